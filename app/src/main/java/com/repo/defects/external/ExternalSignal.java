package com.repo.defects.external;

import com.repo.defects.core.ScoreMap;

import java.util.List;

/**
 * Static analysis findings translated into raw per-file scores.
 *
 * @param rawScores   finding count (or severity sum) per file; files without
 *                    findings are omitted
 * @param warnings    failed tool runs
 * @param invocations number of tool runs attempted
 */
public record ExternalSignal(ScoreMap rawScores, List<ToolWarning> warnings, int invocations) {

    public ExternalSignal {
        warnings = List.copyOf(warnings);
    }

    public static ExternalSignal none() {
        return new ExternalSignal(ScoreMap.empty(), List.of(), 0);
    }
}
