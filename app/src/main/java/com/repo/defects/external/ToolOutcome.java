package com.repo.defects.external;

import java.util.Optional;

/**
 * Raw score one tool run contributes to one file.
 */
public record ToolOutcome(String file, double rawScore, Optional<ToolWarning> warning) {

    public static ToolOutcome findings(String file, double rawScore) {
        return new ToolOutcome(file, rawScore, Optional.empty());
    }

    public static ToolOutcome failed(String tool, String file, String reason) {
        return new ToolOutcome(file, 0, Optional.of(new ToolWarning(tool, file, reason)));
    }
}
