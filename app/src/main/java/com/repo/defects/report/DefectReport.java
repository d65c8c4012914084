package com.repo.defects.report;

import com.repo.defects.scoring.RankedEntry;

import java.util.List;

/**
 * Ranked files of one score source, ready to be rendered.
 * A report without entries is a valid "no signal" outcome; a failed run never
 * produces a report at all.
 */
public record DefectReport(
        /** Score source, e.g. "change-history", "static-analysis", "combined" */
        String title,

        /** Number of entries that were requested */
        int requested,

        List<RankedEntry> entries,

        /** True if the underlying data was only partially collected */
        boolean partial,

        List<String> warnings) {

    public DefectReport {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public boolean hasSignal() {
        return !entries.isEmpty();
    }
}
