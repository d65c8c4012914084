package com.repo.defects.git;

import java.util.List;

/**
 * Result of mining a repository's change history.
 * A {@link Status#PARTIAL} result still carries every count that could be
 * collected; the warnings say what is missing.
 */
public record AggregationResult(
        FileChangeRecord changes,
        Status status,
        int commitCount,
        List<String> warnings) {

    public enum Status {
        /** Every selected commit was aggregated */
        COMPLETE,
        /** Cancelled, timed out, or at least one branch could not be walked */
        PARTIAL
    }

    public AggregationResult {
        warnings = List.copyOf(warnings);
    }

    public boolean isPartial() {
        return status == Status.PARTIAL;
    }
}
