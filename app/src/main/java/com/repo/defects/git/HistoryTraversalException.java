package com.repo.defects.git;

/**
 * The object store reported inconsistent history while walking a branch,
 * e.g. a missing parent commit or a ref that points to something other than a
 * commit.
 */
public class HistoryTraversalException extends HistoryMiningException {

    private static final long serialVersionUID = 1L;

    public HistoryTraversalException(String message) {
        super(message);
    }

    public HistoryTraversalException(String message, Throwable cause) {
        super(message, cause);
    }
}
