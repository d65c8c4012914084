package com.repo.defects.git;

/**
 * Base class of all failures reading repository history.
 */
public class HistoryMiningException extends Exception {

    private static final long serialVersionUID = 1L;

    public HistoryMiningException(String message) {
        super(message);
    }

    public HistoryMiningException(String message, Throwable cause) {
        super(message, cause);
    }
}
