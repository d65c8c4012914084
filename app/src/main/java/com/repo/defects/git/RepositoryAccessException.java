package com.repo.defects.git;

/**
 * The repository path does not exist, is not a Git repository or cannot be
 * read at all. No partial result is possible.
 */
public class RepositoryAccessException extends HistoryMiningException {

    private static final long serialVersionUID = 1L;

    public RepositoryAccessException(String message) {
        super(message);
    }

    public RepositoryAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
