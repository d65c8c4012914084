package com.repo.defects.git;

import java.util.Iterator;
import java.util.Optional;

/**
 * Lazy, finite sequence of commits. Reading the next commit may touch the
 * repository's object store and therefore fail with a
 * {@link HistoryTraversalException}.
 */
public interface CommitCursor extends AutoCloseable {

    /**
     * @return the next commit, or empty once the sequence is exhausted
     */
    Optional<Commit> next() throws HistoryTraversalException;

    @Override
    default void close() {
    }

    /**
     * Cursor over commits that are already in memory.
     */
    static CommitCursor of(Iterable<Commit> commits) {
        Iterator<Commit> iterator = commits.iterator();
        return () -> iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
    }
}
