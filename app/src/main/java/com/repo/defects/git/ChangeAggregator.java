package com.repo.defects.git;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Turns a sequence of commits into per-file change counts.
 *
 * <p>
 * Each touched path that passes the path filter is incremented by the commit's
 * weight. Increments commute, so the same commits in any order produce the same
 * record.
 */
public class ChangeAggregator {

    /**
     * Outcome of aggregating one commit sequence.
     *
     * @param changes   the counts collected so far
     * @param commits   number of commits consumed
     * @param cancelled true if the walk stopped early because of cancellation
     */
    public record Aggregation(FileChangeRecord changes, int commits, boolean cancelled) {
    }

    private final WeightFunction weightFunction;
    private final Predicate<String> pathFilter;

    public ChangeAggregator() {
        this(WeightFunction.unit(), path -> true);
    }

    public ChangeAggregator(WeightFunction weightFunction) {
        this(weightFunction, path -> true);
    }

    public ChangeAggregator(WeightFunction weightFunction, Predicate<String> pathFilter) {
        this.weightFunction = weightFunction;
        this.pathFilter = pathFilter;
    }

    /**
     * Aggregate commits that are already in memory.
     */
    public FileChangeRecord aggregate(Iterable<Commit> commits) {
        FileChangeRecord.Builder builder = FileChangeRecord.builder();
        for (Commit commit : commits) {
            accumulate(builder, commit);
        }
        return builder.build();
    }

    /**
     * Drain a cursor, stopping early if the token is cancelled.
     *
     * @throws HistoryTraversalException if the cursor cannot read the history
     */
    public Aggregation aggregate(CommitCursor cursor, CancellationToken token) throws HistoryTraversalException {
        FileChangeRecord.Builder builder = FileChangeRecord.builder();
        int commits = 0;
        while (true) {
            if (token.isCancelled()) {
                return new Aggregation(builder.build(), commits, true);
            }
            Optional<Commit> next = cursor.next();
            if (next.isEmpty()) {
                return new Aggregation(builder.build(), commits, false);
            }
            accumulate(builder, next.get());
            commits++;
        }
    }

    private void accumulate(FileChangeRecord.Builder builder, Commit commit) {
        if (commit.touchedFiles().isEmpty()) {
            return;
        }
        double weight = weightFunction.weigh(commit);
        for (String path : commit.touchedFiles()) {
            if (pathFilter.test(path)) {
                builder.increment(path, weight);
            }
        }
        commit.renames().forEach((oldPath, newPath) -> {
            if (pathFilter.test(newPath)) {
                builder.recordRename(oldPath, newPath, commit.commitTime());
            }
        });
    }
}
