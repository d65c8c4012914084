package com.repo.defects.git;

import com.repo.defects.core.PredictorConfig;
import org.eclipse.jgit.lib.ObjectId;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Git history miner for change frequency.
 *
 * <p>
 * The selected history is split into disjoint per-branch partitions that are
 * walked concurrently. Every worker builds its own {@link FileChangeRecord};
 * the records are summed on the calling thread once all workers are done.
 * A branch that cannot be walked is dropped with a warning and the result is
 * flagged partial; the branches after it are walked again without excluding
 * its ancestry. Only when no branch at all can be walked does the miner fail.
 */
public class HistoryMiner {

    private final PredictorConfig config;

    public HistoryMiner(PredictorConfig config) {
        this.config = config;
    }

    /**
     * Weight function configured for this run: recency decay when a half-life
     * is set, plain counting otherwise.
     */
    public WeightFunction configuredWeightFunction(Instant now) {
        if (config.getHalfLifeDays() > 0) {
            long halfLifeMillis = Math.round(config.getHalfLifeDays() * 24 * 60 * 60 * 1000);
            return WeightFunction.recencyDecay(Duration.ofMillis(halfLifeMillis), now);
        }
        return WeightFunction.unit();
    }

    /**
     * Cancellation token honoring the configured history timeout.
     */
    public CancellationToken configuredCancellation() {
        if (config.getHistoryTimeoutSeconds() > 0) {
            return CancellationToken.withTimeout(Duration.ofSeconds(config.getHistoryTimeoutSeconds()));
        }
        return CancellationToken.create();
    }

    public AggregationResult aggregateChangeHistory(Path repoRoot, CommitSelector selector)
            throws HistoryMiningException {
        return aggregateChangeHistory(repoRoot, selector, configuredWeightFunction(Instant.now()),
                configuredCancellation());
    }

    /**
     * Count how often every file was changed in the selected history.
     *
     * @throws RepositoryAccessException if the repository cannot be opened
     * @throws HistoryTraversalException if no part of the history can be walked
     */
    public AggregationResult aggregateChangeHistory(Path repoRoot, CommitSelector selector,
            WeightFunction weightFunction, CancellationToken token) throws HistoryMiningException {
        System.out.println("Mining Git history for: " + repoRoot + " (" + selector + ")");
        try (CommitWalker walker = CommitWalker.open(repoRoot, config.isFollowRenames())) {
            return aggregateChangeHistory(walker, selector, weightFunction, token);
        }
    }

    public AggregationResult aggregateChangeHistory(CommitWalker walker, CommitSelector selector,
            WeightFunction weightFunction, CancellationToken token) throws HistoryMiningException {
        CommitWalker.Partitioning partitioning = walker.partition(selector);
        List<HistoryPartition> partitions = partitioning.partitions();
        List<String> warnings = new ArrayList<>(partitioning.warnings());

        if (partitions.isEmpty()) {
            if (!warnings.isEmpty()) {
                throw new HistoryTraversalException("No usable history: " + String.join("; ", warnings));
            }
            System.out.println("Repository has no commits.");
            return new AggregationResult(FileChangeRecord.empty(), AggregationResult.Status.COMPLETE, 0, warnings);
        }

        ChangeAggregator aggregator = new ChangeAggregator(weightFunction, config::isTracked);
        int workers = Math.min(config.getParallelism(), partitions.size());
        System.out.println("Walking " + partitions.size() + " branch partitions with " + workers + " workers...");

        FileChangeRecord total = FileChangeRecord.empty();
        int commits = 0;
        int failed = 0;
        boolean cancelled = false;

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<HistoryPartition> pending = partitions;
            while (!pending.isEmpty()) {
                List<Future<ChangeAggregator.Aggregation>> futures = new ArrayList<>();
                for (HistoryPartition partition : pending) {
                    futures.add(executor.submit(() -> {
                        try (CommitCursor cursor = walker.walk(partition)) {
                            return aggregator.aggregate(cursor, token);
                        }
                    }));
                }

                List<HistoryPartition> retry = List.of();
                for (int i = 0; i < futures.size(); i++) {
                    HistoryPartition partition = pending.get(i);
                    try {
                        ChangeAggregator.Aggregation aggregation = futures.get(i).get();
                        total = total.merge(aggregation.changes());
                        commits += aggregation.commits();
                        cancelled |= aggregation.cancelled();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        token.cancel();
                        cancelled = true;
                        warnings.add("Interrupted while waiting for " + partition.name());
                        break;
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause();
                        if (cause instanceof Error) {
                            throw (Error) cause;
                        }
                        failed++;
                        warnings.add("Skipped " + partition.name() + ": " + cause.getMessage());
                        System.err.println("Warning: could not walk " + partition.name() + ": " + cause.getMessage());
                        // later partitions excluded this head's ancestry: walk them again without it
                        retry = withoutHead(pending.subList(i + 1, pending.size()), partition.head());
                        futures.subList(i + 1, futures.size()).forEach(f -> f.cancel(false));
                        break;
                    }
                }
                pending = retry;
            }
        } finally {
            executor.shutdownNow();
        }

        if (failed == partitions.size()) {
            throw new HistoryTraversalException("No usable history: " + String.join("; ", warnings));
        }
        if (cancelled) {
            warnings.add("History walk cancelled after " + commits + " commits");
        }
        if (config.isFollowRenames()) {
            total = total.resolveRenames();
        }

        System.out.println("Aggregated " + commits + " commits touching " + total.size() + " files.");
        AggregationResult.Status status = cancelled || failed > 0 || !warnings.isEmpty()
                ? AggregationResult.Status.PARTIAL
                : AggregationResult.Status.COMPLETE;
        return new AggregationResult(total, status, commits, warnings);
    }

    private static List<HistoryPartition> withoutHead(List<HistoryPartition> partitions, ObjectId head) {
        List<HistoryPartition> rebuilt = new ArrayList<>(partitions.size());
        for (HistoryPartition partition : partitions) {
            rebuilt.add(partition.withoutExcluded(head));
        }
        return rebuilt;
    }
}
