package com.repo.defects.git;

import com.repo.defects.core.ScoreMap;

import java.time.Instant;
import java.util.*;

/**
 * Immutable per-file change counts produced by one aggregation pass.
 *
 * <p>
 * Records built by independent workers are combined with {@link #merge}, which
 * sums counts and is associative and commutative, so the reduction order never
 * changes the result. Rename edges observed during the walk are kept next to
 * the counts and applied by {@link #resolveRenames()}.
 */
public final class FileChangeRecord {

    /**
     * A path was renamed to {@code target} by a commit made at {@code when}.
     */
    public record RenameEdge(String target, Instant when) {

        /** Later renames win; ties go to the lexicographically greater target. */
        RenameEdge latest(RenameEdge other) {
            int byTime = when.compareTo(other.when);
            if (byTime != 0) {
                return byTime > 0 ? this : other;
            }
            return target.compareTo(other.target) >= 0 ? this : other;
        }
    }

    private static final FileChangeRecord EMPTY = new FileChangeRecord(new TreeMap<>(), new TreeMap<>());

    private final SortedMap<String, Double> counts;
    private final SortedMap<String, RenameEdge> renames;

    private FileChangeRecord(SortedMap<String, Double> counts, SortedMap<String, RenameEdge> renames) {
        this.counts = Collections.unmodifiableSortedMap(counts);
        this.renames = Collections.unmodifiableSortedMap(renames);
    }

    public static FileChangeRecord empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double countOf(String path) {
        return counts.getOrDefault(path, 0.0);
    }

    /** Change counts sorted by path. */
    public SortedMap<String, Double> counts() {
        return counts;
    }

    /** Rename edges, old path to latest new path. */
    public SortedMap<String, RenameEdge> renames() {
        return renames;
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public double totalChanges() {
        double total = 0;
        for (double count : counts.values()) {
            total += count;
        }
        return total;
    }

    /**
     * Sum this record with another one. Neither input is modified.
     */
    public FileChangeRecord merge(FileChangeRecord other) {
        if (other.isEmpty() && other.renames.isEmpty()) {
            return this;
        }
        if (isEmpty() && renames.isEmpty()) {
            return other;
        }
        SortedMap<String, Double> mergedCounts = new TreeMap<>(counts);
        other.counts.forEach((path, count) -> mergedCounts.merge(path, count, Double::sum));

        SortedMap<String, RenameEdge> mergedRenames = new TreeMap<>(renames);
        other.renames.forEach((path, edge) -> mergedRenames.merge(path, edge, RenameEdge::latest));

        return new FileChangeRecord(mergedCounts, mergedRenames);
    }

    /**
     * Fold the counts of every renamed path into its canonical identity, the
     * last name reachable through the rename edges. Every path on a rename
     * cycle ends up at the target of the cycle's latest edge.
     */
    public FileChangeRecord resolveRenames() {
        if (renames.isEmpty()) {
            return this;
        }
        SortedMap<String, Double> resolved = new TreeMap<>();
        counts.forEach((path, count) -> resolved.merge(canonicalPath(path), count, Double::sum));
        return new FileChangeRecord(resolved, new TreeMap<>());
    }

    /**
     * The name the given path ends up with after following all rename edges.
     */
    public String canonicalPath(String path) {
        List<String> chain = new ArrayList<>();
        Map<String, Integer> position = new HashMap<>();
        String current = path;
        while (renames.containsKey(current)) {
            Integer seen = position.get(current);
            if (seen != null) {
                return latestTarget(chain.subList(seen, chain.size()));
            }
            position.put(current, chain.size());
            chain.add(current);
            current = renames.get(current).target();
        }
        return current;
    }

    private String latestTarget(List<String> cycle) {
        RenameEdge latest = renames.get(cycle.get(0));
        for (String path : cycle) {
            latest = latest.latest(renames.get(path));
        }
        return latest.target();
    }

    /**
     * Raw (not normalized) scores: one entry per path with its change count.
     */
    public ScoreMap toScoreMap() {
        return ScoreMap.of(counts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FileChangeRecord))
            return false;
        FileChangeRecord that = (FileChangeRecord) o;
        return counts.equals(that.counts) && renames.equals(that.renames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts, renames);
    }

    @Override
    public String toString() {
        return "FileChangeRecord" + counts;
    }

    /**
     * Mutable, single-threaded accumulator owned by one worker. Counters can
     * only grow.
     */
    public static final class Builder {

        private final SortedMap<String, Double> counts = new TreeMap<>();
        private final SortedMap<String, RenameEdge> renames = new TreeMap<>();

        private Builder() {
        }

        public Builder increment(String path, double weight) {
            if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
                throw new IllegalArgumentException("Change weight must be finite and non-negative: " + weight);
            }
            counts.merge(path, weight, Double::sum);
            return this;
        }

        public Builder increment(String path) {
            return increment(path, 1.0);
        }

        public Builder recordRename(String oldPath, String newPath, Instant when) {
            if (!oldPath.equals(newPath)) {
                renames.merge(oldPath, new RenameEdge(newPath, when), RenameEdge::latest);
            }
            return this;
        }

        public FileChangeRecord build() {
            if (counts.isEmpty() && renames.isEmpty()) {
                return EMPTY;
            }
            return new FileChangeRecord(new TreeMap<>(counts), new TreeMap<>(renames));
        }
    }
}
