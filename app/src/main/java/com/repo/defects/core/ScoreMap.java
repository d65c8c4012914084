package com.repo.defects.core;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable mapping from file path to a non-negative score.
 * Keys are kept in ascending path order so iteration (and therefore every
 * sum taken over the map) is reproducible across runs.
 *
 * <p>
 * A map is <em>normalized</em> when its values sum to 1.0 within
 * {@link #TOLERANCE}. The empty map is valid and means "no signal".
 */
public final class ScoreMap {

    /** Tolerance used when checking that a map sums to 1. */
    public static final double TOLERANCE = 1e-9;

    private static final ScoreMap EMPTY = new ScoreMap(new TreeMap<>());

    private final SortedMap<String, Double> scores;

    private ScoreMap(SortedMap<String, Double> scores) {
        this.scores = Collections.unmodifiableSortedMap(scores);
    }

    public static ScoreMap empty() {
        return EMPTY;
    }

    /**
     * Copy the given values into a new score map.
     *
     * @throws IllegalArgumentException if a key is null or a value is negative,
     *                                  NaN or infinite
     */
    public static ScoreMap of(Map<String, ? extends Number> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        SortedMap<String, Double> copy = new TreeMap<>();
        for (Map.Entry<String, ? extends Number> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Score map keys must not be null");
            }
            double value = entry.getValue().doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                throw new IllegalArgumentException(
                        "Score for '" + entry.getKey() + "' must be a finite, non-negative number: " + value);
            }
            copy.put(entry.getKey(), value);
        }
        return new ScoreMap(copy);
    }

    public double get(String path) {
        return scores.getOrDefault(path, 0.0);
    }

    public boolean contains(String path) {
        return scores.containsKey(path);
    }

    public Set<String> paths() {
        return scores.keySet();
    }

    /** Read-only view, sorted by path. */
    public SortedMap<String, Double> asMap() {
        return scores;
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public double total() {
        double total = 0;
        for (double value : scores.values()) {
            total += value;
        }
        return total;
    }

    /**
     * True if the map is empty or its values sum to 1 within {@link #TOLERANCE}.
     */
    public boolean isNormalized() {
        return isEmpty() || Math.abs(total() - 1.0) <= TOLERANCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoreMap))
            return false;
        return scores.equals(((ScoreMap) o).scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "ScoreMap" + scores;
    }
}
