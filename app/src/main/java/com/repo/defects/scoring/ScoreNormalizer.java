package com.repo.defects.scoring;

import com.repo.defects.core.ScoreMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns raw per-file values into probability-like scores and combines scores
 * coming from different sources.
 *
 * <p>
 * Change counts, static analysis findings and simulated model output all go
 * through the same {@link #normalize} so they can be blended with each other.
 */
public class ScoreNormalizer {

    /**
     * Scale the values so they sum to 1. A zero total (empty input or only zero
     * values) means there is no signal and yields an empty map.
     */
    public ScoreMap normalize(ScoreMap raw) {
        double total = raw.total();
        if (total == 0) {
            return ScoreMap.empty();
        }
        Map<String, Double> scores = new TreeMap<>();
        raw.asMap().forEach((path, value) -> scores.put(path, value / total));
        return ScoreMap.of(scores);
    }

    /**
     * Weighted linear combination {@code weight * a + (1 - weight) * b}, where a
     * path missing from one side counts as 0 there. An empty input carries no
     * signal, so the other map is returned as is.
     *
     * @throws IllegalArgumentException if the weight is outside [0, 1] or an
     *                                  input is not normalized
     */
    public ScoreMap blend(ScoreMap a, ScoreMap b, double weight) {
        if (Double.isNaN(weight) || weight < 0 || weight > 1) {
            throw new IllegalArgumentException("Blend weight must be within [0, 1]: " + weight);
        }
        requireNormalized(a, "first");
        requireNormalized(b, "second");
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }

        SortedSet<String> paths = new TreeSet<>(a.paths());
        paths.addAll(b.paths());
        Map<String, Double> blended = new TreeMap<>();
        for (String path : paths) {
            blended.put(path, weight * a.get(path) + (1 - weight) * b.get(path));
        }
        return ScoreMap.of(blended);
    }

    /**
     * Equal-weight mean of several normalized score maps. Empty maps carry no
     * signal and do not take a share of the weight.
     *
     * @throws IllegalArgumentException if an input is not normalized
     */
    public ScoreMap average(List<ScoreMap> sources) {
        List<ScoreMap> signals = new ArrayList<>();
        for (ScoreMap source : sources) {
            requireNormalized(source, "averaged");
            if (!source.isEmpty()) {
                signals.add(source);
            }
        }
        if (signals.size() <= 1) {
            return signals.isEmpty() ? ScoreMap.empty() : signals.get(0);
        }

        Map<String, Double> mean = new TreeMap<>();
        for (ScoreMap signal : signals) {
            signal.asMap().forEach((path, score) -> mean.merge(path, score / signals.size(), Double::sum));
        }
        return ScoreMap.of(mean);
    }

    private void requireNormalized(ScoreMap scores, String position) {
        if (!scores.isNormalized()) {
            throw new IllegalArgumentException(
                    "The " + position + " score map is not normalized (total " + scores.total() + ")");
        }
    }
}
