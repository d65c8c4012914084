package com.repo.defects.scoring;

import com.repo.defects.core.ScoreMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders files by score and cuts the list to the requested size.
 * Equal scores are ordered by path so identical input always yields an
 * identical report.
 */
public class RankReporter {

    private static final Comparator<Map.Entry<String, Double>> BY_SCORE_THEN_PATH = Comparator
            .comparing((Map.Entry<String, Double> e) -> e.getValue(), Comparator.reverseOrder())
            .thenComparing(Map.Entry::getKey);

    /**
     * @param n maximum number of entries; larger than the map returns everything
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public List<RankedEntry> topN(ScoreMap scores, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("Report size must be positive: " + n);
        }
        List<Map.Entry<String, Double>> sorted = scores.asMap().entrySet().stream()
                .sorted(BY_SCORE_THEN_PATH)
                .limit(n)
                .toList();

        List<RankedEntry> report = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Map.Entry<String, Double> entry = sorted.get(i);
            report.add(new RankedEntry(entry.getKey(), entry.getValue(), i + 1));
        }
        return List.copyOf(report);
    }
}
