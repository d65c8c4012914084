package com.repo.defects.scoring;

import com.repo.defects.core.ScoreMap;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RankReporterTest {

    private final RankReporter reporter = new RankReporter();

    @Test
    void testOrdersByScoreDescending() {
        ScoreMap scores = ScoreMap.of(Map.of("low.py", 0.1, "high.py", 0.6, "mid.py", 0.3));

        List<RankedEntry> top = reporter.topN(scores, 2);

        assertEquals(List.of(
                new RankedEntry("high.py", 0.6, 1),
                new RankedEntry("mid.py", 0.3, 2)), top);
    }

    @Test
    void testTiesAreOrderedByPath() {
        ScoreMap scores = ScoreMap.of(Map.of("b.py", 0.25, "a.py", 0.25, "d.py", 0.25, "c.py", 0.25));

        List<RankedEntry> top = reporter.topN(scores, 4);

        assertEquals(List.of("a.py", "b.py", "c.py", "d.py"), top.stream().map(RankedEntry::path).toList());
        assertEquals(List.of(1, 2, 3, 4), top.stream().map(RankedEntry::rank).toList());
    }

    @Test
    void testRequestLargerThanMapReturnsEverything() {
        ScoreMap scores = ScoreMap.of(Map.of("a", 0.5, "b", 0.5));

        assertEquals(2, reporter.topN(scores, 100).size());
    }

    @Test
    void testEmptyMapGivesEmptyReport() {
        assertTrue(reporter.topN(ScoreMap.empty(), 10).isEmpty());
    }

    @Test
    void testNonPositiveSizeIsRejected() {
        ScoreMap scores = ScoreMap.of(Map.of("a", 1.0));

        assertThrows(IllegalArgumentException.class, () -> reporter.topN(scores, 0));
        assertThrows(IllegalArgumentException.class, () -> reporter.topN(scores, -3));
    }

    @Test
    void testRepeatedCallsAgree() {
        ScoreMap scores = ScoreMap.of(Map.of("x", 0.2, "y", 0.2, "z", 0.6));

        assertEquals(reporter.topN(scores, 3), reporter.topN(scores, 3));
    }
}
