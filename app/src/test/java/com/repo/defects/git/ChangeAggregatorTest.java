package com.repo.defects.git;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChangeAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ChangeAggregator aggregator = new ChangeAggregator();

    @Test
    void testCountsEveryTouchOfAFile() {
        List<Commit> commits = List.of(
                Commit.of("c1", T0, Set.of("a.py")),
                Commit.of("c2", T0, Set.of("a.py", "b.py")),
                Commit.of("c3", T0, Set.of("b.py")));

        FileChangeRecord record = aggregator.aggregate(commits);

        assertEquals(Map.of("a.py", 2.0, "b.py", 2.0), record.counts());
    }

    @Test
    void testZeroCommitsGiveEmptyRecord() {
        assertTrue(aggregator.aggregate(List.of()).isEmpty());
    }

    @Test
    void testCommitWithoutFilesIsNoOp() {
        FileChangeRecord record = aggregator.aggregate(List.of(Commit.of("empty", T0, Set.of())));

        assertTrue(record.isEmpty());
        assertEquals(0, record.size());
    }

    @Test
    void testOrderIndependence() {
        List<Commit> commits = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            commits.add(Commit.of("c" + i, T0.plusSeconds(i),
                    Set.of("src/f" + (i % 7) + ".c", "src/g" + (i % 3) + ".h")));
        }
        FileChangeRecord expected = aggregator.aggregate(commits);

        Random random = new Random(42);
        for (int round = 0; round < 5; round++) {
            List<Commit> shuffled = new ArrayList<>(commits);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, aggregator.aggregate(shuffled));
        }
    }

    @Test
    void testPathFilterSkipsExcludedFiles() {
        ChangeAggregator onlyJava = new ChangeAggregator(WeightFunction.unit(), p -> p.endsWith(".java"));

        FileChangeRecord record = onlyJava.aggregate(List.of(
                Commit.of("c1", T0, Set.of("A.java", "README.md"))));

        assertEquals(Set.of("A.java"), record.counts().keySet());
    }

    @Test
    void testRecencyWeighting() {
        Instant now = T0.plus(Duration.ofDays(10));
        ChangeAggregator decayed = new ChangeAggregator(WeightFunction.recencyDecay(Duration.ofDays(10), now));

        FileChangeRecord record = decayed.aggregate(List.of(
                Commit.of("old", T0, Set.of("a.py")),
                Commit.of("new", now, Set.of("b.py"))));

        assertEquals(Math.exp(-1), record.countOf("a.py"), 1e-12);
        assertEquals(1.0, record.countOf("b.py"), 1e-12);
    }

    @Test
    void testNegativeWeightIsRejected() {
        ChangeAggregator broken = new ChangeAggregator(commit -> -1.0);

        assertThrows(IllegalArgumentException.class,
                () -> broken.aggregate(List.of(Commit.of("c1", T0, Set.of("a.py")))));
    }

    @Test
    void testCursorAggregationCountsCommits() throws HistoryTraversalException {
        List<Commit> commits = List.of(
                Commit.of("c1", T0, Set.of("a.py")),
                Commit.of("c2", T0, Set.of()));

        ChangeAggregator.Aggregation aggregation = aggregator.aggregate(CommitCursor.of(commits),
                CancellationToken.create());

        assertEquals(2, aggregation.commits());
        assertFalse(aggregation.cancelled());
        assertEquals(1.0, aggregation.changes().countOf("a.py"));
    }

    @Test
    void testCancellationStopsAndFlagsPartial() throws HistoryTraversalException {
        CancellationToken token = CancellationToken.create();
        List<Commit> commits = List.of(
                Commit.of("c1", T0, Set.of("a.py")),
                Commit.of("c2", T0, Set.of("b.py")),
                Commit.of("c3", T0, Set.of("c.py")));
        CommitCursor cursor = CommitCursor.of(commits);
        // cancel as soon as the first commit has been handed out
        CommitCursor cancelling = () -> {
            var next = cursor.next();
            token.cancel();
            return next;
        };

        ChangeAggregator.Aggregation aggregation = aggregator.aggregate(cancelling, token);

        assertTrue(aggregation.cancelled());
        assertEquals(1, aggregation.commits());
        assertEquals(Map.of("a.py", 1.0), aggregation.changes().counts());
    }

    @Test
    void testRenamesAreRecordedWithCommitTime() {
        Commit rename = new Commit("c1", List.of("c0"), Set.of("new.py"), Map.of("old.py", "new.py"), T0, "dev");

        FileChangeRecord record = aggregator.aggregate(List.of(rename));

        assertEquals(new FileChangeRecord.RenameEdge("new.py", T0), record.renames().get("old.py"));
    }
}
