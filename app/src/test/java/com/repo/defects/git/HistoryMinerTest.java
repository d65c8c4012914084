package com.repo.defects.git;

import com.repo.defects.core.PredictorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HistoryMinerTest {

    @TempDir
    Path tempDir;

    private final HistoryMiner miner = new HistoryMiner(PredictorConfig.defaults().withParallelism(2));

    @Test
    void testMergeHistoryCountsMergedFilesAgain() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("a.py", "1\n");
            repo.commit("c1");
            repo.branch("feature");
            repo.write("b.py", "2\n");
            repo.commit("c2");
            repo.checkout("main");
            repo.write("a.py", "3\n").write("c.py", "4\n");
            repo.commit("c3");
            repo.merge("feature");
        }

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertEquals(AggregationResult.Status.COMPLETE, result.status());
        assertEquals(4, result.commitCount());
        assertEquals(Map.of("a.py", 2.0, "b.py", 2.0, "c.py", 1.0), result.changes().counts());
    }

    @Test
    void testSharedAncestryIsCountedOnce() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("a.py", "1\n");
            repo.commit("c1");
            repo.write("a.py", "2\n");
            repo.commit("c2");
            repo.branch("feature");
            repo.write("b.py", "3\n");
            repo.commit("c3");
        }

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertFalse(result.isPartial());
        assertEquals(3, result.commitCount());
        assertEquals(Map.of("a.py", 2.0, "b.py", 1.0), result.changes().counts());
    }

    @Test
    void testBranchSelectorLimitsHistory() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("a.py", "1\n");
            repo.commit("c1");
            repo.branch("feature");
            repo.write("b.py", "2\n");
            repo.commit("c2");
        }

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.branches("main"));

        assertEquals(Map.of("a.py", 1.0), result.changes().counts());
    }

    @Test
    void testEmptyRepositoryIsCompleteAndEmpty() throws Exception {
        GitTestRepository.init(tempDir).close();

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertEquals(AggregationResult.Status.COMPLETE, result.status());
        assertTrue(result.changes().isEmpty());
        assertEquals(0, result.commitCount());
    }

    @Test
    void testBrokenBranchGivesPartialResult() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("a.py", "1\n");
            repo.commit("c1");
            repo.brokenRef("refs/heads/broken", "0123456789abcdef0123456789abcdef01234567");
        }

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertTrue(result.isPartial());
        assertEquals(Map.of("a.py", 1.0), result.changes().counts());
        assertFalse(result.warnings().isEmpty());
    }

    @Test
    void testCorruptBranchDoesNotHideLaterBranches() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("a.py", "1\n");
            repo.commit("c1");
            repo.branch("a-broken");
            repo.write("b.py", "2\n");
            String lost = repo.commit("b1");
            repo.write("b2.py", "3\n");
            repo.commit("b2");
            repo.checkout("main");
            repo.branch("z-feature");
            repo.write("z.py", "4\n");
            repo.commit("z1");
            repo.checkout("main");
            repo.deleteObject(lost);
        }

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertTrue(result.isPartial());
        assertEquals(1.0, result.changes().countOf("a.py"));
        assertEquals(1.0, result.changes().countOf("z.py"));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("refs/heads/a-broken")));
        assertTrue(result.warnings().stream().noneMatch(w -> w.contains("z-feature")));
    }

    @Test
    void testNoUsableHistoryFails() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.brokenRef("refs/heads/broken", "0123456789abcdef0123456789abcdef01234567");
        }

        assertThrows(HistoryTraversalException.class,
                () -> miner.aggregateChangeHistory(tempDir, CommitSelector.all()));
    }

    @Test
    void testMissingRepository() {
        assertThrows(RepositoryAccessException.class,
                () -> miner.aggregateChangeHistory(tempDir.resolve("missing"), CommitSelector.all()));
    }

    @Test
    void testCancelledWalkIsPartial() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("a.py", "1\n");
            repo.commit("c1");
        }
        CancellationToken token = CancellationToken.create();
        token.cancel();

        AggregationResult result = miner.aggregateChangeHistory(tempDir, CommitSelector.all(),
                WeightFunction.unit(), token);

        assertTrue(result.isPartial());
        assertEquals(0, result.commitCount());
        assertTrue(result.changes().isEmpty());
    }

    @Test
    void testFollowRenamesFoldsCountsIntoNewName() throws Exception {
        String content = "alpha\nbeta\ngamma\ndelta\n";
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("old.txt", content);
            repo.commit("add");
            repo.move("old.txt", "new.txt");
            repo.commit("rename");
            repo.write("new.txt", content + "epsilon\n");
            repo.commit("edit");
        }

        AggregationResult plain = miner.aggregateChangeHistory(tempDir, CommitSelector.all());
        HistoryMiner following = new HistoryMiner(PredictorConfig.defaults().withFollowRenames(true));
        AggregationResult renamed = following.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertEquals(Map.of("old.txt", 2.0, "new.txt", 2.0), plain.changes().counts());
        assertEquals(Map.of("new.txt", 3.0), renamed.changes().counts());
    }

    @Test
    void testExclusionsAndSourceOnlyFilter() throws Exception {
        try (GitTestRepository repo = GitTestRepository.init(tempDir)) {
            repo.write("src/App.java", "class App {}\n")
                    .write("README.md", "docs\n")
                    .write("vendor/lib.js", "x\n");
            repo.commit("c1");
        }
        HistoryMiner filtered = new HistoryMiner(PredictorConfig.defaults()
                .withSourceOnly(true)
                .withExclusions(Set.of("vendor/**")));

        AggregationResult result = filtered.aggregateChangeHistory(tempDir, CommitSelector.all());

        assertEquals(Set.of("src/App.java"), result.changes().counts().keySet());
    }

    @Test
    void testConfiguredWeightFunction() {
        Instant now = Instant.parse("2024-01-31T00:00:00Z");
        HistoryMiner decaying = new HistoryMiner(PredictorConfig.defaults().withHalfLifeDays(30));

        WeightFunction weight = decaying.configuredWeightFunction(now);

        Commit old = Commit.of("c", now.minus(Duration.ofDays(30)), Set.of("a"));
        assertEquals(Math.exp(-1), weight.weigh(old), 1e-9);
        assertEquals(1.0, miner.configuredWeightFunction(now).weigh(old));
    }
}
