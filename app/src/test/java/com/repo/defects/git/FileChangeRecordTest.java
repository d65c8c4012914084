package com.repo.defects.git;

import com.repo.defects.core.ScoreMap;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileChangeRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testMergeSumsCounts() {
        FileChangeRecord left = FileChangeRecord.builder().increment("a").increment("b").build();
        FileChangeRecord right = FileChangeRecord.builder().increment("b").increment("c", 2.5).build();

        FileChangeRecord merged = left.merge(right);

        assertEquals(Map.of("a", 1.0, "b", 2.0, "c", 2.5), merged.counts());
        assertEquals(1.0, left.countOf("b"), "inputs stay untouched");
    }

    @Test
    void testMergeIsAssociativeAndCommutative() {
        FileChangeRecord a = FileChangeRecord.builder().increment("x").recordRename("o", "x", T0).build();
        FileChangeRecord b = FileChangeRecord.builder().increment("y", 3).build();
        FileChangeRecord c = FileChangeRecord.builder().increment("x").recordRename("o", "z", T0.plusSeconds(1))
                .build();

        assertEquals(a.merge(b).merge(c), a.merge(b.merge(c)));
        assertEquals(a.merge(c), c.merge(a));
        assertEquals("z", a.merge(c).renames().get("o").target(), "the later rename wins");
    }

    @Test
    void testEmptyMergeIsIdentity() {
        FileChangeRecord a = FileChangeRecord.builder().increment("x").build();

        assertSame(a, a.merge(FileChangeRecord.empty()));
        assertSame(a, FileChangeRecord.empty().merge(a));
    }

    @Test
    void testResolveRenamesFollowsChains() {
        FileChangeRecord record = FileChangeRecord.builder()
                .increment("v1.py", 2)
                .increment("v2.py", 1)
                .increment("v3.py", 4)
                .increment("other.py")
                .recordRename("v1.py", "v2.py", T0)
                .recordRename("v2.py", "v3.py", T0.plusSeconds(60))
                .build();

        FileChangeRecord resolved = record.resolveRenames();

        assertEquals(Map.of("v3.py", 7.0, "other.py", 1.0), resolved.counts());
        assertTrue(resolved.renames().isEmpty());
        assertEquals(record.totalChanges(), resolved.totalChanges(), 1e-12);
    }

    @Test
    void testRenameCycleResolvesToLatestName() {
        FileChangeRecord record = FileChangeRecord.builder()
                .increment("a")
                .increment("b")
                .recordRename("a", "b", T0)
                .recordRename("b", "a", T0.plusSeconds(1))
                .build();

        FileChangeRecord resolved = record.resolveRenames();

        assertEquals(Map.of("a", 2.0), resolved.counts());
        assertEquals("a", record.canonicalPath("b"));
    }

    @Test
    void testPathLeadingIntoCycleJoinsIt() {
        FileChangeRecord record = FileChangeRecord.builder()
                .increment("start")
                .increment("x")
                .increment("y")
                .recordRename("start", "x", T0)
                .recordRename("x", "y", T0.plusSeconds(5))
                .recordRename("y", "x", T0.plusSeconds(9))
                .build();

        assertEquals(Map.of("x", 3.0), record.resolveRenames().counts());
    }

    @Test
    void testToScoreMapKeepsRawCounts() {
        FileChangeRecord record = FileChangeRecord.builder().increment("a").increment("a").build();

        assertEquals(ScoreMap.of(Map.of("a", 2.0)), record.toScoreMap());
    }

    @Test
    void testBuilderRejectsInvalidWeights() {
        FileChangeRecord.Builder builder = FileChangeRecord.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.increment("a", -0.5));
        assertThrows(IllegalArgumentException.class, () -> builder.increment("a", Double.NaN));
    }
}
