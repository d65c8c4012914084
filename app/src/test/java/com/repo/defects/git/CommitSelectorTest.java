package com.repo.defects.git;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitSelectorTest {

    @Test
    void testParseRange() {
        CommitSelector selector = CommitSelector.parseRange("v1.0..main");

        assertEquals(CommitSelector.Kind.RANGE, selector.kind());
        assertEquals("v1.0", selector.from());
        assertEquals("main", selector.to());
        assertEquals("v1.0..main", selector.toString());
    }

    @Test
    void testInvalidSelectors() {
        assertThrows(IllegalArgumentException.class, () -> CommitSelector.parseRange("main"));
        assertThrows(IllegalArgumentException.class, () -> CommitSelector.parseRange("..main"));
        assertThrows(IllegalArgumentException.class, () -> CommitSelector.branches(new String[0]));
    }

    @Test
    void testBranches() {
        CommitSelector selector = CommitSelector.branches("main", "develop");

        assertEquals(List.of("main", "develop"), selector.branches());
        assertEquals("--all", CommitSelector.all().toString());
    }
}
