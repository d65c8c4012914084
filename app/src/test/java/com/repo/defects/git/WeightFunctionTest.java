package com.repo.defects.git;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WeightFunctionTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    void testUnitWeight() {
        assertEquals(1.0, WeightFunction.unit().weigh(Commit.of("c", NOW.minusSeconds(999_999), Set.of())));
    }

    @Test
    void testRecencyDecayFollowsExponential() {
        WeightFunction decay = WeightFunction.recencyDecay(Duration.ofDays(30), NOW);

        assertEquals(1.0, decay.weigh(Commit.of("now", NOW, Set.of())), 1e-12);
        assertEquals(Math.exp(-2), decay.weigh(Commit.of("old", NOW.minus(Duration.ofDays(60)), Set.of())), 1e-12);
    }

    @Test
    void testFutureCommitsWeighOne() {
        WeightFunction decay = WeightFunction.recencyDecay(Duration.ofDays(1), NOW);

        assertEquals(1.0, decay.weigh(Commit.of("future", NOW.plusSeconds(3600), Set.of())), 1e-12);
    }

    @Test
    void testHalfLifeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> WeightFunction.recencyDecay(Duration.ZERO, NOW));
    }
}
