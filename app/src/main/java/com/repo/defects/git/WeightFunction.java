package com.repo.defects.git;

import java.time.Duration;
import java.time.Instant;

/**
 * Weight of a single commit's contribution to each file it touched.
 */
@FunctionalInterface
public interface WeightFunction {

    double weigh(Commit commit);

    /**
     * Every commit counts 1, which reproduces plain change counting.
     */
    static WeightFunction unit() {
        return commit -> 1.0;
    }

    /**
     * Recency decay: {@code exp(-age / halfLife)}, where age is the time between
     * the commit and {@code now}. Commits dated after {@code now} weigh 1.
     */
    static WeightFunction recencyDecay(Duration halfLife, Instant now) {
        if (halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("Half-life must be positive: " + halfLife);
        }
        double halfLifeSeconds = halfLife.toMillis() / 1000.0;
        return commit -> {
            double ageSeconds = Math.max(0, Duration.between(commit.commitTime(), now).toMillis() / 1000.0);
            return Math.exp(-ageSeconds / halfLifeSeconds);
        };
    }
}
