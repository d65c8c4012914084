package com.repo.defects.git;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative stop signal for long history walks.
 * A token is cancelled either explicitly through {@link #cancel()} or once its
 * deadline has passed. Safe to share between worker threads.
 */
public final class CancellationToken {

    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /** A token that is only cancelled by an explicit {@link #cancel()}. */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            cancelled = true;
        }
        return cancelled;
    }
}
