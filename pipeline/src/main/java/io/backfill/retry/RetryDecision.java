package io.backfill.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a {@link RetryPolicy} consultation: either retry after {@link #delay()} or give up.
 */
public record RetryDecision(boolean retry, Duration delay) {
    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("negative delay: " + delay);
    }

    public static RetryDecision retryAfter(Duration delay) { return new RetryDecision(true, delay); }

    public static RetryDecision giveUp() { return GIVE_UP; }
}
