package io.backfill.retry;

import java.time.Duration;

/**
 * Retries transient failures up to {@code maxRetries} times, waiting {@code step * attempt} before each retry
 * (3s, 6s, ... for the default step). Terminal failures are never retried.
 */
public class LinearBackoffRetryPolicy implements RetryPolicy {
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_STEP = Duration.ofSeconds(3);

    private final int maxRetries;
    private final Duration step;

    public LinearBackoffRetryPolicy() { this(DEFAULT_MAX_RETRIES, DEFAULT_STEP); }

    public LinearBackoffRetryPolicy(int maxRetries, Duration step) {
        if (step.isNegative()) throw new IllegalArgumentException("negative step: " + step);
        this.maxRetries = Math.max(0, maxRetries);
        this.step = step;
    }

    @Override
    public RetryDecision decide(int attempt, ErrorClass errorClass) {
        if (errorClass == ErrorClass.TERMINAL) return RetryDecision.giveUp();
        if (attempt > maxRetries) return RetryDecision.giveUp();
        return RetryDecision.retryAfter(step.multipliedBy(Math.max(1, attempt)));
    }
}
