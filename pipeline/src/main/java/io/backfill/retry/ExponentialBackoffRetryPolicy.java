package io.backfill.retry;

import java.time.Duration;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, long maxMillis) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    @Override
    public RetryDecision decide(int attempt, ErrorClass errorClass) {
        if (errorClass == ErrorClass.TERMINAL || attempt > maxRetries) return RetryDecision.giveUp();
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return RetryDecision.retryAfter(Duration.ofMillis(Math.min(delay, maxMillis)));
    }
}
