package io.backfill.retry;

public interface RetryPolicy {
    /**
     * @param attempt number of attempts already made for the unit of work, starting at 1
     * @param errorClass classification of the failure of that attempt
     */
    RetryDecision decide(int attempt, ErrorClass errorClass);
}
