package io.backfill.retry;

/**
 * Coarse classification of a failed request as seen by a {@link RetryPolicy}.
 */
public enum ErrorClass {
    /** A later attempt may succeed (timeouts, congestion, dropped connections). */
    TRANSIENT,
    /** The request can never succeed as issued. */
    TERMINAL
}
