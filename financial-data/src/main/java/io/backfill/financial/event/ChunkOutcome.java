package io.backfill.financial.event;

public enum ChunkOutcome {
    SUCCEEDED,
    FAILED_TRANSIENT,
    FAILED_TERMINAL
}
