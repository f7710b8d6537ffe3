package io.backfill.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Work loops consult it between units of work; nothing in flight is preempted.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }
}
