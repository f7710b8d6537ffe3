package io.backfill.core;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause, injectable so that pacing and backoff can be driven by a manual clock in tests.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> {
            if (d.isZero() || d.isNegative()) return;
            TimeUnit.NANOSECONDS.sleep(d.toNanos());
        };
    }
}
