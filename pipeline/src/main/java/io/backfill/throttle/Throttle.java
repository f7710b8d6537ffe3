package io.backfill.throttle;

import io.backfill.core.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Blocking request gate that keeps a minimum wall-clock spacing between the <em>start</em> of consecutive
 * requests, no matter how long (or how briefly) each request ran. One instance is shared by every caller
 * that talks to the same upstream.
 * <p>
 * {@link #acquire()} never throws. If the waiting thread is interrupted the interrupt flag is restored and
 * the gate opens early.
 */
public class Throttle {
    public static final Duration DEFAULT_SPACING = Duration.ofSeconds(3);

    private final long spacingNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private long nextAvailableNanos;
    private boolean started = false;
    private long acquisitions = 0;

    public Throttle(Duration spacing) { this(spacing, System::nanoTime, Sleeper.system()); }

    public Throttle(Duration spacing, LongSupplier nanoClock, Sleeper sleeper) {
        if (spacing.isNegative()) throw new IllegalArgumentException("negative spacing: " + spacing);
        this.spacingNanos = spacing.toNanos();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public synchronized void acquire() {
        long now = nanoClock.getAsLong();
        if (started) {
            while (now - nextAvailableNanos < 0) {
                try {
                    sleeper.sleep(Duration.ofNanos(nextAvailableNanos - now));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                now = nanoClock.getAsLong();
            }
        }
        // spacing is measured from the moment the caller is released, not from the scheduled slot
        nextAvailableNanos = now + spacingNanos;
        started = true;
        acquisitions++;
    }

    public Duration spacing() { return Duration.ofNanos(spacingNanos); }

    public synchronized long acquisitions() { return acquisitions; }
}
