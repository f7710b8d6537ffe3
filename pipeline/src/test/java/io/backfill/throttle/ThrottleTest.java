package io.backfill.throttle;

import io.backfill.core.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class ThrottleTest {
    @Test
    void spaces_consecutive_starts_in_wall_clock_time() {
        Throttle throttle = new Throttle(Duration.ofMillis(100));
        List<Long> starts = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            throttle.acquire();
            starts.add(System.nanoTime());
            // requests that fail fast must not shorten the spacing
        }
        for (int i = 1; i < starts.size(); i++) {
            long dtMs = (starts.get(i) - starts.get(i - 1)) / 1_000_000;
            // Allow some slack in CI; expect at least ~90ms spacing
            assertTrue(dtMs >= 90, "expected spacing >= 90ms but was " + dtMs + "ms");
        }
    }

    @Test
    void first_acquire_does_not_wait() {
        ManualClock clock = new ManualClock();
        Throttle throttle = new Throttle(Duration.ofSeconds(3), clock::now, clock);
        throttle.acquire();
        assertTrue(clock.sleeps.isEmpty());
    }

    @Test
    void spacing_is_start_to_start_regardless_of_request_duration() {
        ManualClock clock = new ManualClock();
        Throttle throttle = new Throttle(Duration.ofSeconds(3), clock::now, clock);
        List<Long> starts = new ArrayList<>();

        throttle.acquire();
        starts.add(clock.now());
        clock.advance(Duration.ofMillis(200)); // fast failure
        throttle.acquire();
        starts.add(clock.now());
        clock.advance(Duration.ofSeconds(10)); // slow request
        throttle.acquire();
        starts.add(clock.now());

        assertEquals(Duration.ofSeconds(3).toNanos(), starts.get(1) - starts.get(0));
        assertEquals(Duration.ofSeconds(10).toNanos(), starts.get(2) - starts.get(1));
        assertEquals(List.of(Duration.ofMillis(2800)), clock.sleeps);
        assertEquals(3, throttle.acquisitions());
    }

    @Test
    void interrupted_wait_restores_flag_and_does_not_throw() {
        ManualClock clock = new ManualClock();
        Sleeper interrupting = d -> { throw new InterruptedException("test"); };
        Throttle throttle = new Throttle(Duration.ofSeconds(3), clock::now, interrupting);
        throttle.acquire();
        assertDoesNotThrow(throttle::acquire);
        assertTrue(Thread.interrupted(), "interrupt flag restored (and cleared here)");
    }

    static final class ManualClock implements Sleeper {
        private final AtomicLong nanos = new AtomicLong(1_000_000_000L);
        final List<Duration> sleeps = new ArrayList<>();

        long now() { return nanos.get(); }

        void advance(Duration d) { nanos.addAndGet(d.toNanos()); }

        @Override
        public void sleep(Duration duration) {
            sleeps.add(duration);
            advance(duration);
        }
    }
}
