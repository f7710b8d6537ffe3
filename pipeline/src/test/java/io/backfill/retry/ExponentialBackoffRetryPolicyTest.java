package io.backfill.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void doubles_delay_and_caps_at_max() {
        var policy = new ExponentialBackoffRetryPolicy(5, 100, 300);
        assertEquals(Duration.ofMillis(100), policy.decide(1, ErrorClass.TRANSIENT).delay());
        assertEquals(Duration.ofMillis(200), policy.decide(2, ErrorClass.TRANSIENT).delay());
        assertEquals(Duration.ofMillis(300), policy.decide(3, ErrorClass.TRANSIENT).delay());
        assertEquals(Duration.ofMillis(300), policy.decide(5, ErrorClass.TRANSIENT).delay());
        assertFalse(policy.decide(6, ErrorClass.TRANSIENT).retry());
    }

    @Test
    void terminal_is_not_retried() {
        var policy = new ExponentialBackoffRetryPolicy(5, 100, 300);
        assertFalse(policy.decide(1, ErrorClass.TERMINAL).retry());
    }
}
