package io.backfill.financial;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.backfill.financial.provider.ProviderSession;
import io.backfill.financial.provider.TimeBoundedProviderSession;
import io.backfill.retry.ErrorClass;
import io.backfill.retry.ExponentialBackoffRetryPolicy;
import io.backfill.retry.LinearBackoffRetryPolicy;
import io.backfill.retry.RetryPolicy;
import io.backfill.throttle.Throttle;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Period;

import static org.junit.jupiter.api.Assertions.*;

public class BackfillModuleTest {
    private static BackfillConfig config(String backoff) {
        return new BackfillConfig(Path.of("data"), Duration.ofMillis(1500), Duration.ofSeconds(10), 3,
                Duration.ofMillis(200), backoff, Period.ofMonths(6), BarSize.WEEK, URI.create("http://127.0.0.1:1"));
    }

    @Test
    void wires_singletons_from_config() {
        Injector injector = Guice.createInjector(new BackfillModule(config("linear")));

        BatchOrchestrator orchestrator = injector.getInstance(BatchOrchestrator.class);
        assertSame(orchestrator, injector.getInstance(BatchOrchestrator.class));
        assertSame(injector.getInstance(ProviderSession.class), injector.getInstance(ProviderSession.class));
        assertTrue(injector.getInstance(ProviderSession.class) instanceof TimeBoundedProviderSession);
        assertEquals(Duration.ofMillis(1500), injector.getInstance(Throttle.class).spacing());
        assertEquals(Period.ofMonths(6), injector.getInstance(ChunkPlanner.class).maxWindow());

        RetryPolicy retry = injector.getInstance(RetryPolicy.class);
        assertTrue(retry instanceof LinearBackoffRetryPolicy);
        assertEquals(Duration.ofMillis(400), retry.decide(2, ErrorClass.TRANSIENT).delay());
        assertFalse(retry.decide(4, ErrorClass.TRANSIENT).retry());
    }

    @Test
    void exponential_backoff_is_selectable() {
        Injector injector = Guice.createInjector(new BackfillModule(config("Exponential")));
        RetryPolicy retry = injector.getInstance(RetryPolicy.class);
        assertTrue(retry instanceof ExponentialBackoffRetryPolicy);
        assertEquals(Duration.ofMillis(800), retry.decide(3, ErrorClass.TRANSIENT).delay());
    }

    @Test
    void config_rejects_unknown_backoff_and_defaults_match_documented_values() {
        assertThrows(IllegalArgumentException.class, () -> config("fibonacci"));
        assertThrows(IllegalArgumentException.class, () -> BackfillConfig.defaults().withChunkWindow(Period.ZERO));
        assertThrows(IllegalArgumentException.class, () -> BackfillConfig.defaults().withChunkWindow(Period.ofMonths(-6)));
        BackfillConfig d = BackfillConfig.defaults();
        assertEquals(Duration.ofSeconds(3), d.throttleSpacing());
        assertEquals(Duration.ofSeconds(45), d.requestTimeout());
        assertEquals(2, d.maxRetries());
        assertEquals(Period.ofYears(1), d.chunkWindow());
        assertEquals(BarSize.DAY, d.barSize());
    }

    @Test
    void from_env_reads_system_properties() {
        System.setProperty("backfill.throttle.ms", "250");
        System.setProperty("backfill.bar.size", "monthly");
        try {
            BackfillConfig c = BackfillConfig.fromEnv();
            assertEquals(Duration.ofMillis(250), c.throttleSpacing());
            assertEquals(BarSize.MONTH, c.barSize());
        } finally {
            System.clearProperty("backfill.throttle.ms");
            System.clearProperty("backfill.bar.size");
        }
    }
}
