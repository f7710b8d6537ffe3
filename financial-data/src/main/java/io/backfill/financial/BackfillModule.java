package io.backfill.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.backfill.core.CancellationToken;
import io.backfill.core.Sleeper;
import io.backfill.financial.event.EventSink;
import io.backfill.financial.event.MetricsEventSink;
import io.backfill.financial.event.Slf4jEventSink;
import io.backfill.financial.output.CsvOutputSink;
import io.backfill.financial.output.OutputSink;
import io.backfill.financial.provider.ProviderClient;
import io.backfill.financial.provider.ProviderSession;
import io.backfill.financial.provider.SecurityKindResolver;
import io.backfill.financial.provider.TimeBoundedProviderSession;
import io.backfill.financial.provider.YahooChartClient;
import io.backfill.metrics.Metrics;
import io.backfill.retry.ExponentialBackoffRetryPolicy;
import io.backfill.retry.LinearBackoffRetryPolicy;
import io.backfill.retry.RetryPolicy;
import io.backfill.throttle.Throttle;

import java.time.Clock;
import java.time.Duration;

public class BackfillModule extends AbstractModule {
    private static final long MAX_EXPONENTIAL_BACKOFF_MS = 60_000;

    private final BackfillConfig config;

    public BackfillModule(BackfillConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(BackfillConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemDefaultZone(); }

    @Provides @Singleton Sleeper sleeper() { return Sleeper.system(); }

    @Provides @Singleton CancellationToken cancellation() { return new CancellationToken(); }

    @Provides @Singleton Throttle throttle() { return new Throttle(config.throttleSpacing()); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        if (BackfillConfig.EXPONENTIAL.equals(config.backoff())) {
            return new ExponentialBackoffRetryPolicy(config.maxRetries(), config.retryStep().toMillis(), MAX_EXPONENTIAL_BACKOFF_MS);
        }
        return new LinearBackoffRetryPolicy(config.maxRetries(), config.retryStep());
    }

    @Provides @Singleton ChunkPlanner chunkPlanner() { return new ChunkPlanner(config.chunkWindow()); }

    @Provides @Singleton ProviderClient providerClient() {
        return new YahooChartClient(config.providerUri(), Duration.ofSeconds(30));
    }

    @Provides @Singleton ProviderSession providerSession(ProviderClient client) {
        return new TimeBoundedProviderSession(client, new SecurityKindResolver(), config.barSize(), config.requestTimeout());
    }

    @Provides @Singleton EventSink eventSink(Metrics metrics) {
        return EventSink.compose(new Slf4jEventSink(), new MetricsEventSink(metrics));
    }

    @Provides @Singleton OutputSink outputSink() { return new CsvOutputSink(); }

    @Provides @Singleton SymbolFetcher symbolFetcher(ChunkPlanner planner, Throttle throttle, RetryPolicy retry, Sleeper sleeper,
                                                     EventSink events, CancellationToken cancellation) {
        return new SymbolFetcher(planner, throttle, retry, sleeper, events, cancellation);
    }

    @Provides @Singleton BatchOrchestrator orchestrator(ProviderSession session, SymbolFetcher fetcher, OutputSink sink,
                                                        EventSink events, CancellationToken cancellation, Clock clock) {
        return new BatchOrchestrator(session, fetcher, sink, events, cancellation, clock);
    }
}
