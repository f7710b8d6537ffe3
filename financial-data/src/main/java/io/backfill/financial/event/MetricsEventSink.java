package io.backfill.financial.event;

import io.backfill.financial.event.FetchEvent.ChunkResult;
import io.backfill.financial.event.FetchEvent.ReconciliationWarning;
import io.backfill.financial.event.FetchEvent.RetryScheduled;
import io.backfill.financial.event.FetchEvent.SymbolResult;
import io.backfill.metrics.Metrics;

import java.util.concurrent.TimeUnit;

/**
 * Folds fetch events into counters and a per-symbol timer.
 */
public class MetricsEventSink implements EventSink {
    private final Metrics metrics;

    public MetricsEventSink(Metrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void emit(FetchEvent event) {
        if (event instanceof ChunkResult e) {
            if (e.outcome() == ChunkOutcome.SUCCEEDED) {
                metrics.counter("chunks.succeeded").inc();
                metrics.counter("bars.fetched").inc(e.bars());
            } else {
                metrics.counter("chunks.failed").inc();
            }
        } else if (event instanceof RetryScheduled) {
            metrics.counter("retries").inc();
        } else if (event instanceof ReconciliationWarning) {
            metrics.counter("reconciliation.warnings").inc();
        } else if (event instanceof SymbolResult e) {
            metrics.counter(e.success() ? "symbols.succeeded" : "symbols.failed").inc();
            metrics.timer("symbol.time").update(e.elapsed().toNanos(), TimeUnit.NANOSECONDS);
        }
    }
}
