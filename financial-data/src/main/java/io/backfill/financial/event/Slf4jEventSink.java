package io.backfill.financial.event;

import io.backfill.financial.event.FetchEvent.BatchStarted;
import io.backfill.financial.event.FetchEvent.BatchSummary;
import io.backfill.financial.event.FetchEvent.ChunkResult;
import io.backfill.financial.event.FetchEvent.FetchStarted;
import io.backfill.financial.event.FetchEvent.ReconciliationWarning;
import io.backfill.financial.event.FetchEvent.RetryScheduled;
import io.backfill.financial.event.FetchEvent.SymbolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders fetch events as log lines. Failures at WARN, retries and per-symbol results at INFO, chunk detail at DEBUG.
 */
public class Slf4jEventSink implements EventSink {
    private final Logger log;

    public Slf4jEventSink() { this(LoggerFactory.getLogger("io.backfill.fetch")); }

    public Slf4jEventSink(Logger log) { this.log = log; }

    @Override
    public void emit(FetchEvent event) {
        if (event instanceof BatchStarted e) {
            log.info("batch started: {} symbols, range {}", e.symbols(), e.range());
        } else if (event instanceof FetchStarted e) {
            log.info("{}: fetch started from {} ({})", e.symbol(), e.startDate(), e.kind());
        } else if (event instanceof ChunkResult e) {
            switch (e.outcome()) {
                case SUCCEEDED:
                    log.debug("{}: chunk #{} attempt {} ok, {} bars", e.symbol(), e.chunkIndex(), e.attempt(), e.bars());
                    break;
                case FAILED_TRANSIENT:
                    log.info("{}: chunk #{} attempt {} failed ({}): {}", e.symbol(), e.chunkIndex(), e.attempt(),
                            e.failure().reason(), e.detail());
                    break;
                default:
                    log.warn("{}: chunk #{} attempt {} failed permanently ({}): {}", e.symbol(), e.chunkIndex(), e.attempt(),
                            e.failure().reason(), e.detail());
            }
        } else if (event instanceof RetryScheduled e) {
            log.info("{}: retrying chunk #{} in {} ms after {} (attempt {})", e.symbol(), e.chunkIndex(),
                    e.delay().toMillis(), e.cause().reason(), e.attempt());
        } else if (event instanceof ReconciliationWarning e) {
            log.warn("{}: reconciled {} duplicate and {} out-of-order dates", e.symbol(), e.duplicateDates(), e.outOfOrderDates());
        } else if (event instanceof SymbolResult e) {
            if (e.success()) {
                log.info("{}: ok, {} records in {} ms", e.symbol(), e.records(), e.elapsed().toMillis());
            } else {
                log.warn("{}: failed: {} after {} ms", e.symbol(), e.reason(), e.elapsed().toMillis());
            }
        } else if (event instanceof BatchSummary e) {
            log.info("batch finished: {} total, {} succeeded, {} failed in {} s", e.total(), e.succeeded(), e.failed(),
                    e.elapsed().toSeconds());
        } else {
            log.debug("event: {}", event);
        }
    }
}
