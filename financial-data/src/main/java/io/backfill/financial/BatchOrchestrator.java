package io.backfill.financial;

import io.backfill.core.CancellationToken;
import io.backfill.financial.event.EventSink;
import io.backfill.financial.event.FetchEvent;
import io.backfill.financial.output.OutputSink;
import io.backfill.financial.provider.ProviderConnectionException;
import io.backfill.financial.provider.ProviderSession;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Runs a batch: cleans the symbol list, holds the provider session for the whole run and fetches symbols strictly
 * one after another. A failed symbol is recorded and the loop moves on; each successful series is handed to the
 * {@link OutputSink} before the next symbol starts.
 * <p>
 * Cancellation is checked between symbols (and, inside {@link SymbolFetcher}, between requests). Symbols that were
 * never started are reported as {@link FailureKind#CANCELLED}, so the report still covers every symbol.
 */
public class BatchOrchestrator {
    private final ProviderSession session;
    private final SymbolFetcher fetcher;
    private final OutputSink sink;
    private final EventSink events;
    private final CancellationToken cancellation;
    private final Clock clock;

    public BatchOrchestrator(ProviderSession session, SymbolFetcher fetcher, OutputSink sink, EventSink events,
                             CancellationToken cancellation, Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws ProviderConnectionException if the session cannot be established; no symbol is attempted
     */
    public BatchReport run(BatchRequest request) throws ProviderConnectionException {
        long t0 = System.nanoTime();
        LocalDate end = request.endDate() != null ? request.endDate() : LocalDate.now(clock);
        DateRange range = new DateRange(request.startDate(), end);
        SymbolList list = SymbolList.clean(request.symbols(), request.declaredKind());

        BatchReport.Builder report = BatchReport.builder(range);
        list.skipped().forEach(report::skipped);
        events.emit(new FetchEvent.BatchStarted(list.symbols().size(), range));

        if (!list.symbols().isEmpty()) {
            try {
                session.connect();
            } catch (ProviderConnectionException e) {
                session.disconnect();
                throw e;
            }
            try {
                for (Symbol symbol : list.symbols()) {
                    SymbolOutcome outcome = isCancelled()
                            ? SymbolOutcome.failed(symbol.ticker(), FailureKind.CANCELLED, "batch cancelled", Duration.ZERO)
                            : process(symbol, range, request);
                    report.record(outcome);
                    events.emit(new FetchEvent.SymbolResult(outcome.symbol(), outcome.success(), outcome.recordCount(),
                            outcome.reason(), outcome.elapsed()));
                }
            } finally {
                session.disconnect();
            }
        }

        BatchReport built = report.build(Duration.ofNanos(System.nanoTime() - t0));
        events.emit(new FetchEvent.BatchSummary(built.total(), built.successCount(), built.failedCount(), built.elapsed()));
        return built;
    }

    /** Stops the run after the request currently in flight; nothing is preempted. */
    public void cancel() { cancellation.cancel(); }

    public boolean isCancelled() {
        return cancellation.isCancelled() || Thread.currentThread().isInterrupted();
    }

    private SymbolOutcome process(Symbol symbol, DateRange range, BatchRequest request) {
        long t0 = System.nanoTime();
        SeriesResult r = fetcher.fetch(session, symbol, range);
        if (!r.isSuccess()) return SymbolOutcome.failed(r, since(t0));
        Path written = null;
        if (request.persist()) {
            try {
                written = sink.write(symbol.ticker(), r.bars(), request.outputDir());
            } catch (IOException | RuntimeException e) {
                return SymbolOutcome.failed(symbol.ticker(), FailureKind.OUTPUT_FAILED, e.toString(), since(t0));
            }
        }
        return SymbolOutcome.succeeded(r, written, since(t0));
    }

    private static Duration since(long t0) { return Duration.ofNanos(System.nanoTime() - t0); }
}
