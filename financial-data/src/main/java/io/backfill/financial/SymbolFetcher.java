package io.backfill.financial;

import io.backfill.core.CancellationToken;
import io.backfill.core.Sleeper;
import io.backfill.financial.BarReconciler.Reconciliation;
import io.backfill.financial.event.ChunkOutcome;
import io.backfill.financial.event.EventSink;
import io.backfill.financial.event.FetchEvent;
import io.backfill.financial.provider.BarsResponse;
import io.backfill.financial.provider.ProviderSession;
import io.backfill.retry.RetryDecision;
import io.backfill.retry.RetryPolicy;
import io.backfill.throttle.Throttle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Produces one reconciled series, or a definitive failure, for a single symbol.
 * <p>
 * Each fetch runs a small state machine:
 * <pre>
 * PLANNING -> FETCHING_CHUNK(i) -> ok        -> FETCHING_CHUNK(i+1) ... -> RECONCILED
 *                               -> transient -> RETRYING(i) -> FETCHING_CHUNK(i)
 *                               -> terminal  -> FAILED
 * </pre>
 * Chunks are requested oldest first, one at a time, each behind the shared {@link Throttle}. Retry decisions come
 * from the {@link RetryPolicy}; every attempt and every scheduled retry is reported to the {@link EventSink}.
 * Nothing escapes {@link #fetch}: unexpected runtime failures become {@link FailureKind#UNEXPECTED}.
 */
public class SymbolFetcher {
    public enum State {
        PLANNING, FETCHING_CHUNK, RETRYING, RECONCILED, FAILED;

        public boolean isTerminal() { return this == RECONCILED || this == FAILED; }
    }

    private final ChunkPlanner planner;
    private final Throttle throttle;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final EventSink events;
    private final CancellationToken cancellation;
    private final BarReconciler reconciler = new BarReconciler();

    public SymbolFetcher(ChunkPlanner planner, Throttle throttle, RetryPolicy retryPolicy, Sleeper sleeper,
                         EventSink events, CancellationToken cancellation) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.events = Objects.requireNonNull(events, "events");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    }

    public SeriesResult fetch(ProviderSession session, Symbol symbol, DateRange range) {
        try {
            return new Run(session, symbol, range).drive();
        } catch (RuntimeException e) {
            return SeriesResult.failed(symbol, FailureKind.UNEXPECTED, e.toString());
        }
    }

    private final class Run {
        private final ProviderSession session;
        private final Symbol symbol;
        private final DateRange range;
        private final List<List<Bar>> fetched = new ArrayList<>();

        private State state = State.PLANNING;
        private SecurityKind kind;
        private Iterator<Chunk> chunks;
        private Chunk current;
        private int attempt;
        private Duration backoff = Duration.ZERO;
        private SeriesResult result;

        Run(ProviderSession session, Symbol symbol, DateRange range) {
            this.session = Objects.requireNonNull(session, "session");
            this.symbol = Objects.requireNonNull(symbol, "symbol");
            this.range = Objects.requireNonNull(range, "range");
        }

        SeriesResult drive() {
            while (!state.isTerminal()) {
                switch (state) {
                    case PLANNING:
                        state = plan();
                        break;
                    case FETCHING_CHUNK:
                        state = fetchChunk();
                        break;
                    case RETRYING:
                        state = awaitRetry();
                        break;
                    default:
                        throw new IllegalStateException("unexpected state " + state);
                }
            }
            return result;
        }

        private State plan() {
            kind = session.resolveKind(symbol);
            events.emit(new FetchEvent.FetchStarted(symbol.ticker(), range.start(), kind));
            if (kind == SecurityKind.UNKNOWN) {
                return fail(FailureKind.UNRESOLVABLE_SECURITY, "cannot resolve security kind of " + symbol);
            }
            chunks = planner.plan(range).iterator();
            return nextChunk();
        }

        private State nextChunk() {
            if (!chunks.hasNext()) return reconcile();
            current = chunks.next();
            attempt = 0;
            return State.FETCHING_CHUNK;
        }

        private State fetchChunk() {
            if (isCancelled()) return fail(FailureKind.CANCELLED, "cancelled before chunk " + current);
            throttle.acquire();
            attempt++;
            BarsResponse resp = session.requestBars(symbol, current, kind);
            if (resp.isOk()) {
                events.emit(new FetchEvent.ChunkResult(symbol.ticker(), current.index(), attempt,
                        ChunkOutcome.SUCCEEDED, resp.bars().size(), null, null));
                fetched.add(resp.bars());
                return nextChunk();
            }

            FailureKind failure = resp.failure();
            events.emit(new FetchEvent.ChunkResult(symbol.ticker(), current.index(), attempt,
                    failure.isTransient() ? ChunkOutcome.FAILED_TRANSIENT : ChunkOutcome.FAILED_TERMINAL,
                    0, failure, resp.detail()));
            RetryDecision decision = retryPolicy.decide(attempt, failure.errorClass());
            if (decision.retry()) {
                backoff = decision.delay();
                events.emit(new FetchEvent.RetryScheduled(symbol.ticker(), current.index(), attempt, backoff, failure));
                return State.RETRYING;
            }
            String detail = failure.isTransient()
                    ? "chunk " + current + " gave up after " + attempt + " attempts: " + resp.detail()
                    : "chunk " + current + ": " + resp.detail();
            return fail(failure, detail);
        }

        private State awaitRetry() {
            if (isCancelled()) return fail(FailureKind.CANCELLED, "cancelled before retrying chunk " + current);
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return fail(FailureKind.CANCELLED, "interrupted during backoff for chunk " + current);
            }
            return State.FETCHING_CHUNK;
        }

        private State reconcile() {
            Reconciliation rec = reconciler.reconcile(range, fetched);
            if (rec.isEmpty()) {
                return fail(FailureKind.NO_DATA, "provider returned no bars for " + range);
            }
            if (rec.hasWarning()) {
                events.emit(new FetchEvent.ReconciliationWarning(symbol.ticker(), rec.duplicates(), rec.outOfOrder()));
            }
            result = SeriesResult.reconciled(symbol.withKind(kind), rec.bars(), rec.hasWarning(), fetched.size());
            return State.RECONCILED;
        }

        private State fail(FailureKind failure, String detail) {
            result = SeriesResult.failed(symbol, failure, detail);
            return State.FAILED;
        }

        private boolean isCancelled() {
            return cancellation.isCancelled() || Thread.currentThread().isInterrupted();
        }
    }
}
