package io.backfill.financial;

import io.backfill.core.CancellationToken;
import io.backfill.financial.event.ChunkOutcome;
import io.backfill.financial.event.FetchEvent;
import io.backfill.financial.provider.BarsResponse;
import io.backfill.retry.LinearBackoffRetryPolicy;
import io.backfill.throttle.Throttle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolFetcherTest {
    private final List<FetchEvent> events = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();
    private final CancellationToken cancellation = new CancellationToken();
    private final Throttle throttle = new Throttle(Duration.ZERO);
    private ScriptedSession session;
    private SymbolFetcher fetcher;

    @BeforeEach
    void setup() throws Exception {
        session = new ScriptedSession();
        session.connect();
        fetcher = new SymbolFetcher(new ChunkPlanner(Period.ofYears(1)), throttle, new LinearBackoffRetryPolicy(),
                sleeps::add, events::add, cancellation);
    }

    @Test
    void two_timeouts_then_success_retries_with_linear_backoff() {
        session.script("AAPL",
                BarsResponse.failed(FailureKind.REQUEST_TIMEOUT, "stalled"),
                BarsResponse.failed(FailureKind.REQUEST_TIMEOUT, "stalled"));
        DateRange range = new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2021, 6, 30));

        SeriesResult r = fetcher.fetch(session, Symbol.of("AAPL"), range);

        assertTrue(r.isSuccess(), () -> "expected success but was " + r.reason() + ": " + r.detail());
        assertEquals(2, r.chunkCount());
        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(6)), sleeps);
        List<FetchEvent.RetryScheduled> retries = ofType(FetchEvent.RetryScheduled.class);
        assertEquals(2, retries.size());
        assertTrue(retries.stream().allMatch(e -> e.chunkIndex() == 0 && e.cause() == FailureKind.REQUEST_TIMEOUT));
        // 3 attempts on chunk 0, 1 on chunk 1, each behind the throttle
        assertEquals(4, throttle.acquisitions());
        assertEquals(List.of("AAPL#0", "AAPL#0", "AAPL#0", "AAPL#1"), session.requests);
        assertEquals(LocalDate.of(2020, 1, 1), r.bars().get(0).date());
        assertFalse(r.dataQualityWarning());
    }

    @Test
    void exhausted_transient_retries_fail_with_the_transient_reason() {
        session.script("MSFT",
                BarsResponse.failed(FailureKind.SESSION_CONGESTION, "busy"),
                BarsResponse.failed(FailureKind.SESSION_CONGESTION, "busy"),
                BarsResponse.failed(FailureKind.SESSION_CONGESTION, "busy"));

        SeriesResult r = fetcher.fetch(session, Symbol.of("MSFT"), new DateRange(LocalDate.of(2023, 1, 2), LocalDate.of(2023, 3, 1)));

        assertFalse(r.isSuccess());
        assertEquals("session congestion", r.reason());
        assertEquals(3, session.requests.size());
        assertEquals(2, ofType(FetchEvent.RetryScheduled.class).size());
    }

    @Test
    void terminal_error_is_attempted_once() {
        session.script("BADSYM", BarsResponse.failed(FailureKind.UNRESOLVABLE_SECURITY, "unknown"));

        SeriesResult r = fetcher.fetch(session, Symbol.of("BADSYM"), new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2022, 1, 1)));

        assertFalse(r.isSuccess());
        assertEquals(FailureKind.UNRESOLVABLE_SECURITY, r.failure());
        assertEquals("unresolvable security", r.reason());
        assertEquals(List.of("BADSYM#0"), session.requests);
        assertTrue(sleeps.isEmpty());
        assertTrue(ofType(FetchEvent.RetryScheduled.class).isEmpty());
        assertEquals(ChunkOutcome.FAILED_TERMINAL, ofType(FetchEvent.ChunkResult.class).get(0).outcome());
    }

    @Test
    void unresolvable_kind_fails_without_any_request() {
        SeriesResult r = fetcher.fetch(session, Symbol.of("12345"), new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 2, 1)));

        assertEquals(FailureKind.UNRESOLVABLE_SECURITY, r.failure());
        assertTrue(session.requests.isEmpty());
        assertEquals(0, throttle.acquisitions());
    }

    @Test
    void all_chunks_empty_fails_with_no_data() {
        session.script("IPO", BarsResponse.ok(List.of()), BarsResponse.ok(List.of()));

        SeriesResult r = fetcher.fetch(session, Symbol.of("IPO"), new DateRange(LocalDate.of(2019, 1, 1), LocalDate.of(2020, 6, 1)));

        assertFalse(r.isSuccess());
        assertEquals("no data", r.reason());
        assertEquals(2, session.requests.size());
    }

    @Test
    void empty_older_chunk_is_not_a_failure() {
        session.script("IPO", BarsResponse.ok(List.of()));

        SeriesResult r = fetcher.fetch(session, Symbol.of("IPO"), new DateRange(LocalDate.of(2019, 1, 1), LocalDate.of(2020, 6, 1)));

        assertTrue(r.isSuccess());
        assertTrue(r.bars().get(0).date().getYear() >= 2020);
    }

    @Test
    void duplicate_dates_across_chunks_keep_later_chunk_and_flag_warning() {
        session.script("DUP",
                BarsResponse.ok(List.of(ScriptedSession.bar("2020-01-02", 10), ScriptedSession.bar("2020-12-31", 11))),
                BarsResponse.ok(List.of(ScriptedSession.bar("2020-12-31", 12), ScriptedSession.bar("2021-01-04", 13))));

        SeriesResult r = fetcher.fetch(session, Symbol.of("DUP"), new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2021, 3, 1)));

        assertTrue(r.isSuccess());
        assertEquals(3, r.recordCount());
        assertEquals(12.0, r.bars().get(1).close());
        assertTrue(r.dataQualityWarning());
        assertEquals(1, ofType(FetchEvent.ReconciliationWarning.class).size());
    }

    @Test
    void cancellation_stops_before_next_request() {
        fetcher = new SymbolFetcher(new ChunkPlanner(Period.ofMonths(1)), throttle, new LinearBackoffRetryPolicy(),
                sleeps::add, e -> {
                    events.add(e);
                    if (e instanceof FetchEvent.ChunkResult) cancellation.cancel();
                }, cancellation);

        SeriesResult r = fetcher.fetch(session, Symbol.of("AAPL"), new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)));

        assertEquals(FailureKind.CANCELLED, r.failure());
        assertEquals("cancelled", r.reason());
        assertEquals(1, session.requests.size());
    }

    @Test
    void interrupted_backoff_counts_as_cancelled() {
        session.script("AAPL", BarsResponse.failed(FailureKind.CONNECTION_LOST, "reset"));
        fetcher = new SymbolFetcher(new ChunkPlanner(), throttle, new LinearBackoffRetryPolicy(),
                d -> { throw new InterruptedException(); }, events::add, cancellation);
        try {
            SeriesResult r = fetcher.fetch(session, Symbol.of("AAPL"), new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 3, 1)));
            assertEquals(FailureKind.CANCELLED, r.failure());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void unexpected_runtime_failure_is_contained() {
        ScriptedSession broken = new ScriptedSession();
        // never connected: requestBars throws IllegalStateException
        SeriesResult r = fetcher.fetch(broken, Symbol.of("AAPL"), new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 3, 1)));

        assertEquals(FailureKind.UNEXPECTED, r.failure());
        assertTrue(r.detail().contains("not connected"));
    }

    private <T extends FetchEvent> List<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
