package io.backfill.financial.event;

import io.backfill.financial.DateRange;
import io.backfill.financial.FailureKind;
import io.backfill.financial.SecurityKind;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Structured events emitted by the fetch core. Rendering and storage belong to the {@link EventSink}.
 */
public interface FetchEvent {

    record BatchStarted(int symbols, DateRange range) implements FetchEvent {}

    record FetchStarted(String symbol, LocalDate startDate, SecurityKind kind) implements FetchEvent {}

    /**
     * @param failure null when {@code outcome} is {@link ChunkOutcome#SUCCEEDED}
     */
    record ChunkResult(String symbol, int chunkIndex, int attempt, ChunkOutcome outcome, int bars,
                       FailureKind failure, String detail) implements FetchEvent {}

    record RetryScheduled(String symbol, int chunkIndex, int attempt, Duration delay, FailureKind cause) implements FetchEvent {}

    record ReconciliationWarning(String symbol, int duplicateDates, int outOfOrderDates) implements FetchEvent {}

    /**
     * @param reason null on success
     */
    record SymbolResult(String symbol, boolean success, int records, String reason, Duration elapsed) implements FetchEvent {}

    record BatchSummary(int total, int succeeded, int failed, Duration elapsed) implements FetchEvent {}
}
