package io.backfill.financial;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of fetching one symbol: either a non-empty, date-ordered series or a failure. Never both, never partial.
 */
public final class SeriesResult {
    private final Symbol symbol;
    private final List<Bar> bars;
    private final FailureKind failure;
    private final String detail;
    private final boolean dataQualityWarning;
    private final int chunkCount;

    private SeriesResult(Symbol symbol, List<Bar> bars, FailureKind failure, String detail,
                         boolean dataQualityWarning, int chunkCount) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.bars = bars;
        this.failure = failure;
        this.detail = detail;
        this.dataQualityWarning = dataQualityWarning;
        this.chunkCount = chunkCount;
    }

    public static SeriesResult reconciled(Symbol symbol, List<Bar> bars, boolean dataQualityWarning, int chunkCount) {
        if (bars == null || bars.isEmpty()) throw new IllegalArgumentException("reconciled series must not be empty");
        if (!BarReconciler.isStrictlyIncreasing(bars)) throw new IllegalArgumentException("bars not strictly increasing");
        return new SeriesResult(symbol, List.copyOf(bars), null, null, dataQualityWarning, chunkCount);
    }

    public static SeriesResult failed(Symbol symbol, FailureKind failure, String detail) {
        return new SeriesResult(symbol, List.of(), Objects.requireNonNull(failure, "failure"), detail, false, 0);
    }

    public Symbol symbol() { return symbol; }
    public boolean isSuccess() { return failure == null; }
    public List<Bar> bars() { return bars; }
    public int recordCount() { return bars.size(); }
    public FailureKind failure() { return failure; }

    /** Human readable failure reason, null on success. */
    public String reason() { return failure == null ? null : failure.reason(); }

    public String detail() { return detail; }
    public boolean dataQualityWarning() { return dataQualityWarning; }
    public int chunkCount() { return chunkCount; }

    @Override
    public String toString() {
        return isSuccess()
                ? "SeriesResult{" + symbol + " bars=" + bars.size() + (dataQualityWarning ? " warning" : "") + "}"
                : "SeriesResult{" + symbol + " failed=" + failure.reason() + (detail == null ? "" : " (" + detail + ")") + "}";
    }
}
