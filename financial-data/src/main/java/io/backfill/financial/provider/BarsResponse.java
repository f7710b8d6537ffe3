package io.backfill.financial.provider;

import io.backfill.financial.Bar;
import io.backfill.financial.FailureKind;

import java.util.List;
import java.util.Objects;

/**
 * Result of one bounded bars request: the rows the provider returned (possibly none) or a classified failure.
 */
public final class BarsResponse {
    private final List<Bar> bars;
    private final FailureKind failure;
    private final String detail;

    private BarsResponse(List<Bar> bars, FailureKind failure, String detail) {
        this.bars = bars;
        this.failure = failure;
        this.detail = detail;
    }

    public static BarsResponse ok(List<Bar> bars) {
        return new BarsResponse(List.copyOf(Objects.requireNonNull(bars, "bars")), null, null);
    }

    public static BarsResponse failed(FailureKind failure, String detail) {
        return new BarsResponse(List.of(), Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isOk() { return failure == null; }
    public List<Bar> bars() { return bars; }
    public FailureKind failure() { return failure; }
    public String detail() { return detail; }

    @Override
    public String toString() {
        return isOk() ? "BarsResponse{ok, bars=" + bars.size() + "}" : "BarsResponse{" + failure + ", " + detail + "}";
    }
}
