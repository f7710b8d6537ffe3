package io.backfill.financial;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One OHLCV row for a single trading date. {@code close} is the adjusted close when the provider supplies it.
 */
public record Bar(LocalDate date, double open, double high, double low, double close, long volume) {
    public Bar {
        Objects.requireNonNull(date, "date");
    }
}
