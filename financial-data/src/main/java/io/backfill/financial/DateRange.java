package io.backfill.financial;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive calendar date interval [start, end].
 */
public record DateRange(LocalDate start, LocalDate end) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) throw new IllegalArgumentException("start " + start + " is after end " + end);
    }

    public boolean contains(LocalDate d) { return !d.isBefore(start) && !d.isAfter(end); }

    @Override
    public String toString() { return start + ".." + end; }
}
