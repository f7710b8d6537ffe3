package io.backfill.financial;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits a date range into contiguous, non-overlapping windows no wider than the provider's maximum, ordered
 * from oldest to newest. Plans are lazy and may be iterated any number of times.
 */
public class ChunkPlanner {
    public static final Period DEFAULT_MAX_WINDOW = Period.ofYears(1);

    private final Period maxWindow;

    public ChunkPlanner() { this(DEFAULT_MAX_WINDOW); }

    public ChunkPlanner(Period maxWindow) {
        Objects.requireNonNull(maxWindow, "maxWindow");
        if (maxWindow.isNegative() || maxWindow.isZero()
                || maxWindow.getYears() < 0 || maxWindow.getMonths() < 0 || maxWindow.getDays() < 0) {
            throw new IllegalArgumentException("max window must be positive: " + maxWindow);
        }
        this.maxWindow = maxWindow;
    }

    public Period maxWindow() { return maxWindow; }

    /**
     * A range whose start equals its end still yields exactly one chunk.
     */
    public Iterable<Chunk> plan(DateRange range) {
        Objects.requireNonNull(range, "range");
        return () -> new ChunkIterator(range);
    }

    public List<Chunk> planAll(DateRange range) {
        List<Chunk> out = new ArrayList<>();
        plan(range).forEach(out::add);
        return out;
    }

    private final class ChunkIterator implements Iterator<Chunk> {
        private final DateRange parent;
        private LocalDate nextStart;
        private int index = 0;

        ChunkIterator(DateRange parent) {
            this.parent = parent;
            this.nextStart = parent.start();
        }

        @Override
        public boolean hasNext() { return !nextStart.isAfter(parent.end()); }

        @Override
        public Chunk next() {
            if (!hasNext()) throw new NoSuchElementException();
            LocalDate s = nextStart;
            LocalDate e = s.plus(maxWindow).minusDays(1);
            if (e.isAfter(parent.end())) e = parent.end();
            nextStart = e.plusDays(1);
            return new Chunk(index++, new DateRange(s, e));
        }
    }
}
