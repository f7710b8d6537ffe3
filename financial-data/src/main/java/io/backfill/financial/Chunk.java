package io.backfill.financial;

import java.util.Objects;

/**
 * One provider-sized window of a parent range. {@code index} is 0-based, oldest first.
 */
public record Chunk(int index, DateRange range) {
    public Chunk {
        Objects.requireNonNull(range, "range");
        if (index < 0) throw new IllegalArgumentException("negative index");
    }

    @Override
    public String toString() { return "#" + index + "[" + range + "]"; }
}
