package io.backfill.financial;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ChunkPlannerTest {
    @Test
    void chunks_cover_range_exactly_without_overlap() {
        Random rnd = new Random(42);
        Period[] windows = {Period.ofDays(1), Period.ofDays(30), Period.ofMonths(1), Period.ofMonths(6), Period.ofYears(1)};
        for (int i = 0; i < 500; i++) {
            LocalDate start = LocalDate.of(2000, 1, 1).plusDays(rnd.nextInt(8000));
            LocalDate end = start.plusDays(rnd.nextInt(3000));
            Period window = windows[rnd.nextInt(windows.length)];
            DateRange range = new DateRange(start, end);

            List<Chunk> chunks = new ChunkPlanner(window).planAll(range);

            assertFalse(chunks.isEmpty());
            assertEquals(start, chunks.get(0).range().start());
            assertEquals(end, chunks.get(chunks.size() - 1).range().end());
            for (int c = 0; c < chunks.size(); c++) {
                Chunk chunk = chunks.get(c);
                assertEquals(c, chunk.index());
                assertTrue(chunk.range().end().isBefore(chunk.range().start().plus(window)),
                        () -> "chunk " + chunk + " wider than " + window);
                if (c > 0) {
                    assertEquals(chunks.get(c - 1).range().end().plusDays(1), chunk.range().start());
                }
            }
        }
    }

    @Test
    void single_day_range_yields_one_chunk() {
        LocalDate d = LocalDate.of(2024, 2, 29);
        List<Chunk> chunks = new ChunkPlanner().planAll(new DateRange(d, d));
        assertEquals(1, chunks.size());
        assertEquals(new DateRange(d, d), chunks.get(0).range());
    }

    @Test
    void range_smaller_than_window_is_one_chunk() {
        DateRange range = new DateRange(LocalDate.of(2020, 3, 1), LocalDate.of(2020, 11, 30));
        assertEquals(List.of(new Chunk(0, range)), new ChunkPlanner(Period.ofYears(1)).planAll(range));
    }

    @Test
    void yearly_windows_split_on_anniversaries() {
        List<Chunk> chunks = new ChunkPlanner().planAll(new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2021, 6, 30)));
        assertEquals(2, chunks.size());
        assertEquals(LocalDate.of(2020, 12, 31), chunks.get(0).range().end());
        assertEquals(LocalDate.of(2021, 1, 1), chunks.get(1).range().start());
    }

    @Test
    void plan_is_restartable() {
        ChunkPlanner planner = new ChunkPlanner(Period.ofMonths(1));
        Iterable<Chunk> plan = planner.plan(new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)));
        int first = 0;
        for (Chunk ignored : plan) first++;
        int second = 0;
        for (Chunk ignored : plan) second++;
        assertEquals(12, first);
        assertEquals(first, second);
    }

    @Test
    void rejects_non_positive_window() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkPlanner(Period.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new ChunkPlanner(Period.ofDays(-1)));
    }
}
