package io.backfill.financial;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Merges per-chunk bar sequences into one series. Chunks are applied in sequence order, so on a duplicate date
 * the bar from the later chunk wins (within one chunk, the later row wins). Bars outside the requested range are
 * dropped. Duplicates and out-of-order rows in the concatenated input are counted; they never fail the merge.
 */
public final class BarReconciler {

    public Reconciliation reconcile(DateRange range, List<List<Bar>> chunksInOrder) {
        TreeMap<LocalDate, Bar> byDate = new TreeMap<>();
        int duplicates = 0;
        int outOfOrder = 0;
        int outOfRange = 0;
        LocalDate previous = null;
        for (List<Bar> chunk : chunksInOrder) {
            for (Bar bar : chunk) {
                if (!range.contains(bar.date())) {
                    outOfRange++;
                    continue;
                }
                if (byDate.put(bar.date(), bar) != null) {
                    duplicates++;
                } else if (previous != null && bar.date().isBefore(previous)) {
                    outOfOrder++;
                }
                previous = bar.date();
            }
        }
        return new Reconciliation(List.copyOf(new ArrayList<>(byDate.values())), duplicates, outOfOrder, outOfRange);
    }

    static boolean isStrictlyIncreasing(List<Bar> bars) {
        for (int i = 1; i < bars.size(); i++) {
            if (!bars.get(i).date().isAfter(bars.get(i - 1).date())) return false;
        }
        return true;
    }

    /**
     * @param duplicates rows whose date had already been seen and that replaced the earlier row
     * @param outOfOrder rows that arrived with a date earlier than their predecessor
     * @param outOfRange rows outside the requested range, dropped
     */
    public record Reconciliation(List<Bar> bars, int duplicates, int outOfOrder, int outOfRange) {
        public boolean hasWarning() { return duplicates > 0 || outOfOrder > 0; }

        public boolean isEmpty() { return bars.isEmpty(); }
    }
}
