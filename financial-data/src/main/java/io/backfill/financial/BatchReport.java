package io.backfill.financial;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-symbol outcomes of a batch run, in processing order. Immutable once built.
 */
public final class BatchReport {
    private final DateRange range;
    private final Map<String, SymbolOutcome> outcomes;
    private final Map<String, String> skipped;
    private final Duration elapsed;

    private BatchReport(DateRange range, Map<String, SymbolOutcome> outcomes, Map<String, String> skipped, Duration elapsed) {
        this.range = range;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
        this.elapsed = elapsed;
    }

    public static Builder builder(DateRange range) { return new Builder(range); }

    public DateRange range() { return range; }
    public Map<String, SymbolOutcome> outcomes() { return outcomes; }
    public SymbolOutcome outcome(String symbol) { return outcomes.get(Symbol.normalize(symbol)); }

    /** Raw entries excluded before fetching (delisting-marked), with the reason. */
    public Map<String, String> skipped() { return skipped; }

    public Duration elapsed() { return elapsed; }
    public int total() { return outcomes.size(); }
    public int successCount() { return (int) outcomes.values().stream().filter(SymbolOutcome::success).count(); }
    public int failedCount() { return total() - successCount(); }
    public double successRate() { return total() == 0 ? 0.0 : 100.0 * successCount() / total(); }
    public long totalRecords() { return outcomes.values().stream().mapToLong(SymbolOutcome::recordCount).sum(); }

    public List<String> succeeded() {
        return outcomes.values().stream().filter(SymbolOutcome::success).map(SymbolOutcome::symbol).toList();
    }

    public List<String> failed() {
        return outcomes.values().stream().filter(o -> !o.success()).map(SymbolOutcome::symbol).toList();
    }

    @Override
    public String toString() {
        return "BatchReport{total=" + total() + ", success=" + successCount() + ", failed=" + failedCount()
                + ", skipped=" + skipped.size() + ", elapsed=" + elapsed + "}";
    }

    public static final class Builder {
        private final DateRange range;
        private final Map<String, SymbolOutcome> outcomes = new LinkedHashMap<>();
        private final Map<String, String> skipped = new LinkedHashMap<>();
        private boolean built = false;

        private Builder(DateRange range) { this.range = Objects.requireNonNull(range, "range"); }

        public Builder record(SymbolOutcome outcome) {
            if (built) throw new IllegalStateException("report already built");
            if (outcomes.putIfAbsent(outcome.symbol(), outcome) != null) {
                throw new IllegalStateException("symbol recorded twice: " + outcome.symbol());
            }
            return this;
        }

        public Builder skipped(String raw, String reason) {
            if (built) throw new IllegalStateException("report already built");
            skipped.putIfAbsent(raw, reason);
            return this;
        }

        public BatchReport build(Duration elapsed) {
            built = true;
            return new BatchReport(range, outcomes, skipped, elapsed);
        }
    }
}
