package io.backfill.financial;

import java.util.Locale;
import java.util.Optional;

/**
 * Bar sizes a date-keyed series can hold. {@code interval} is the provider's wire code.
 */
public enum BarSize {
    DAY("1 day", "1d"),
    WEEK("1 week", "1wk"),
    MONTH("1 month", "1mo");

    public static final BarSize DEFAULT = DAY;

    private final String label;
    private final String interval;

    BarSize(String label, String interval) {
        this.label = label;
        this.interval = interval;
    }

    public String label() { return label; }

    public String interval() { return interval; }

    /**
     * Accepts labels ("1 day"), plurals ("1 days"), wire codes ("1d", "1wk") and words ("daily").
     */
    public static Optional<BarSize> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        switch (s) {
            case "1 day": case "1 days": case "1day": case "1d": case "day": case "daily":
                return Optional.of(DAY);
            case "1 week": case "1 weeks": case "1week": case "1w": case "1wk": case "week": case "weekly":
                return Optional.of(WEEK);
            case "1 month": case "1 months": case "1month": case "1mo": case "month": case "monthly":
                return Optional.of(MONTH);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String toString() { return label; }
}
