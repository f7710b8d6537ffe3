package io.backfill.financial;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * One line of the batch report. On failure only {@code symbol}, {@code failure}, {@code reason}, {@code detail}
 * and {@code elapsed} are meaningful.
 */
public record SymbolOutcome(String symbol,
                            boolean success,
                            int recordCount,
                            LocalDate firstDate,
                            LocalDate lastDate,
                            double totalReturnPercent,
                            boolean dataQualityWarning,
                            Path output,
                            FailureKind failure,
                            String reason,
                            String detail,
                            Duration elapsed) {

    public static SymbolOutcome succeeded(SeriesResult r, Path output, Duration elapsed) {
        List<Bar> bars = r.bars();
        Bar first = bars.get(0);
        Bar last = bars.get(bars.size() - 1);
        double ret = 0.0;
        if (bars.size() > 1 && first.close() != 0.0) {
            ret = (last.close() - first.close()) / first.close() * 100.0;
        }
        return new SymbolOutcome(r.symbol().ticker(), true, bars.size(), first.date(), last.date(), ret,
                r.dataQualityWarning(), output, null, null, null, elapsed);
    }

    public static SymbolOutcome failed(String symbol, FailureKind failure, String detail, Duration elapsed) {
        return new SymbolOutcome(symbol, false, 0, null, null, 0.0, false, null,
                failure, failure.reason(), detail, elapsed);
    }

    public static SymbolOutcome failed(SeriesResult r, Duration elapsed) {
        return failed(r.symbol().ticker(), r.failure(), r.detail(), elapsed);
    }
}
