package io.backfill.financial;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Input of one batch run. A null {@code endDate} means "today" as of the start of the run.
 */
public record BatchRequest(List<String> symbols,
                           LocalDate startDate,
                           LocalDate endDate,
                           Path outputDir,
                           boolean persist,
                           SecurityKind declaredKind) {
    public BatchRequest {
        symbols = List.copyOf(Objects.requireNonNull(symbols, "symbols").stream().map(s -> s == null ? "" : s).toList());
        Objects.requireNonNull(startDate, "startDate");
        if (persist) Objects.requireNonNull(outputDir, "outputDir");
        if (declaredKind == null) declaredKind = SecurityKind.UNKNOWN;
    }

    public BatchRequest(List<String> symbols, LocalDate startDate, Path outputDir, boolean persist) {
        this(symbols, startDate, null, outputDir, persist, SecurityKind.UNKNOWN);
    }
}
