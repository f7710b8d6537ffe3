package io.backfill.financial.output;

import io.backfill.financial.Bar;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists one reconciled series. {@code bars} are ascending by date with no duplicate dates.
 *
 * @return where the series was written
 */
public interface OutputSink {
    Path write(String symbol, List<Bar> bars, Path outputDir) throws IOException;
}
