package io.backfill.financial;

import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.backfill.financial.provider.ProviderConnectionException;
import io.backfill.metrics.Metrics;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI to backfill historical bars for a list of symbols into one CSV per symbol.
 */
@CommandLine.Command(name = "bar-backfill", mixinStandardHelpOptions = true, description = "Backfill historical price bars to CSVs")
public final class BackfillMain implements Callable<Integer> {
    static final LocalDate DEFAULT_START = LocalDate.of(2008, 1, 1);

    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    Clock clock = Clock.systemDefaultZone();

    @CommandLine.Option(names = {"-s", "--symbol"}, split = ",", description = "Symbols (comma-separated or repeat option)")
    List<String> symbols = new ArrayList<>();

    @CommandLine.Option(names = "--symbols-file", description = "File with one symbol per line (first column)")
    Path symbolsFile;

    @CommandLine.Option(names = "--start-date", description = "Start date (yyyy-MM-dd or yyyyMMdd), default 2008-01-01")
    String startDate;

    @CommandLine.Option(names = "--end-date", description = "End date (yyyy-MM-dd or yyyyMMdd); default today")
    String endDate;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory")
    Path outDir;

    @CommandLine.Option(names = "--bar-size", description = "Bar size: 1 day, 1 week, 1 month")
    String barSize;

    @CommandLine.Option(names = "--kind", description = "Declared security kind for all symbols: ${COMPLETION-CANDIDATES}")
    SecurityKind kind;

    @CommandLine.Option(names = "--max-count", description = "Process at most this many symbols", defaultValue = "0")
    int maxCount;

    @CommandLine.Option(names = "--start-from", description = "1-based position in the symbol list to start from", defaultValue = "1")
    int startFrom;

    @CommandLine.Option(names = "--no-save", description = "Fetch only, do not write CSVs")
    boolean noSave;

    @CommandLine.Option(names = "--throttle-ms", description = "Minimum spacing between provider requests")
    Long throttleMs;

    @CommandLine.Option(names = "--chunk-window", description = "Maximum chunk window as ISO period, e.g. P1Y or P6M")
    String chunkWindow;

    public static void main(String[] args) {
        int code = new CommandLine(new BackfillMain()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        BackfillConfig config;
        BatchRequest request;
        try {
            config = config();
            request = request(config);
        } catch (IllegalArgumentException | DateTimeParseException | IOException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        }
        if (SymbolList.clean(request.symbols()).symbols().isEmpty()) {
            System.err.println("No symbols given; use --symbol or --symbols-file");
            return 2;
        }

        Injector injector = Guice.createInjector(new BackfillModule(config));
        BatchOrchestrator orchestrator = injector.getInstance(BatchOrchestrator.class);

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            orchestrator.cancel();
            try {
                finished.await(config.requestTimeout().toMillis() + 5_000, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "backfill-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            BatchReport report = orchestrator.run(request);
            print(report);
            printMetrics(injector.getInstance(Metrics.class));
            return report.failedCount() == 0 ? 0 : 1;
        } catch (ProviderConnectionException e) {
            System.err.println("Cannot connect to provider: " + e.getMessage());
            return 2;
        } finally {
            finished.countDown();
        }
    }

    BackfillConfig config() {
        BackfillConfig config = BackfillConfig.fromEnv();
        if (outDir != null) config = config.withOutputDir(outDir);
        if (throttleMs != null) config = config.withThrottleSpacing(Duration.ofMillis(throttleMs));
        if (chunkWindow != null) config = config.withChunkWindow(Period.parse(chunkWindow));
        if (barSize != null) config = config.withBarSize(BackfillConfig.barSizeOrDefault(barSize));
        return config;
    }

    BatchRequest request(BackfillConfig config) throws IOException {
        List<String> raw = new ArrayList<>(symbols);
        if (symbolsFile != null) raw.addAll(SymbolListLoader.load(symbolsFile));
        raw = SymbolListLoader.slice(raw, startFrom, maxCount);
        LocalDate start = startDate == null ? DEFAULT_START : parseDate(startDate);
        LocalDate end = endDate == null ? null : parseDate(endDate);
        LocalDate effectiveEnd = end != null ? end : LocalDate.now(clock);
        if (start.isAfter(effectiveEnd)) {
            throw new IllegalArgumentException("start date " + start + " is after end date " + effectiveEnd);
        }
        return new BatchRequest(raw, start, end, config.outputDir(), !noSave, kind);
    }

    /** Accepts {@code yyyy-MM-dd} and {@code yyyyMMdd}. */
    static LocalDate parseDate(String raw) {
        String s = raw.trim();
        return s.length() == 8 && s.chars().allMatch(Character::isDigit) ? LocalDate.parse(s, BASIC) : LocalDate.parse(s);
    }

    private static void print(BatchReport report) {
        System.out.println("Backfill " + report.range() + ": " + report.successCount() + "/" + report.total()
                + " succeeded (" + String.format("%.1f", report.successRate()) + "%), "
                + report.totalRecords() + " records in " + report.elapsed().toSeconds() + "s");
        for (SymbolOutcome o : report.outcomes().values()) {
            if (o.success()) {
                System.out.println("  " + o.symbol() + ": " + o.recordCount() + " bars " + o.firstDate() + ".." + o.lastDate()
                        + " return=" + String.format("%.2f", o.totalReturnPercent()) + "%"
                        + (o.dataQualityWarning() ? " [data-quality warning]" : "")
                        + (o.output() != null ? " -> " + o.output() : ""));
            } else {
                System.out.println("  " + o.symbol() + ": FAILED " + o.reason() + (o.detail() != null ? " (" + o.detail() + ")" : ""));
            }
        }
        for (Map.Entry<String, String> e : report.skipped().entrySet()) {
            System.out.println("  " + e.getKey() + ": skipped " + e.getValue());
        }
        if (report.failedCount() > 0) {
            System.out.println("Succeeded: " + report.succeeded());
            System.out.println("Failed: " + report.failed());
        }
    }

    private static void printMetrics(Metrics m) {
        Timer t = m.timer("symbol.time");
        Snapshot snap = t.getSnapshot();
        System.out.println("metrics: chunksOk=" + m.counter("chunks.succeeded").getCount()
                + " chunksFailed=" + m.counter("chunks.failed").getCount()
                + " retries=" + m.counter("retries").getCount()
                + " warnings=" + m.counter("reconciliation.warnings").getCount()
                + " bars=" + m.counter("bars.fetched").getCount()
                + " | symbol.p50(ms)=" + String.format("%.1f", snap.getMedian() / 1_000_000.0)
                + " max(ms)=" + String.format("%.1f", snap.getMax() / 1_000_000.0));
    }
}
