package io.backfill.financial;

import io.backfill.financial.provider.TimeBoundedProviderSession;
import io.backfill.financial.provider.YahooChartClient;
import io.backfill.throttle.Throttle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Period;
import java.util.Locale;

public record BackfillConfig(
        Path outputDir,
        Duration throttleSpacing,
        Duration requestTimeout,
        int maxRetries,
        Duration retryStep,
        String backoff,
        Period chunkWindow,
        BarSize barSize,
        URI providerUri
) {
    private static final Logger log = LoggerFactory.getLogger(BackfillConfig.class);

    public static final String LINEAR = "linear";
    public static final String EXPONENTIAL = "exponential";

    public BackfillConfig {
        if (throttleSpacing.isNegative()) throw new IllegalArgumentException("throttle spacing must be >= 0");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) throw new IllegalArgumentException("request timeout must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("max retries must be >= 0");
        if (chunkWindow.isZero() || chunkWindow.getYears() < 0 || chunkWindow.getMonths() < 0 || chunkWindow.getDays() < 0) {
            throw new IllegalArgumentException("chunk window must be positive: " + chunkWindow);
        }
        backoff = backoff.trim().toLowerCase(Locale.ROOT);
        if (!LINEAR.equals(backoff) && !EXPONENTIAL.equals(backoff)) {
            throw new IllegalArgumentException("backoff must be linear or exponential: " + backoff);
        }
    }

    public static BackfillConfig defaults() {
        return new BackfillConfig(Path.of("data"), Throttle.DEFAULT_SPACING, TimeBoundedProviderSession.DEFAULT_REQUEST_TIMEOUT, 2,
                Duration.ofMillis(3000), LINEAR, Period.ofYears(1), BarSize.DEFAULT, YahooChartClient.DEFAULT_BASE_URI);
    }

    public static BackfillConfig fromEnv() {
        Path out = Path.of(get("backfill.out", "BACKFILL_OUT", "data"));
        long throttleMs = Long.parseLong(get("backfill.throttle.ms", "BACKFILL_THROTTLE_MS",
                String.valueOf(Throttle.DEFAULT_SPACING.toMillis())));
        long timeoutMs = Long.parseLong(get("backfill.timeout.ms", "BACKFILL_TIMEOUT_MS",
                String.valueOf(TimeBoundedProviderSession.DEFAULT_REQUEST_TIMEOUT.toMillis())));
        int retries = Integer.parseInt(get("backfill.retries", "BACKFILL_RETRIES", "2"));
        long stepMs = Long.parseLong(get("backfill.retry.step.ms", "BACKFILL_RETRY_STEP_MS", "3000"));
        String backoff = get("backfill.backoff", "BACKFILL_BACKOFF", LINEAR);
        Period window = Period.parse(get("backfill.chunk.window", "BACKFILL_CHUNK_WINDOW", "P1Y"));
        BarSize barSize = barSizeOrDefault(get("backfill.bar.size", "BACKFILL_BAR_SIZE", BarSize.DEFAULT.label()));
        URI uri = URI.create(get("backfill.provider.uri", "BACKFILL_PROVIDER_URI", YahooChartClient.DEFAULT_BASE_URI.toString()));
        return new BackfillConfig(out, Duration.ofMillis(throttleMs), Duration.ofMillis(timeoutMs), retries,
                Duration.ofMillis(stepMs), backoff, window, barSize, uri);
    }

    /** Unknown bar sizes fall back to {@link BarSize#DEFAULT}. */
    public static BarSize barSizeOrDefault(String raw) {
        return BarSize.parse(raw).orElseGet(() -> {
            log.warn("Unknown bar size '{}', using {}", raw, BarSize.DEFAULT);
            return BarSize.DEFAULT;
        });
    }

    public BackfillConfig withOutputDir(Path dir) {
        return new BackfillConfig(dir, throttleSpacing, requestTimeout, maxRetries, retryStep, backoff, chunkWindow, barSize, providerUri);
    }

    public BackfillConfig withThrottleSpacing(Duration spacing) {
        return new BackfillConfig(outputDir, spacing, requestTimeout, maxRetries, retryStep, backoff, chunkWindow, barSize, providerUri);
    }

    public BackfillConfig withChunkWindow(Period window) {
        return new BackfillConfig(outputDir, throttleSpacing, requestTimeout, maxRetries, retryStep, backoff, window, barSize, providerUri);
    }

    public BackfillConfig withBarSize(BarSize size) {
        return new BackfillConfig(outputDir, throttleSpacing, requestTimeout, maxRetries, retryStep, backoff, chunkWindow, size, providerUri);
    }

    private static String get(String prop, String env, String def) {
        return System.getProperty(prop, System.getenv().getOrDefault(env, def));
    }
}
