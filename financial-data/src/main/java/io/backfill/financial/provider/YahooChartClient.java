package io.backfill.financial.provider;

import io.backfill.financial.Bar;
import io.backfill.financial.BarSize;
import io.backfill.financial.FailureKind;
import io.backfill.financial.SecurityKind;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches daily, weekly or monthly bars from the Yahoo Finance v8 chart API. Index symbols go over the wire with
 * a {@code ^} prefix. The adjusted close is used when the response carries one.
 */
public class YahooChartClient implements ProviderClient {
    public static final URI DEFAULT_BASE_URI = URI.create("https://query1.finance.yahoo.com");

    private static final Pattern NOT_FOUND = Pattern.compile("\"code\"\\s*:\\s*\"Not Found\"");

    private final URI baseUri;
    private final Duration httpTimeout;
    private volatile HttpClient http;

    public YahooChartClient(URI baseUri, Duration httpTimeout) {
        this.baseUri = baseUri;
        this.httpTimeout = httpTimeout;
    }

    @Override
    public void open() throws IOException {
        HttpClient c = HttpClient.newBuilder().connectTimeout(httpTimeout).build();
        HttpRequest probe = HttpRequest.newBuilder(baseUri.resolve("/"))
                .timeout(httpTimeout)
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        try {
            // any HTTP answer proves the endpoint is reachable
            c.send(probe, HttpResponse.BodyHandlers.discarding());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while connecting to " + baseUri);
        }
        this.http = c;
    }

    @Override
    public List<Bar> fetchBars(String symbol, SecurityKind kind, LocalDate start, LocalDate end, BarSize barSize)
            throws ProviderException, IOException {
        HttpClient c = http;
        if (c == null) throw new IOException("client is not open");
        long p1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = end.plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC) - 1; // inclusive end
        String url = String.format("%s/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d&events=history&includeAdjustedClose=true",
                trimSlash(baseUri.toString()),
                URLEncoder.encode(wireSymbol(symbol, kind), StandardCharsets.UTF_8),
                URLEncoder.encode(barSize.interval(), StandardCharsets.UTF_8),
                p1, p2);
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(httpTimeout)
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = c.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(FailureKind.REQUEST_TIMEOUT, "http timeout for " + symbol, e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while fetching " + symbol);
        }
        int status = resp.statusCode();
        String body = resp.body() == null ? "" : resp.body();
        if (status != 200) {
            throw new ProviderException(classify(status, body), "http " + status + " for " + symbol + " " + start + ".." + end);
        }
        if (NOT_FOUND.matcher(body).find()) {
            throw new ProviderException(FailureKind.UNRESOLVABLE_SECURITY, "provider does not know " + symbol);
        }
        return parseBars(body, start, end);
    }

    @Override
    public void close() {
        http = null;
    }

    static FailureKind classify(int status, String body) {
        if (status == 404 || NOT_FOUND.matcher(body).find()) return FailureKind.UNRESOLVABLE_SECURITY;
        if (status == 401 || status == 403) return FailureKind.ENTITLEMENT_DENIED;
        if (status == 400 || status == 422) return FailureKind.MALFORMED_RANGE;
        if (status == 429 || status >= 500) return FailureKind.SESSION_CONGESTION;
        return FailureKind.UNEXPECTED;
    }

    static String wireSymbol(String symbol, SecurityKind kind) {
        if (kind == SecurityKind.INDEX && !symbol.startsWith("^")) return "^" + symbol;
        return symbol;
    }

    static List<Bar> parseBars(String body, LocalDate start, LocalDate end) {
        long[] timestamps = extractLongArray(body, "\"timestamp\"\\s*:");
        double[] open = extractDoubleArray(body, "\"open\"\\s*:");
        double[] high = extractDoubleArray(body, "\"high\"\\s*:");
        double[] low = extractDoubleArray(body, "\"low\"\\s*:");
        double[] close = extractDoubleArray(body, "\"close\"\\s*:");
        double[] adjClose = extractDoubleArray(body, "\"adjclose\"\\s*:");
        long[] volume = extractLongArray(body, "\"volume\"\\s*:");

        int n = Math.min(timestamps.length,
                Math.min(open.length, Math.min(high.length, Math.min(low.length, Math.min(close.length, volume.length)))));
        boolean adjusted = adjClose.length >= n && n > 0;

        List<Bar> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            LocalDate d = Instant.ofEpochSecond(timestamps[i]).atZone(ZoneOffset.UTC).toLocalDate();
            if (d.isBefore(start) || d.isAfter(end)) continue;
            double c = adjusted && !Double.isNaN(adjClose[i]) ? adjClose[i] : close[i];
            if (Double.isNaN(c)) continue; // placeholder row without prices
            out.add(new Bar(d, open[i], high[i], low[i], c, volume[i]));
        }
        return out;
    }

    // Very narrow JSON array extraction for flat numeric arrays like: "timestamp":[1696118400, ...]
    private static long[] extractLongArray(String json, String keyRegex) {
        Optional<String> arr = extractArray(json, keyRegex);
        if (arr.isEmpty() || arr.get().isBlank()) return new long[0];
        String[] parts = arr.get().split(",");
        long[] out = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i].trim();
            if (p.equals("null") || p.isEmpty()) out[i] = 0L; else out[i] = (long) Double.parseDouble(p);
        }
        return out;
    }

    private static double[] extractDoubleArray(String json, String keyRegex) {
        Optional<String> arr = extractArray(json, keyRegex);
        if (arr.isEmpty() || arr.get().isBlank()) return new double[0];
        String[] parts = arr.get().split(",");
        double[] out = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i].trim();
            if (p.equals("null") || p.isEmpty()) out[i] = Double.NaN; else out[i] = Double.parseDouble(p);
        }
        return out;
    }

    private static Optional<String> extractArray(String json, String keyRegex) {
        // skip object-wrapped arrays such as "adjclose":[{"adjclose":[...]}]
        Pattern p = Pattern.compile(keyRegex + "\\s*\\[([^\\[\\]{}]*)\\]", Pattern.DOTALL);
        Matcher m = p.matcher(json);
        if (m.find()) {
            return Optional.ofNullable(m.group(1));
        }
        return Optional.empty();
    }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
