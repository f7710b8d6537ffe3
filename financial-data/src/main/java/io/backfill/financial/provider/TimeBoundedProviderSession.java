package io.backfill.financial.provider;

import io.backfill.financial.Bar;
import io.backfill.financial.BarSize;
import io.backfill.financial.Chunk;
import io.backfill.financial.DateRange;
import io.backfill.financial.FailureKind;
import io.backfill.financial.SecurityKind;
import io.backfill.financial.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProviderSession} over a blocking {@link ProviderClient}. Each request runs on a dedicated worker thread and
 * is abandoned after {@code requestTimeout}: the provider is known to stall forever on some requests. A stalled
 * worker is discarded and the client reconnected, so the next request starts on a clean connection.
 */
public class TimeBoundedProviderSession implements ProviderSession {
    private static final Logger log = LoggerFactory.getLogger(TimeBoundedProviderSession.class);

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(45);

    private static final AtomicInteger WORKER_SEQ = new AtomicInteger();

    private final ProviderClient client;
    private final SecurityKindResolver resolver;
    private final BarSize barSize;
    private final Duration requestTimeout;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private ExecutorService worker;
    private int reconnects = 0;

    public TimeBoundedProviderSession(ProviderClient client, SecurityKindResolver resolver, BarSize barSize, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.barSize = Objects.requireNonNull(barSize, "barSize");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("request timeout must be positive: " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
    }

    @Override
    public synchronized void connect() throws ProviderConnectionException {
        if (connected.get()) return;
        try {
            client.open();
        } catch (IOException e) {
            throw new ProviderConnectionException("provider unreachable: " + e.getMessage(), e);
        }
        worker = newWorker();
        connected.set(true);
        log.info("provider session connected (barSize={}, requestTimeout={})", barSize, requestTimeout);
    }

    @Override
    public SecurityKind resolveKind(Symbol symbol) {
        return resolver.resolve(symbol);
    }

    @Override
    public synchronized BarsResponse requestBars(Symbol symbol, Chunk chunk, SecurityKind kind) {
        if (!connected.get()) throw new IllegalStateException("provider session is not connected");
        if (kind == null || kind == SecurityKind.UNKNOWN) {
            return BarsResponse.failed(FailureKind.UNRESOLVABLE_SECURITY, "cannot resolve security kind of " + symbol);
        }
        DateRange r = chunk.range();
        Future<List<Bar>> f = worker.submit(() -> client.fetchBars(symbol.ticker(), kind, r.start(), r.end(), barSize));
        try {
            return BarsResponse.ok(f.get(requestTimeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("{} {}: no response within {}, abandoning request", symbol, chunk, requestTimeout);
            return recycle(FailureKind.REQUEST_TIMEOUT, "no response within " + requestTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                if (pe.kind() == FailureKind.NO_DATA) return BarsResponse.ok(List.of());
                return BarsResponse.failed(pe.kind(), pe.getMessage());
            }
            if (cause instanceof IOException) {
                log.warn("{} {}: connection failure: {}", symbol, chunk, cause.toString());
                return recycle(FailureKind.CONNECTION_LOST, cause.toString());
            }
            log.error("{} {}: provider client failed unexpectedly", symbol, chunk, cause);
            return BarsResponse.failed(FailureKind.UNEXPECTED, String.valueOf(cause));
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            return BarsResponse.failed(FailureKind.CANCELLED, "interrupted while waiting for provider");
        }
    }

    @Override
    public synchronized void disconnect() {
        if (!connected.compareAndSet(true, false)) return;
        worker.shutdownNow();
        client.close();
        log.info("provider session disconnected (reconnects={})", reconnects);
    }

    @Override
    public boolean isConnected() { return connected.get(); }

    public synchronized int reconnects() { return reconnects; }

    private BarsResponse recycle(FailureKind kind, String detail) {
        worker.shutdownNow();
        client.close();
        worker = newWorker();
        try {
            client.open();
            reconnects++;
        } catch (IOException e) {
            log.warn("provider reconnect failed: {}", e.toString());
            return BarsResponse.failed(kind, detail + "; reconnect failed: " + e.getMessage());
        }
        return BarsResponse.failed(kind, detail);
    }

    private static ExecutorService newWorker() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "provider-request-" + WORKER_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
