package io.backfill.financial.provider;

import io.backfill.financial.Chunk;
import io.backfill.financial.SecurityKind;
import io.backfill.financial.Symbol;

/**
 * The single logical connection to the provider. Not safe for concurrent use; callers serialize all requests.
 */
public interface ProviderSession extends AutoCloseable {
    void connect() throws ProviderConnectionException;

    /** Declared kind if any, otherwise inferred; UNKNOWN when the contract cannot be resolved. */
    SecurityKind resolveKind(Symbol symbol);

    /**
     * Issues one request bounded by the session's timeout. Never blocks indefinitely and never throws for
     * provider-side failures; those come back as a failed {@link BarsResponse}.
     */
    BarsResponse requestBars(Symbol symbol, Chunk chunk, SecurityKind kind);

    /** Idempotent. */
    void disconnect();

    boolean isConnected();

    @Override
    default void close() { disconnect(); }
}
