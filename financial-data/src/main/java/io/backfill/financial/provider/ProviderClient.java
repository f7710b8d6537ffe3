package io.backfill.financial.provider;

import io.backfill.financial.Bar;
import io.backfill.financial.BarSize;
import io.backfill.financial.SecurityKind;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Wire-level binding to the market-data provider. Implementations are not thread-safe and may block
 * indefinitely; {@link TimeBoundedProviderSession} supplies the timeouts.
 */
public interface ProviderClient {
    /** Establishes the connection; a {@link java.net.ConnectException} or other IOException if unreachable. */
    void open() throws IOException;

    /**
     * Bars for {@code [start, end]} inclusive. An empty list means the provider had nothing for the window.
     *
     * @throws ProviderException for failures the provider classifies (unknown security, entitlement, ...)
     * @throws IOException when the connection broke mid-request
     */
    List<Bar> fetchBars(String symbol, SecurityKind kind, LocalDate start, LocalDate end, BarSize barSize)
            throws ProviderException, IOException;

    void close();
}
