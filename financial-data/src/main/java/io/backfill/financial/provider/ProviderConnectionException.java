package io.backfill.financial.provider;

/**
 * The provider session could not be established. Fatal to a batch run.
 */
public class ProviderConnectionException extends Exception {
    public ProviderConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
