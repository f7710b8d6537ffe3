package io.backfill.financial.provider;

import io.backfill.financial.FailureKind;

import java.util.Objects;

/**
 * A classified failure reported by the provider for one request.
 */
public class ProviderException extends Exception {
    private final FailureKind kind;

    public ProviderException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ProviderException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() { return kind; }
}
