package io.backfill.financial;

import io.backfill.retry.ErrorClass;

/**
 * Why a request or a whole symbol failed. Every kind carries the fixed reason string reported to users.
 */
public enum FailureKind {
    REQUEST_TIMEOUT("request timeout", ErrorClass.TRANSIENT),
    SESSION_CONGESTION("session congestion", ErrorClass.TRANSIENT),
    CONNECTION_LOST("connection lost", ErrorClass.TRANSIENT),
    UNRESOLVABLE_SECURITY("unresolvable security", ErrorClass.TERMINAL),
    ENTITLEMENT_DENIED("entitlement denied", ErrorClass.TERMINAL),
    MALFORMED_RANGE("malformed date range", ErrorClass.TERMINAL),
    NO_DATA("no data", ErrorClass.TERMINAL),
    CANCELLED("cancelled", ErrorClass.TERMINAL),
    OUTPUT_FAILED("output write failed", ErrorClass.TERMINAL),
    UNEXPECTED("unexpected error", ErrorClass.TERMINAL);

    private final String reason;
    private final ErrorClass errorClass;

    FailureKind(String reason, ErrorClass errorClass) {
        this.reason = reason;
        this.errorClass = errorClass;
    }

    public String reason() { return reason; }

    public ErrorClass errorClass() { return errorClass; }

    public boolean isTransient() { return errorClass == ErrorClass.TRANSIENT; }
}
