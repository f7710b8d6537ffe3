package io.backfill.financial;

public enum SecurityKind {
    EQUITY,
    INDEX,
    /** Not declared, or could not be inferred. A symbol that stays UNKNOWN is never requested. */
    UNKNOWN
}
