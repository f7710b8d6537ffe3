package io.backfill.financial;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized (trimmed, upper-cased) security identifier with its declared kind, UNKNOWN when not declared.
 */
public record Symbol(String ticker, SecurityKind kind) {
    static final char DELISTING_MARKER = '$';

    public Symbol {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(kind, "kind");
        ticker = normalize(ticker);
        if (ticker.isEmpty()) throw new IllegalArgumentException("blank ticker");
    }

    public static Symbol of(String ticker) { return new Symbol(ticker, SecurityKind.UNKNOWN); }

    /**
     * Parses a raw list entry. Blank entries and entries wrapped in the delisting marker yield empty.
     */
    public static Optional<Symbol> parse(String raw, SecurityKind declared) {
        if (raw == null) return Optional.empty();
        String t = normalize(raw);
        if (t.isEmpty() || isDelisted(t)) return Optional.empty();
        return Optional.of(new Symbol(t, declared == null ? SecurityKind.UNKNOWN : declared));
    }

    static boolean isDelisted(String raw) {
        String t = raw.trim();
        return t.length() >= 2 && t.charAt(0) == DELISTING_MARKER && t.charAt(t.length() - 1) == DELISTING_MARKER;
    }

    static String normalize(String raw) { return raw.trim().toUpperCase(Locale.ROOT); }

    public Symbol withKind(SecurityKind k) { return new Symbol(ticker, k); }

    @Override
    public String toString() { return ticker; }
}
