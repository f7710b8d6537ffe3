package io.backfill.financial.provider;

import io.backfill.financial.SecurityKind;
import io.backfill.financial.Symbol;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the security kind of a symbol once, before any request is planned.
 */
public class SecurityKindResolver {
    static final Set<String> KNOWN_INDICES = Set.of("NDX", "SPX", "RUT", "VIX", "DJI", "IXIC", "COMPX", "NYA", "OEX");

    private static final Pattern INDEX = Pattern.compile("\\^[A-Z0-9.]{1,10}");
    private static final Pattern EQUITY = Pattern.compile("[A-Z][A-Z0-9.\\-]{0,9}");

    private final Set<String> indices;

    public SecurityKindResolver() { this(KNOWN_INDICES); }

    public SecurityKindResolver(Set<String> indices) { this.indices = Set.copyOf(indices); }

    public SecurityKind resolve(Symbol symbol) {
        if (symbol.kind() != SecurityKind.UNKNOWN) return symbol.kind();
        String t = symbol.ticker();
        if (indices.contains(t) || INDEX.matcher(t).matches()) return SecurityKind.INDEX;
        if (EQUITY.matcher(t).matches()) return SecurityKind.EQUITY;
        return SecurityKind.UNKNOWN;
    }
}
