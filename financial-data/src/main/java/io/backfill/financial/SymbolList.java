package io.backfill.financial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cleaned processing list: blank and delisting-marked entries dropped, duplicates collapsed onto their first
 * occurrence, relative order kept.
 */
public final class SymbolList {
    public static final String DELISTED = "delisted";

    private final List<Symbol> symbols;
    private final Map<String, String> skipped;

    private SymbolList(List<Symbol> symbols, Map<String, String> skipped) {
        this.symbols = Collections.unmodifiableList(symbols);
        this.skipped = Collections.unmodifiableMap(skipped);
    }

    public static SymbolList clean(List<String> raw) { return clean(raw, SecurityKind.UNKNOWN); }

    public static SymbolList clean(List<String> raw, SecurityKind declared) {
        List<Symbol> out = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String entry : raw) {
            if (entry == null || entry.isBlank()) continue;
            if (Symbol.isDelisted(entry)) {
                skipped.putIfAbsent(entry.trim(), DELISTED);
                continue;
            }
            Optional<Symbol> s = Symbol.parse(entry, declared);
            if (s.isPresent() && seen.add(s.get().ticker())) out.add(s.get());
        }
        return new SymbolList(out, skipped);
    }

    public List<Symbol> symbols() { return symbols; }

    public List<String> tickers() { return symbols.stream().map(Symbol::ticker).toList(); }

    /** Raw entries excluded before fetching, with the reason. */
    public Map<String, String> skipped() { return skipped; }
}
