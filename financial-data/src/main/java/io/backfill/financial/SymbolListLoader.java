package io.backfill.financial;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads raw symbol entries from a text file: the first column of every line, columns separated by whitespace or
 * commas. Blank lines and {@code #} comments are ignored. Entries are returned raw; cleaning happens in
 * {@link SymbolList}.
 */
public final class SymbolListLoader {
    private SymbolListLoader() {}

    public static List<String> load(Path file) throws IOException {
        List<String> out = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String s = line.strip();
                if (s.isEmpty() || s.startsWith("#")) continue;
                String first = s.split("[\\s,]+", 2)[0];
                if (!first.isEmpty()) out.add(first);
            }
        }
        return out;
    }

    /**
     * @param startFrom 1-based position of the first entry to keep
     * @param maxCount  keep at most this many entries; {@code <= 0} keeps all
     */
    public static List<String> slice(List<String> entries, int startFrom, int maxCount) {
        if (startFrom < 1) throw new IllegalArgumentException("start-from is 1-based: " + startFrom);
        int from = Math.min(entries.size(), startFrom - 1);
        int to = maxCount > 0 ? Math.min(entries.size(), from + maxCount) : entries.size();
        return List.copyOf(entries.subList(from, to));
    }
}
