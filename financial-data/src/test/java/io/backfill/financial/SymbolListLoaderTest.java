package io.backfill.financial;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolListLoaderTest {
    @TempDir
    Path tmp;

    @Test
    void reads_first_column_and_skips_comments() throws Exception {
        Path file = tmp.resolve("symbols.txt");
        Files.writeString(file, "# watchlist\nAAPL\tApple Inc\n\nmsft,Microsoft\n  $LEH$  \nIBM NYSE\n", StandardCharsets.UTF_8);

        assertEquals(List.of("AAPL", "msft", "$LEH$", "IBM"), SymbolListLoader.load(file));
    }

    @Test
    void slices_with_one_based_start_and_max_count() {
        List<String> all = List.of("A", "B", "C", "D", "E");
        assertEquals(List.of("B", "C"), SymbolListLoader.slice(all, 2, 2));
        assertEquals(List.of("D", "E"), SymbolListLoader.slice(all, 4, 0));
        assertEquals(List.of(), SymbolListLoader.slice(all, 9, 3));
        assertThrows(IllegalArgumentException.class, () -> SymbolListLoader.slice(all, 0, 1));
    }
}
