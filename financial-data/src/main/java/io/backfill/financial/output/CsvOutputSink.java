package io.backfill.financial.output;

import io.backfill.financial.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes {@code <SYMBOL>.csv} (UTF-8, comma separated, header row) into the output directory. The file is written
 * to a temporary sibling first and moved into place, so a crash never leaves a half-written series behind.
 */
public class CsvOutputSink implements OutputSink {
    private static final Logger log = LoggerFactory.getLogger(CsvOutputSink.class);

    public static final String HEADER = "date,open,high,low,close,volume";

    @Override
    public Path write(String symbol, List<Bar> bars, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path out = outputDir.resolve(fileName(symbol));
        Path tmp = Files.createTempFile(outputDir, "." + fileName(symbol), ".tmp");
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(HEADER);
                w.write('\n');
                for (Bar b : bars) {
                    w.write(row(b));
                    w.write('\n');
                }
            }
            try {
                Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("wrote {} rows to {}", bars.size(), out);
        return out;
    }

    /**
     * Index symbols lose their {@code ^} prefix. Any other character outside {@code [A-Za-z0-9.-]}, {@code _}
     * included, is written as {@code _XX} (hex), so distinct symbols never share a file.
     */
    static String fileName(String symbol) {
        String s = symbol.startsWith("^") ? symbol.substring(1) : symbol;
        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (char c : s.toCharArray()) {
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '-') {
                sb.append(c);
            } else {
                sb.append('_').append(String.format("%02X", (int) c));
            }
        }
        return sb.append(".csv").toString();
    }

    static String row(Bar b) {
        return b.date() + "," + num(b.open()) + "," + num(b.high()) + "," + num(b.low()) + "," + num(b.close()) + "," + b.volume();
    }

    private static String num(double d) {
        if (Double.isNaN(d)) return "";
        return Double.toString(d);
    }
}
