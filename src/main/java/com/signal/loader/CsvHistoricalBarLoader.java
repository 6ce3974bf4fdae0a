package com.signal.loader;

import com.signal.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads 1-minute bars from a CSV file with the columns
 * {@code timestamp,open,high,low,close,volume} (timestamp in Unix milliseconds).
 *
 * <p>A header line and blank lines are skipped. Malformed rows are logged and skipped.
 * Enabled by setting {@code signal.history.csv}.
 */
@Component
@ConditionalOnProperty(name = "signal.history.csv")
public class CsvHistoricalBarLoader implements HistoricalBarLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvHistoricalBarLoader.class);

    private final Path path;

    public CsvHistoricalBarLoader(@Value("${signal.history.csv}") Path path) {
        this.path = path;
    }

    @Override
    public List<Bar> load() throws IOException {
        List<Bar> bars = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || Character.isLetter(trimmed.charAt(0))) continue;
                try {
                    bars.add(parse(trimmed));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping malformed bar at {}:{}: {}", path, lineNumber, e.getMessage());
                }
            }
        }
        bars.sort(Comparator.comparingLong(Bar::timestamp));
        return bars;
    }

    @Override
    public String describe() {
        return path.toString();
    }

    static Bar parse(String line) {
        String[] cols = line.split(",");
        if (cols.length < 5) {
            throw new IllegalArgumentException("expected at least 5 columns, got " + cols.length);
        }
        double volume = cols.length > 5 && !cols[5].isBlank() ? Double.parseDouble(cols[5].trim()) : 0.0;
        return new Bar(
                Long.parseLong(cols[0].trim()),
                Double.parseDouble(cols[1].trim()),
                Double.parseDouble(cols[2].trim()),
                Double.parseDouble(cols[3].trim()),
                Double.parseDouble(cols[4].trim()),
                volume);
    }
}
