package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses per-symbol bar files.
 * Expected format: Date,Open,High,Low,Close,Volume[,Adj Close] with a header row.
 * Records are returned sorted ascending by timestamp regardless of file order.
 */
@Slf4j
public final class BarCsvReader {

    private static final DateTimeFormatter[] DATE_TIME_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    };

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    private BarCsvReader() {
    }

    /**
     * Read the bar file for a symbol.
     *
     * @throws BacktestConfigurationException if the file is missing or unreadable
     */
    public static List<Bar> read(String symbol, Path file) {
        if (!Files.isReadable(file)) {
            throw new BacktestConfigurationException(
                    String.format("Bar file for %s not found or unreadable: %s", symbol, file));
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(symbol, in);
        } catch (IOException e) {
            throw new BacktestConfigurationException(
                    String.format("Failed to read bar file for %s: %s", symbol, file), e);
        }
    }

    /**
     * Parse bars from a stream. Unparseable lines are logged and skipped.
     */
    public static List<Bar> read(String symbol, InputStream inputStream) throws IOException {
        List<Bar> bars = new ArrayList<>();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean isFirstLine = true;

            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }

                // Skip header row
                if (isFirstLine) {
                    isFirstLine = false;
                    if (line.toLowerCase().contains("date")) {
                        continue;
                    }
                }

                Bar bar = parseLine(symbol, line);
                if (bar != null) {
                    bars.add(bar);
                }
            }
        }

        bars.sort(Comparator.comparing(Bar::getTimestamp));
        log.debug("Parsed {} bars for {}", bars.size(), symbol);
        return bars;
    }

    private static Bar parseLine(String symbol, String line) {
        String[] parts = line.split(",");

        if (parts.length < 6) {
            log.warn("Invalid bar line format (expected 6+ columns): {}", line);
            return null;
        }

        try {
            LocalDateTime timestamp = parseTimestamp(parts[0].trim());
            BigDecimal close = new BigDecimal(parts[4].trim());
            BigDecimal adjClose = parts.length > 6 && !parts[6].isBlank()
                    ? new BigDecimal(parts[6].trim())
                    : close;

            return Bar.builder()
                    .symbol(symbol)
                    .timestamp(timestamp)
                    .open(new BigDecimal(parts[1].trim()))
                    .high(new BigDecimal(parts[2].trim()))
                    .low(new BigDecimal(parts[3].trim()))
                    .close(close)
                    .volume(new BigDecimal(parts[5].trim()).longValue())
                    .adjClose(adjClose)
                    .build();

        } catch (RuntimeException e) {
            log.warn("Failed to parse values from line: {} - Error: {}", line, e.getMessage());
            return null;
        }
    }

    /**
     * Parse a timestamp, accepting either a date-time or a plain date (start of day).
     */
    static LocalDateTime parseTimestamp(String value) {
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return LocalDateTime.parse(value, formatter);
            } catch (DateTimeParseException e) {
                // Try next formatter
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter).atStartOfDay();
            } catch (DateTimeParseException e) {
                // Try next formatter
            }
        }
        throw new IllegalArgumentException("Unable to parse date: " + value);
    }
}
