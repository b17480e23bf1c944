package com.candle.analyzer.loader;

import com.candle.analyzer.exception.MissingColumnException;
import com.candle.analyzer.model.Bar;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads OHLCV bars from a CSV file with a header row.
 *
 * Header names are matched case-insensitively against common aliases
 * ({@code Date, Timestamp, O, Adj Close, Vol, ...}). An optional
 * {@code trend} column is passed through to each bar unchanged.
 */
@Service
@Slf4j
public class CsvBarLoader {

    private static final Map<String, Column> ALIASES = Map.ofEntries(
            Map.entry("date", Column.DATE),
            Map.entry("time", Column.DATE),
            Map.entry("datetime", Column.DATE),
            Map.entry("timestamp", Column.DATE),
            Map.entry("open time", Column.DATE),
            Map.entry("open", Column.OPEN),
            Map.entry("o", Column.OPEN),
            Map.entry("high", Column.HIGH),
            Map.entry("h", Column.HIGH),
            Map.entry("low", Column.LOW),
            Map.entry("l", Column.LOW),
            Map.entry("close", Column.CLOSE),
            Map.entry("c", Column.CLOSE),
            Map.entry("adj close", Column.CLOSE),
            Map.entry("volume", Column.VOLUME),
            Map.entry("v", Column.VOLUME),
            Map.entry("vol", Column.VOLUME),
            Map.entry("tickvol", Column.VOLUME),
            Map.entry("trend", Column.TREND)
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy")
    );

    // Epoch values above this are taken as milliseconds
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    public List<Bar> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Bar> bars = read(reader);
            log.info("Loaded {} bars from {}", bars.size(), path);
            return bars;
        }
    }

    /**
     * Parses bars from CSV text and returns them in chronological order.
     * Rows with an unparseable date or price are skipped.
     */
    public List<Bar> read(Reader reader) throws IOException {
        try (CSVReader csv = new CSVReaderBuilder(reader).build()) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new MissingColumnException("date", "open", "high", "low", "close");
            }

            Map<Column, Integer> positions = resolveColumns(header);
            List<Bar> bars = new ArrayList<>();
            int skipped = 0;
            String[] row;

            while ((row = csv.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) {
                    continue;
                }
                Bar bar = toBar(row, positions);
                if (bar == null) {
                    skipped++;
                    continue;
                }
                bars.add(bar);
            }

            if (skipped > 0) {
                log.warn("Skipped {} unparseable rows", skipped);
            }

            bars.sort(Comparator.comparing(Bar::getTimestamp));
            return bars;
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV: " + e.getMessage(), e);
        }
    }

    /**
     * Timeframe from the median spacing between consecutive timestamps.
     */
    public Timeframe detectTimeframe(List<Bar> bars) {
        if (bars.size() < 2) {
            return Timeframe.UNKNOWN;
        }

        List<Duration> spacings = new ArrayList<>(bars.size() - 1);
        for (int i = 1; i < bars.size(); i++) {
            spacings.add(Duration.between(bars.get(i - 1).getTimestamp(), bars.get(i).getTimestamp()));
        }
        spacings.sort(Comparator.naturalOrder());

        int mid = spacings.size() / 2;
        Duration median = spacings.size() % 2 == 1
                ? spacings.get(mid)
                : spacings.get(mid - 1).plus(spacings.get(mid)).dividedBy(2);

        Timeframe timeframe = Timeframe.fromSpacing(median);
        log.debug("Median bar spacing {} -> timeframe {}", median, timeframe.getLabel());
        return timeframe;
    }

    private Map<Column, Integer> resolveColumns(String[] header) {
        Map<Column, Integer> positions = new EnumMap<>(Column.class);

        for (int i = 0; i < header.length; i++) {
            String name = normalize(header[i]);
            Column column = ALIASES.get(name);
            if (column == null) {
                continue;
            }
            // An exact canonical name wins over an alias such as "adj close"
            boolean canonical = name.equals(column.name().toLowerCase(Locale.ROOT));
            if (!positions.containsKey(column) || canonical) {
                positions.put(column, i);
            }
        }

        List<String> missing = new ArrayList<>();
        for (Column column : Column.values()) {
            if (column.required && !positions.containsKey(column)) {
                missing.add(column.name().toLowerCase(Locale.ROOT));
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnException(missing);
        }
        return positions;
    }

    private Bar toBar(String[] row, Map<Column, Integer> positions) {
        LocalDateTime timestamp = parseTimestamp(cell(row, positions.get(Column.DATE)));
        Double open = parseNumber(cell(row, positions.get(Column.OPEN)));
        Double high = parseNumber(cell(row, positions.get(Column.HIGH)));
        Double low = parseNumber(cell(row, positions.get(Column.LOW)));
        Double close = parseNumber(cell(row, positions.get(Column.CLOSE)));

        if (timestamp == null || open == null || high == null || low == null || close == null) {
            log.debug("Skipping row: {}", String.join(",", row));
            return null;
        }

        Double volume = parseNumber(cell(row, positions.get(Column.VOLUME)));
        String trend = cell(row, positions.get(Column.TREND));

        return Bar.builder()
                .timestamp(timestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume != null ? volume : 0.0)
                .trend(trend == null || trend.isBlank() ? null : trend.trim())
                .build();
    }

    private static String cell(String[] row, Integer position) {
        if (position == null || position >= row.length) {
            return null;
        }
        return row[position];
    }

    LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();

        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }

        if (text.length() <= 18 && text.chars().allMatch(Character::isDigit)) {
            long epoch = Long.parseLong(text);
            Instant instant = epoch > EPOCH_MILLIS_THRESHOLD
                    ? Instant.ofEpochMilli(epoch)
                    : Instant.ofEpochSecond(epoch);
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        return null;
    }

    static Double parseNumber(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalize(String header) {
        // Excel exports may prefix the first header with a byte-order mark
        return header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
    }

    private enum Column {
        DATE(true), OPEN(true), HIGH(true), LOW(true), CLOSE(true), VOLUME(false), TREND(false);

        private final boolean required;

        Column(boolean required) {
            this.required = required;
        }
    }
}
