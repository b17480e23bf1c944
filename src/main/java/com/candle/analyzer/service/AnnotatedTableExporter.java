package com.candle.analyzer.service;

import com.candle.analyzer.analysis.AnalysisReport;
import com.candle.analyzer.analysis.SummaryRecord;
import com.candle.analyzer.model.Bar;
import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.model.Field;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes an analysis to disk: the annotated table as CSV (raw OHLCV, every
 * indicator, every pattern flag and the regime labels) and the summary as text.
 */
@Service
@Slf4j
public class AnnotatedTableExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Export result containing file path and statistics.
     */
    public record ExportResult(
            String filePath,
            int rowsExported,
            int columnsCount,
            long executionTimeMs
    ) {
        public String toFormattedString() {
            return String.format(
                    "Table Export Complete\n" +
                    "File: %s\n" +
                    "Rows: %d\n" +
                    "Columns: %d\n" +
                    "Time: %dms",
                    filePath, rowsExported, columnsCount, executionTimeMs
            );
        }
    }

    public ExportResult exportTable(FeatureTable table, Path path) throws IOException {
        long startTime = System.currentTimeMillis();

        int columns;
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            columns = writeTable(table, writer);
        }

        long executionTime = System.currentTimeMillis() - startTime;
        log.info("Exported {} rows to {} in {}ms", table.size(), path, executionTime);

        return new ExportResult(path.toString(), table.size(), columns, executionTime);
    }

    /**
     * Writes the header and one line per row.
     *
     * @return number of columns written
     */
    public int writeTable(FeatureTable table, Writer out) {
        List<Field> fields = exportedFields(table);
        PrintWriter writer = new PrintWriter(out);

        List<String> header = new ArrayList<>(List.of("date", "open", "high", "low", "close", "volume", "trend"));
        fields.forEach(f -> header.add(f.getKey()));
        if (table.hasRegimes()) {
            header.add("momentum_state");
            header.add("volatility_state");
        }
        writer.println(String.join(",", header));

        for (int i = 0; i < table.size(); i++) {
            writer.println(formatRow(table, i, fields));
        }
        writer.flush();

        return header.size();
    }

    public void exportSummary(SummaryRecord summary, Path path) throws IOException {
        Files.writeString(path, summary.toFormattedString() + System.lineSeparator(), StandardCharsets.UTF_8);
        log.info("Summary written to {}", path);
    }

    public void export(AnalysisReport report, Path tablePath, Path summaryPath) throws IOException {
        exportTable(report.table(), tablePath);
        exportSummary(report.summary(), summaryPath);
    }

    private List<Field> exportedFields(FeatureTable table) {
        List<Field> fields = new ArrayList<>();
        for (Field field : Field.values()) {
            if (table.has(field)) {
                fields.add(field);
            }
        }
        return fields;
    }

    private String formatRow(FeatureTable table, int row, List<Field> fields) {
        Bar bar = table.bar(row);
        List<String> cells = new ArrayList<>();

        cells.add(bar.getTimestamp().format(TIMESTAMP_FORMAT));
        cells.add(formatNumber(bar.getOpen()));
        cells.add(formatNumber(bar.getHigh()));
        cells.add(formatNumber(bar.getLow()));
        cells.add(formatNumber(bar.getClose()));
        cells.add(formatNumber(bar.volumeOrZero()));
        cells.add(escapeCSV(bar.getTrend()));

        for (Field field : fields) {
            if (field.isFlag()) {
                cells.add(table.flag(field, row) ? "1" : "0");
            } else {
                cells.add(formatNumber(table.value(field, row)));
            }
        }

        if (table.hasRegimes()) {
            cells.add(table.momentum(row).getLabel());
            cells.add(table.volatility(row).getLabel());
        }
        return String.join(",", cells);
    }

    private String escapeCSV(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

        private String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
