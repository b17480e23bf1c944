package com.candle.analyzer.service;

import com.candle.analyzer.analysis.AnalysisPipeline;
import com.candle.analyzer.analysis.AnalysisReport;
import com.candle.analyzer.loader.CsvBarLoader;
import com.candle.analyzer.loader.Timeframe;
import com.candle.analyzer.model.Bar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point.
 *
 * Flow:
 * 1. Bars loaded from the CSV given as first argument (or analyzer.input)
 * 2. AnalysisPipeline annotates the table and estimates the probability
 * 3. Annotated table and summary written to analyzer.output-dir
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisRunner implements ApplicationRunner {

    private final CsvBarLoader barLoader;
    private final AnalysisPipeline pipeline;
    private final AnnotatedTableExporter exporter;

    @Value("${analyzer.input:}")
    private String defaultInput;

    @Value("${analyzer.output-dir:.}")
    private String outputDir;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> positional = args.getNonOptionArgs();
        String input = !positional.isEmpty() ? positional.get(0) : defaultInput;

        if (input == null || input.isBlank()) {
            log.info("No input file given, nothing to analyze");
            return;
        }

        analyze(resolveInput(input), Path.of(outputDir));
    }

    public AnalysisReport analyze(Path input, Path outputDirectory) throws IOException {
        log.info("=== Starting analysis of {} ===", input);

        List<Bar> bars = barLoader.load(input);
        Timeframe timeframe = barLoader.detectTimeframe(bars);
        log.info("Detected timeframe: {}", timeframe.getLabel());

        AnalysisReport report = pipeline.run(bars);

        Files.createDirectories(outputDirectory);
        exporter.export(report,
                outputDirectory.resolve("annotated.csv"),
                outputDirectory.resolve("summary.txt"));

        log.info("=== Analysis complete ===\n{}", report.summary().toFormattedString());
        return report;
    }

    /**
     * A bare name resolves to data/&lt;name&gt;.csv.
     */
    static Path resolveInput(String input) {
        String name = input.trim();
        if (!name.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return Path.of("data", name + ".csv");
        }
        return Path.of(name);
    }
}
