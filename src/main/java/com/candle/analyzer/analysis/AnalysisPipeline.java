package com.candle.analyzer.analysis;

import com.candle.analyzer.model.Bar;
import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.regime.RegimeClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * bars -> indicators -> patterns -> regimes -> analog probability.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisPipeline {

    private final IndicatorEngine indicatorEngine;
    private final PatternDetector patternDetector;
    private final RegimeClassifier regimeClassifier;
    private final AnalogProbabilityModel probabilityModel;

    public AnalysisReport run(List<Bar> bars) {
        long startTime = System.currentTimeMillis();

        FeatureTable features = indicatorEngine.calculate(bars);
        FeatureTable patterns = patternDetector.detectAll(features);
        FeatureTable annotated = regimeClassifier.classify(patterns);
        SummaryRecord summary = probabilityModel.summary(annotated);

        log.info("Analysis complete in {}ms: {} rows, next bullish probability {}%",
                System.currentTimeMillis() - startTime, annotated.size(), summary.getProbabilityNextBullish());

        return new AnalysisReport(annotated, summary);
    }
}
