package com.candle.analyzer.analysis;

import com.candle.analyzer.model.FeatureTable;

/**
 * Fully annotated table together with its summary.
 */
public record AnalysisReport(FeatureTable table, SummaryRecord summary) {}
