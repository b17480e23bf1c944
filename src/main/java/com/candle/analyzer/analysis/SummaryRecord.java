package com.candle.analyzer.analysis;

import com.candle.analyzer.regime.MomentumState;
import com.candle.analyzer.regime.VolatilityState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Headline result handed to reporting.
 */
@Value
@Builder
public class SummaryRecord {

    private static final String NONE = "none";

    BigDecimal probabilityNextBullish;
    String lastTrend;
    MomentumState lastMomentum;
    VolatilityState lastVolatility;
    String primaryPattern;
    @Builder.Default
    List<String> detectedPatterns = List.of();
    int matchedSamples;

    public String toFormattedString() {
        return String.format(
                "Trend: %s\n" +
                "Momentum: %s\n" +
                "Volatility: %s\n" +
                "Primary pattern: %s\n" +
                "Detected patterns: %s\n" +
                "Matched samples: %d\n" +
                "Probability of next bullish candle: %s%%",
                lastTrend != null ? lastTrend : NONE, lastMomentum.getLabel(), lastVolatility.getLabel(),
                primaryPattern, detectedPatterns.isEmpty() ? NONE : String.join(", ", detectedPatterns),
                matchedSamples, probabilityNextBullish.toPlainString()
        );
    }
}
