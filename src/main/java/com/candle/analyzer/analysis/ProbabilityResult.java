package com.candle.analyzer.analysis;

import com.candle.analyzer.regime.MomentumState;
import com.candle.analyzer.regime.VolatilityState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProbabilityResult {

    // Percentage in [0, 100], two decimals
    private BigDecimal probabilityUpPct;

    private int matchedSamplesCount;
    private int bullishOutcomes;

    // Conditions of the latest bar the history was matched against
    private String primaryPattern;
    private String currentTrend;
    private MomentumState currentMomentum;
    private VolatilityState currentVolatility;

    public boolean hasSamples() {
        return matchedSamplesCount > 0;
    }
}
