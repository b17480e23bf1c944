package com.candle.analyzer.analysis;

import com.candle.analyzer.exception.InsufficientHistoryException;
import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.model.Field;
import com.candle.analyzer.regime.MomentumState;
import com.candle.analyzer.regime.VolatilityState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Estimates the probability that the next bar closes above its open by
 * looking up historical bars in the same state as the latest one.
 *
 * A historical row matches when:
 * 1. its trend equals the current trend (a missing trend never matches)
 * 2. its primary-pattern flag is set, unless the latest bar shows no pattern
 * 3. its momentum label equals the current momentum
 * 4. its volatility label equals the current volatility
 *
 * The outcome of a match is the bullish flag of the row right after it,
 * so the latest row never contributes.
 */
@Service
@Slf4j
public class AnalogProbabilityModel {

    public static final String NO_PATTERN = "none";

    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);
    private static final int SCALE = 2;

    private static final BigDecimal NEUTRAL_PROBABILITY = BigDecimal.valueOf(50).setScale(SCALE, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public ProbabilityResult estimate(FeatureTable table) {
        if (table == null || table.isEmpty()) {
            throw new InsufficientHistoryException(0, 1);
        }

        int last = table.lastIndex();
        Field primaryPattern = primaryPattern(table);
        String currentTrend = table.trend(last);
        MomentumState currentMomentum = table.momentum(last);
        VolatilityState currentVolatility = table.volatility(last);

        int matched = 0;
        int bullishNext = 0;

        for (int i = 0; i < last; i++) {
            if (!matches(table, i, primaryPattern, currentTrend, currentMomentum, currentVolatility)) {
                continue;
            }
            matched++;
            if (table.flag(Field.BULLISH, i + 1)) {
                bullishNext++;
            }
        }

        String patternName = primaryPattern != null ? primaryPattern.getKey() : NO_PATTERN;
        ProbabilityResult.ProbabilityResultBuilder result = ProbabilityResult.builder()
                .primaryPattern(patternName)
                .currentTrend(currentTrend)
                .currentMomentum(currentMomentum)
                .currentVolatility(currentVolatility)
                .matchedSamplesCount(matched)
                .bullishOutcomes(bullishNext);

        if (matched == 0) {
            log.info("No matching history for pattern={}, trend={}, momentum={}, volatility={}",
                    patternName, currentTrend, currentMomentum, currentVolatility);
            return result.probabilityUpPct(NEUTRAL_PROBABILITY).build();
        }

        BigDecimal probabilityUp = BigDecimal.valueOf(bullishNext)
                .divide(BigDecimal.valueOf(matched), MC)
                .multiply(HUNDRED)
                .setScale(SCALE, RoundingMode.HALF_UP);

        log.info("Analog analysis: pattern={}, trend={}, momentum={}, volatility={}, {} matched, {} bullish next, {}%",
                patternName, currentTrend, currentMomentum, currentVolatility, matched, bullishNext, probabilityUp);

        return result.probabilityUpPct(probabilityUp).build();
    }

    /**
     * Probability plus the latest regime labels in one record.
     */
    public SummaryRecord summary(FeatureTable table) {
        ProbabilityResult result = estimate(table);

        return SummaryRecord.builder()
                .probabilityNextBullish(result.getProbabilityUpPct())
                .lastTrend(result.getCurrentTrend())
                .lastMomentum(result.getCurrentMomentum())
                .lastVolatility(result.getCurrentVolatility())
                .primaryPattern(result.getPrimaryPattern())
                .detectedPatterns(detectedPatterns(table))
                .matchedSamples(result.getMatchedSamplesCount())
                .build();
    }

    /**
     * Keys of every pattern set on the latest row, in priority order.
     */
    public List<String> detectedPatterns(FeatureTable table) {
        int last = table.lastIndex();
        List<String> keys = new ArrayList<>();
        for (Field pattern : Field.PRIMARY_PATTERN_PRIORITY) {
            if (table.flag(pattern, last)) {
                keys.add(pattern.getKey());
            }
        }
        return keys;
    }

    /**
     * First pattern, in priority order, set on the latest row; null when none is.
     */
    public Field primaryPattern(FeatureTable table) {
        int last = table.lastIndex();
        for (Field pattern : Field.PRIMARY_PATTERN_PRIORITY) {
            if (table.flag(pattern, last)) {
                return pattern;
            }
        }
        return null;
    }

    private boolean matches(FeatureTable table, int row, Field primaryPattern, String trend,
                            MomentumState momentum, VolatilityState volatility) {
        if (trend == null || !Objects.equals(trend, table.trend(row))) {
            return false;
        }
        if (primaryPattern != null && !table.flag(primaryPattern, row)) {
            return false;
        }
        return table.momentum(row) == momentum && table.volatility(row) == volatility;
    }
}
