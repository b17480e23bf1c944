package com.candle.analyzer.analysis;

import com.candle.analyzer.BarFixtures;
import com.candle.analyzer.exception.InsufficientHistoryException;
import com.candle.analyzer.exception.MissingColumnException;
import com.candle.analyzer.model.Bar;
import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.model.Field;
import com.candle.analyzer.regime.MomentumState;
import com.candle.analyzer.regime.VolatilityState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AnalogProbabilityModel Tests")
class AnalogProbabilityModelTest {

    private static final MomentumState BUL = MomentumState.BULLISH;
    private static final MomentumState BEAR = MomentumState.BEARISH;
    private static final VolatilityState NORM = VolatilityState.NORMAL;

    private AnalogProbabilityModel model;

    @BeforeEach
    void setUp() {
        model = new AnalogProbabilityModel();
    }

    /**
     * Hand-built annotated table. Every pattern flag starts false.
     */
    private static final class AnnotatedTable {

        private final String[] trends;
        private final boolean[] bullish;
        private final Map<Field, boolean[]> patterns = new EnumMap<>(Field.class);
        private final MomentumState[] momentum;
        private final VolatilityState[] volatility;

        AnnotatedTable(String... trends) {
            int n = trends.length;
            this.trends = trends;
            this.bullish = new boolean[n];
            this.momentum = new MomentumState[n];
            this.volatility = new VolatilityState[n];
            Arrays.fill(momentum, BUL);
            Arrays.fill(volatility, NORM);
            for (Field pattern : Field.PRIMARY_PATTERN_PRIORITY) {
                patterns.put(pattern, new boolean[n]);
            }
        }

        AnnotatedTable pattern(Field field, int... rows) {
            for (int row : rows) {
                patterns.get(field)[row] = true;
            }
            return this;
        }

        AnnotatedTable bullish(int... rows) {
            for (int row : rows) {
                bullish[row] = true;
            }
            return this;
        }

        AnnotatedTable momentum(int row, MomentumState state) {
            momentum[row] = state;
            return this;
        }

        AnnotatedTable volatility(int row, VolatilityState state) {
            volatility[row] = state;
            return this;
        }

        FeatureTable build() {
            return builder().regimes(momentum, volatility).build();
        }

        FeatureTable buildWithoutRegimes() {
            return builder().build();
        }

        private FeatureTable.Builder builder() {
            List<Bar> bars = new ArrayList<>();
            for (int i = 0; i < trends.length; i++) {
                bars.add(BarFixtures.bar(i, 10, 11, 9, 10).toBuilder().trend(trends[i]).build());
            }
            boolean[] bearish = new boolean[trends.length];
            for (int i = 0; i < bearish.length; i++) {
                bearish[i] = !bullish[i];
            }

            FeatureTable.Builder builder = FeatureTable.builder(bars)
                    .flag(Field.BULLISH, bullish)
                    .flag(Field.BEARISH, bearish);
            patterns.forEach(builder::flag);
            return builder;
        }
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Counts bullish next bars among rows in the same state")
        void twoOfThree() {
            FeatureTable table = new AnnotatedTable("up", "up", "up", "down", "up", "up", "up", "up")
                    .pattern(Field.HAMMER, 0, 2, 3, 4, 6, 7)
                    .bullish(1, 3, 6)
                    .momentum(6, BEAR)
                    .build();

            ProbabilityResult result = model.estimate(table);

            assertEquals(3, result.getMatchedSamplesCount());
            assertEquals(2, result.getBullishOutcomes());
            assertEquals(new BigDecimal("66.67"), result.getProbabilityUpPct());
            assertEquals("hammer", result.getPrimaryPattern());
            assertEquals("up", result.getCurrentTrend());
            assertTrue(result.hasSamples());
        }

        @Test
        @DisplayName("A match on the second to last row takes its outcome from the last row")
        void matchBeforeLastRow() {
            FeatureTable table = new AnnotatedTable("up", "up", "up")
                    .pattern(Field.HAMMER, 1, 2)
                    .bullish(2)
                    .build();

            ProbabilityResult result = model.estimate(table);

            assertEquals(1, result.getMatchedSamplesCount());
            assertEquals(new BigDecimal("100.00"), result.getProbabilityUpPct());
        }

        @Test
        @DisplayName("Volatility must match too")
        void volatilityFilter() {
            FeatureTable table = new AnnotatedTable("up", "up", "up", "up")
                    .pattern(Field.HAMMER, 0, 1, 3)
                    .volatility(0, VolatilityState.HIGH)
                    .bullish(1)
                    .build();

            ProbabilityResult result = model.estimate(table);

            // row 0 is filtered out, row 1 is followed by a bearish bar
            assertEquals(1, result.getMatchedSamplesCount());
            assertEquals(new BigDecimal("0.00"), result.getProbabilityUpPct());
        }

        @Test
        @DisplayName("Without a current pattern every row in the same state is a sample")
        void noPattern() {
            FeatureTable table = new AnnotatedTable("up", "up", "up", "up", "up")
                    .pattern(Field.INSIDE_BAR, 1)
                    .bullish(1, 2)
                    .build();

            ProbabilityResult result = model.estimate(table);

            assertEquals(AnalogProbabilityModel.NO_PATTERN, result.getPrimaryPattern());
            assertEquals(4, result.getMatchedSamplesCount());
            assertEquals(new BigDecimal("50.00"), result.getProbabilityUpPct());
        }

        @Test
        @DisplayName("The latest row never counts as its own sample")
        void lastRowExcluded() {
            FeatureTable table = new AnnotatedTable("up", "down")
                    .pattern(Field.HAMMER, 1)
                    .build();

            ProbabilityResult result = model.estimate(table);

            assertEquals(0, result.getMatchedSamplesCount());
            assertFalse(result.hasSamples());
        }
    }

    @Nested
    @DisplayName("Fallbacks")
    class FallbackTests {

        @Test
        @DisplayName("No matching history gives the neutral 50.00")
        void noMatches() {
            FeatureTable table = new AnnotatedTable("down", "down", "up")
                    .pattern(Field.SHOOTING_STAR, 2)
                    .bullish(0, 1)
                    .build();

            ProbabilityResult result = model.estimate(table);

            assertEquals(new BigDecimal("50.00"), result.getProbabilityUpPct());
            assertEquals(0, result.getMatchedSamplesCount());
        }

        @Test
        @DisplayName("A missing current trend never matches")
        void missingTrend() {
            FeatureTable table = new AnnotatedTable(null, null, null)
                    .bullish(1, 2)
                    .build();

            ProbabilityResult result = model.estimate(table);

            assertNull(result.getCurrentTrend());
            assertEquals(0, result.getMatchedSamplesCount());
            assertEquals(new BigDecimal("50.00"), result.getProbabilityUpPct());
        }

        @Test
        @DisplayName("An empty table is rejected")
        void emptyTable() {
            assertThatThrownBy(() -> model.estimate(FeatureTable.of(List.of())))
                    .isInstanceOf(InsufficientHistoryException.class);
        }

        @Test
        @DisplayName("A table without regime labels is rejected")
        void missingRegimes() {
            FeatureTable table = new AnnotatedTable("up", "up").buildWithoutRegimes();

            assertThatThrownBy(() -> model.estimate(table))
                    .isInstanceOf(MissingColumnException.class)
                    .hasMessageContaining("momentum_state");
        }
    }

    @Nested
    @DisplayName("Primary pattern")
    class PrimaryPatternTests {

        @Test
        @DisplayName("Engulfing outranks hammer, hammer outranks inside bar")
        void priorityOrder() {
            FeatureTable table = new AnnotatedTable("up", "up")
                    .pattern(Field.HAMMER, 1)
                    .pattern(Field.INSIDE_BAR, 1)
                    .build();
            FeatureTable engulfing = new AnnotatedTable("up", "up")
                    .pattern(Field.HAMMER, 1)
                    .pattern(Field.BULLISH_ENGULFING, 1)
                    .build();

            assertEquals(Field.HAMMER, model.primaryPattern(table));
            assertEquals(Field.BULLISH_ENGULFING, model.primaryPattern(engulfing));
        }

        @Test
        @DisplayName("No flag on the latest row means no primary pattern")
        void none() {
            FeatureTable table = new AnnotatedTable("up", "up").pattern(Field.HAMMER, 0).build();

            assertNull(model.primaryPattern(table));
        }
    }

    @Nested
    @DisplayName("Summary")
    class SummaryTests {

        @Test
        @DisplayName("Summary carries the probability and the latest labels")
        void summary() {
            FeatureTable table = new AnnotatedTable("up", "up", "up", "up", "up", "up", "up", "up")
                    .pattern(Field.HAMMER, 0, 2, 4, 7)
                    .bullish(1, 3)
                    .build();

            SummaryRecord summary = model.summary(table);

            assertEquals(new BigDecimal("66.67"), summary.getProbabilityNextBullish());
            assertEquals("up", summary.getLastTrend());
            assertEquals(MomentumState.BULLISH, summary.getLastMomentum());
            assertEquals(VolatilityState.NORMAL, summary.getLastVolatility());
            assertEquals(3, summary.getMatchedSamples());
            assertThat(summary.toFormattedString())
                    .contains("Probability of next bullish candle: 66.67%")
                    .contains("Primary pattern: hammer")
                    .contains("Detected patterns: hammer\n");
        }

        @Test
        @DisplayName("Summary lists every pattern on the latest bar in priority order")
        void everyActivePattern() {
            FeatureTable table = new AnnotatedTable("up", "up", "up")
                    .pattern(Field.INSIDE_BAR, 2)
                    .pattern(Field.HAMMER, 2)
                    .pattern(Field.BULLISH_ENGULFING, 2)
                    .build();

            SummaryRecord summary = model.summary(table);

            assertThat(summary.getDetectedPatterns()).containsExactly("bullish_engulfing", "hammer", "inside_bar");
            assertEquals("bullish_engulfing", summary.getPrimaryPattern());
            assertThat(summary.toFormattedString())
                    .contains("Detected patterns: bullish_engulfing, hammer, inside_bar");
        }

        @Test
        @DisplayName("A missing trend and no patterns both read as none")
        void noneLabels() {
            FeatureTable table = new AnnotatedTable(null, null).build();

            SummaryRecord summary = model.summary(table);

            assertThat(summary.getDetectedPatterns()).isEmpty();
            assertThat(summary.toFormattedString())
                    .contains("Trend: none")
                    .contains("Primary pattern: none")
                    .contains("Detected patterns: none")
                    .doesNotContain("null");
        }
    }
}
