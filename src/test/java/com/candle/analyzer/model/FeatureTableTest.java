package com.candle.analyzer.model;

import com.candle.analyzer.BarFixtures;
import com.candle.analyzer.exception.MissingColumnException;
import com.candle.analyzer.regime.MomentumState;
import com.candle.analyzer.regime.VolatilityState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FeatureTable Tests")
class FeatureTableTest {

    private final List<Bar> bars = BarFixtures.fromCloses(new double[]{10, 11, 12, 13});

    @Nested
    @DisplayName("Columns")
    class ColumnTests {

        @Test
        @DisplayName("Columns are copied in and out")
        void immutable() {
            double[] sma = {1, 2, 3, 4};
            FeatureTable table = FeatureTable.builder(bars).numeric(Field.SMA_5, sma).build();

            sma[0] = 99;
            table.column(Field.SMA_5)[1] = 99;

            assertEquals(1.0, table.value(Field.SMA_5, 0));
            assertEquals(2.0, table.value(Field.SMA_5, 1));
        }

        @Test
        @DisplayName("Reading an absent column names it")
        void missingColumn() {
            FeatureTable table = FeatureTable.of(bars);

            assertFalse(table.has(Field.RSI_14));
            assertThatThrownBy(() -> table.value(Field.RSI_14, 0))
                    .isInstanceOf(MissingColumnException.class)
                    .hasMessageContaining("rsi_14");
        }

        @Test
        @DisplayName("Column kind and length are checked")
        void rejectsBadColumns() {
            FeatureTable.Builder builder = FeatureTable.builder(bars);

            assertThatThrownBy(() -> builder.numeric(Field.DOJI, new double[4]))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> builder.flag(Field.RSI_14, new boolean[4]))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> builder.numeric(Field.RSI_14, new double[3]))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("toBuilder keeps existing columns and adds new ones")
        void toBuilder() {
            FeatureTable base = FeatureTable.builder(bars).numeric(Field.SMA_5, new double[4]).build();

            FeatureTable extended = base.toBuilder().flag(Field.DOJI, new boolean[]{true, false, false, true}).build();

            assertTrue(extended.has(Field.SMA_5));
            assertTrue(extended.flag(Field.DOJI, 3));
            assertFalse(base.has(Field.DOJI));
            assertThat(extended.fields()).containsExactly(Field.SMA_5, Field.DOJI);
        }
    }

    @Nested
    @DisplayName("Trimming")
    class TrimTests {

        @Test
        @DisplayName("dropLeading re-indexes every column and label from zero")
        void dropLeading() {
            FeatureTable table = FeatureTable.builder(bars)
                    .numeric(Field.SMA_5, new double[]{1, 2, 3, 4})
                    .flag(Field.DOJI, new boolean[]{false, false, true, false})
                    .regimes(new MomentumState[]{MomentumState.UNDEFINED, MomentumState.NEUTRAL,
                                    MomentumState.BULLISH, MomentumState.BEARISH},
                            new VolatilityState[]{VolatilityState.UNDEFINED, VolatilityState.LOW,
                                    VolatilityState.NORMAL, VolatilityState.HIGH})
                    .build();

            FeatureTable trimmed = table.dropLeading(2);

            assertEquals(2, trimmed.size());
            assertEquals(bars.get(2), trimmed.bar(0));
            assertEquals(3.0, trimmed.value(Field.SMA_5, 0));
            assertTrue(trimmed.flag(Field.DOJI, 0));
            assertEquals(MomentumState.BEARISH, trimmed.momentum(1));
            assertEquals(VolatilityState.HIGH, trimmed.volatility(1));
        }

        @Test
        @DisplayName("Dropping past the end leaves an empty table")
        void dropAll() {
            FeatureTable trimmed = FeatureTable.of(bars).dropLeading(10);

            assertTrue(trimmed.isEmpty());
        }
    }

    @Test
    @DisplayName("Field keys round-trip through fromKey")
    void fieldKeys() {
        assertEquals(Field.BB_WIDTH_PCT_252, Field.fromKey("bb_width_pct_252"));
        assertTrue(Field.HAMMER.isFlag());
        assertThatThrownBy(() -> Field.fromKey("ema_200"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
