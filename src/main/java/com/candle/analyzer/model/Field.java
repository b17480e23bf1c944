package com.candle.analyzer.model;

import java.util.Arrays;
import java.util.List;

/**
 * Canonical column identifiers shared by every analysis stage.
 * The key is the snake_case name used in exports.
 */
public enum Field {

    // Returns
    RET_1("ret_1", Kind.NUMERIC),
    RET_5("ret_5", Kind.NUMERIC),
    RET_10("ret_10", Kind.NUMERIC),
    RET_21("ret_21", Kind.NUMERIC),

    // Moving averages
    SMA_5("sma_5", Kind.NUMERIC),
    SMA_20("sma_20", Kind.NUMERIC),
    SMA_50("sma_50", Kind.NUMERIC),
    SMA_200("sma_200", Kind.NUMERIC),
    EMA_12("ema_12", Kind.NUMERIC),
    EMA_26("ema_26", Kind.NUMERIC),
    EMA_50("ema_50", Kind.NUMERIC),

    // MACD
    MACD_LINE("macd_line", Kind.NUMERIC),
    MACD_SIGNAL("macd_signal", Kind.NUMERIC),
    MACD_HIST("macd_hist", Kind.NUMERIC),

    RSI_14("rsi_14", Kind.NUMERIC),

    // Volatility / directional
    TR("tr", Kind.NUMERIC),
    ATR_14("atr_14", Kind.NUMERIC),
    ADX_14("adx_14", Kind.NUMERIC),
    DI_PLUS_14("di_plus_14", Kind.NUMERIC),
    DI_MINUS_14("di_minus_14", Kind.NUMERIC),

    // Bollinger
    BB_MID_20("bb_mid_20", Kind.NUMERIC),
    BB_UP_20_2("bb_up_20_2", Kind.NUMERIC),
    BB_LO_20_2("bb_lo_20_2", Kind.NUMERIC),
    BB_WIDTH_20("bb_width_20", Kind.NUMERIC),
    STDEV_20("stdev_20", Kind.NUMERIC),
    STDEV_10("stdev_10", Kind.NUMERIC),
    BB_WIDTH_PCT_252("bb_width_pct_252", Kind.NUMERIC),

    // Volume
    VOL_MA20("vol_ma20", Kind.NUMERIC),
    VOL_RATIO("vol_ratio", Kind.NUMERIC),
    VOL_SPIKE_FLAG("vol_spike_flag", Kind.FLAG),

    // Candle anatomy
    BODY_PCT("body_pct", Kind.NUMERIC),
    UPPER_WICK_PCT("upper_wick_pct", Kind.NUMERIC),
    LOWER_WICK_PCT("lower_wick_pct", Kind.NUMERIC),

    // Calendar
    DAY_OF_WEEK("day_of_week", Kind.NUMERIC),
    MONTH("month", Kind.NUMERIC),

    // Candle patterns
    BULLISH("bullish", Kind.FLAG),
    BEARISH("bearish", Kind.FLAG),
    BULLISH_ENGULFING("bullish_engulfing", Kind.FLAG),
    BEARISH_ENGULFING("bearish_engulfing", Kind.FLAG),
    HAMMER("hammer", Kind.FLAG),
    SHOOTING_STAR("shooting_star", Kind.FLAG),
    DOJI("doji", Kind.FLAG),
    INSIDE_BAR("inside_bar", Kind.FLAG),
    OUTSIDE_BAR("outside_bar", Kind.FLAG),
    MORNING_STAR("morning_star", Kind.FLAG),
    EVENING_STAR("evening_star", Kind.FLAG);

    /**
     * Columns that must all be defined before a row survives the warm-up trim.
     */
    public static final List<Field> WARM_UP_SET = List.of(
            RET_1, SMA_20, SMA_50, SMA_200, EMA_12, EMA_26, MACD_LINE,
            RSI_14, ATR_14, ADX_14, BB_MID_20, BB_WIDTH_20, STDEV_10
    );

    /**
     * Pattern flags in the order the analog model looks for a primary pattern.
     */
    public static final List<Field> PRIMARY_PATTERN_PRIORITY = List.of(
            BULLISH_ENGULFING, BEARISH_ENGULFING,
            HAMMER, SHOOTING_STAR,
            MORNING_STAR, EVENING_STAR,
            INSIDE_BAR, OUTSIDE_BAR
    );

    private final String key;
    private final Kind kind;

    Field(String key, Kind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String getKey() {
        return key;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFlag() {
        return kind == Kind.FLAG;
    }

    public static Field fromKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field: " + key));
    }

    public enum Kind {
        NUMERIC, FLAG
    }
}
