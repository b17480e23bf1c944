package com.candle.analyzer.regime;

/**
 * Momentum label derived from RSI(14) and the MACD histogram.
 */
public enum MomentumState {

    BULLISH("bullish", "RSI above the bullish threshold with a positive MACD histogram"),

    BEARISH("bearish", "RSI below the bearish threshold with a negative MACD histogram"),

    NEUTRAL("neutral", "Neither bullish nor bearish momentum"),

    /**
     * An input indicator was missing on this row.
     */
    UNDEFINED("undefined", "Momentum indicators not available");

    private final String label;
    private final String description;

    MomentumState(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }
}
