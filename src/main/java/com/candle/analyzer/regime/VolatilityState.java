package com.candle.analyzer.regime;

/**
 * Volatility label derived from ATR(14) relative to its median.
 */
public enum VolatilityState {

    HIGH("high", "ATR well above its median"),

    LOW("low", "ATR well below its median"),

    NORMAL("normal", "ATR close to its median"),

    /**
     * ATR or its median was missing on this row.
     */
    UNDEFINED("undefined", "Volatility indicators not available");

    private final String label;
    private final String description;

    VolatilityState(String label, String description) {
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
