package com.candle.analyzer.regime;

/**
 * How regime labels are laid out across the rows of a table.
 */
public enum RegimeMode {

    /**
     * Each row is labelled from its own indicator values. The volatility
     * median is taken over that row and the rows before it.
     */
    PER_ROW,

    /**
     * Legacy compatibility: the labels of the latest row are copied onto every
     * row, which makes momentum and volatility filters match everything that
     * shares the current label by construction.
     */
    BROADCAST
}
