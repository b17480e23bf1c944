package com.candle.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One OHLCV observation. Price fields are boxed so that an absent value can be
 * told apart from zero; the indicator stage rejects bars without them.
 */
@Value
@Builder(toBuilder = true)
public class Bar {

    LocalDateTime timestamp;
    Double open;
    Double high;
    Double low;
    Double close;

    @Builder.Default
    Double volume = 0.0;

    // Supplied by an upstream regime tagger, never computed here
    String trend;

    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }

    public double getBody() {
        return Math.abs(close - open);
    }

    public double getRange() {
        return high - low;
    }

    public double getUpperWick() {
        return high - Math.max(open, close);
    }

    public double getLowerWick() {
        return Math.min(open, close) - low;
    }

    public double volumeOrZero() {
        return volume != null ? volume : 0.0;
    }
}
