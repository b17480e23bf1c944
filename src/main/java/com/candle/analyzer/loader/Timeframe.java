package com.candle.analyzer.loader;

import java.time.Duration;

/**
 * Bar interval, inferred from the median spacing between timestamps.
 */
public enum Timeframe {

    M1("1m", Duration.ofMinutes(2)),
    M5("5m", Duration.ofMinutes(10)),
    M15("15m", Duration.ofMinutes(20)),
    M30("30m", Duration.ofMinutes(40)),
    H1("1h", Duration.ofMinutes(90)),
    H2("2h", Duration.ofHours(3)),
    H4("4h", Duration.ofHours(6)),
    H12("12h", Duration.ofHours(12)),
    D1("1d", Duration.ofDays(2)),
    W1("1w", Duration.ofDays(10)),
    MO1("1mo", null),
    UNKNOWN("unknown", null);

    private final String label;
    // Exclusive upper bound of the median spacing for this timeframe
    private final Duration below;

    Timeframe(String label, Duration below) {
        this.label = label;
        this.below = below;
    }

    public String getLabel() {
        return label;
    }

    public static Timeframe fromSpacing(Duration spacing) {
        if (spacing == null) {
            return UNKNOWN;
        }
        for (Timeframe timeframe : values()) {
            if (timeframe.below != null && spacing.compareTo(timeframe.below) < 0) {
                return timeframe;
            }
        }
        return MO1;
    }
}
