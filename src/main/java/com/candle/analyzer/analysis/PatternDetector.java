package com.candle.analyzer.analysis;

import com.candle.analyzer.model.Bar;
import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.model.Field;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single and multi-bar candlestick patterns.
 *
 * Each flag at row t looks at rows t-2..t only. Rows without enough history
 * for a pattern read false.
 */
@Service
@Slf4j
public class PatternDetector {

    public static final double DEFAULT_DOJI_THRESHOLD = 0.1;

    // Middle star body must be at most this fraction of the first body
    private static final double STAR_BODY_RATIO = 0.5;

    private final double dojiThreshold;

    public PatternDetector() {
        this(DEFAULT_DOJI_THRESHOLD);
    }

    @Autowired
    public PatternDetector(@Value("${analyzer.pattern.doji-threshold:0.1}") double dojiThreshold) {
        this.dojiThreshold = dojiThreshold;
    }

    /**
     * Runs every pattern and returns a new table carrying all flag columns.
     */
    public FeatureTable detectAll(FeatureTable table) {
        List<Bar> bars = table.getBars();

        FeatureTable result = table.toBuilder()
                .flag(Field.BULLISH, bullish(bars))
                .flag(Field.BEARISH, bearish(bars))
                .flag(Field.BULLISH_ENGULFING, bullishEngulfing(bars))
                .flag(Field.BEARISH_ENGULFING, bearishEngulfing(bars))
                .flag(Field.HAMMER, hammer(bars))
                .flag(Field.SHOOTING_STAR, shootingStar(bars))
                .flag(Field.DOJI, doji(bars))
                .flag(Field.INSIDE_BAR, insideBar(bars))
                .flag(Field.OUTSIDE_BAR, outsideBar(bars))
                .flag(Field.MORNING_STAR, morningStar(bars))
                .flag(Field.EVENING_STAR, eveningStar(bars))
                .build();

        if (log.isDebugEnabled() && !result.isEmpty()) {
            int last = result.lastIndex();
            List<String> active = Field.PRIMARY_PATTERN_PRIORITY.stream()
                    .filter(f -> result.flag(f, last))
                    .map(Field::getKey)
                    .toList();
            log.debug("Patterns on last bar: {}", active.isEmpty() ? "none" : active);
        }
        return result;
    }

    public boolean[] bullish(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            out[i] = bars.get(i).isBullish();
        }
        return out;
    }

    public boolean[] bearish(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            out[i] = bars.get(i).isBearish();
        }
        return out;
    }

    /**
     * Bearish bar followed by a bullish bar that opens below the previous
     * close and closes above the previous open.
     */
    public boolean[] bullishEngulfing(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 1; i < bars.size(); i++) {
            Bar prev = bars.get(i - 1);
            Bar cur = bars.get(i);
            out[i] = prev.isBearish()
                    && cur.isBullish()
                    && cur.getOpen() < prev.getClose()
                    && cur.getClose() > prev.getOpen();
        }
        return out;
    }

    public boolean[] bearishEngulfing(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 1; i < bars.size(); i++) {
            Bar prev = bars.get(i - 1);
            Bar cur = bars.get(i);
            out[i] = prev.isBullish()
                    && cur.isBearish()
                    && cur.getOpen() > prev.getClose()
                    && cur.getClose() < prev.getOpen();
        }
        return out;
    }

    /**
     * Long lower shadow (at least twice the body), upper shadow no longer
     * than the body, non-zero body.
     */
    public boolean[] hammer(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            double body = bar.getBody();
            out[i] = bar.getLowerWick() >= 2 * body
                    && bar.getUpperWick() <= body
                    && body > 0;
        }
        return out;
    }

    public boolean[] shootingStar(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            double body = bar.getBody();
            out[i] = bar.getUpperWick() >= 2 * body
                    && bar.getLowerWick() <= body
                    && body > 0;
        }
        return out;
    }

    /**
     * Body no larger than {@code dojiThreshold} of the range. A zero range is
     * treated as 1 so the body is judged on its absolute size.
     */
    public boolean[] doji(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            double range = bar.getRange() == 0.0 ? 1.0 : bar.getRange();
            out[i] = bar.getBody() / range <= dojiThreshold;
        }
        return out;
    }

    public boolean[] insideBar(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 1; i < bars.size(); i++) {
            Bar prev = bars.get(i - 1);
            Bar cur = bars.get(i);
            out[i] = cur.getHigh() <= prev.getHigh() && cur.getLow() >= prev.getLow();
        }
        return out;
    }

    public boolean[] outsideBar(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 1; i < bars.size(); i++) {
            Bar prev = bars.get(i - 1);
            Bar cur = bars.get(i);
            out[i] = cur.getHigh() >= prev.getHigh() && cur.getLow() <= prev.getLow();
        }
        return out;
    }

    /**
     * Bearish bar, small-bodied bar, then a bullish bar closing above the
     * midpoint of the first bar's body.
     */
    public boolean[] morningStar(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 2; i < bars.size(); i++) {
            Bar first = bars.get(i - 2);
            Bar star = bars.get(i - 1);
            Bar cur = bars.get(i);
            out[i] = first.isBearish()
                    && star.getBody() <= first.getBody() * STAR_BODY_RATIO
                    && cur.isBullish()
                    && cur.getClose() > (first.getOpen() + first.getClose()) / 2;
        }
        return out;
    }

    public boolean[] eveningStar(List<Bar> bars) {
        boolean[] out = new boolean[bars.size()];
        for (int i = 2; i < bars.size(); i++) {
            Bar first = bars.get(i - 2);
            Bar star = bars.get(i - 1);
            Bar cur = bars.get(i);
            out[i] = first.isBullish()
                    && star.getBody() <= first.getBody() * STAR_BODY_RATIO
                    && cur.isBearish()
                    && cur.getClose() < (first.getOpen() + first.getClose()) / 2;
        }
        return out;
    }

    public double getDojiThreshold() {
        return dojiThreshold;
    }
}
