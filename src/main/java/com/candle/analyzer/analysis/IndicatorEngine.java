package com.candle.analyzer.analysis;

import com.candle.analyzer.exception.InsufficientHistoryException;
import com.candle.analyzer.exception.MissingColumnException;
import com.candle.analyzer.indicator.IndicatorCalculator;
import com.candle.analyzer.indicator.IndicatorCalculator.ADXData;
import com.candle.analyzer.indicator.IndicatorCalculator.BollingerData;
import com.candle.analyzer.indicator.IndicatorCalculator.MACDData;
import com.candle.analyzer.model.Bar;
import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.model.Field;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes every technical indicator column from raw bars and trims the
 * leading warm-up rows.
 */
@Service
@Slf4j
public class IndicatorEngine {

    // Minimum bars accepted as input
    public static final int MIN_BARS = 2;

    private static final int RSI_PERIOD = 14;
    private static final int ATR_PERIOD = 14;
    private static final int ADX_PERIOD = 14;
    private static final int BB_PERIOD = 20;
    private static final double BB_MULTIPLIER = 2.0;
    private static final int VOLUME_PERIOD = 20;
    private static final double VOLUME_SPIKE_RATIO = 1.5;
    private static final int RETURN_VOLATILITY_PERIOD = 10;
    private static final int WIDTH_PERCENTILE_WINDOW = 252;

    // SMA columns only count as defined once their full window is available
    private static final Map<Field, Integer> FULL_WINDOW = Map.of(
            Field.SMA_20, 20,
            Field.SMA_50, 50,
            Field.SMA_200, 200,
            Field.BB_MID_20, BB_PERIOD
    );

    public FeatureTable calculate(List<Bar> input) {
        validate(input);
        List<Bar> bars = chronological(input);

        int n = bars.size();
        double[] open = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        double[] volume = new double[n];

        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            open[i] = bar.getOpen();
            high[i] = bar.getHigh();
            low[i] = bar.getLow();
            close[i] = bar.getClose();
            volume[i] = bar.volumeOrZero();
        }

        Map<Field, double[]> columns = new EnumMap<>(Field.class);

        // Returns
        double[] ret1 = IndicatorCalculator.calculatePercentChange(close, 1);
        columns.put(Field.RET_1, ret1);
        columns.put(Field.RET_5, IndicatorCalculator.calculatePercentChange(close, 5));
        columns.put(Field.RET_10, IndicatorCalculator.calculatePercentChange(close, 10));
        columns.put(Field.RET_21, IndicatorCalculator.calculatePercentChange(close, 21));

        // Moving averages
        columns.put(Field.SMA_5, IndicatorCalculator.calculateSMA(close, 5));
        columns.put(Field.SMA_20, IndicatorCalculator.calculateSMA(close, 20));
        columns.put(Field.SMA_50, IndicatorCalculator.calculateSMA(close, 50));
        columns.put(Field.SMA_200, IndicatorCalculator.calculateSMA(close, 200));
        columns.put(Field.EMA_12, IndicatorCalculator.calculateEMA(close, 12));
        columns.put(Field.EMA_26, IndicatorCalculator.calculateEMA(close, 26));
        columns.put(Field.EMA_50, IndicatorCalculator.calculateEMA(close, 50));

        MACDData macd = IndicatorCalculator.calculateMACD(close, 12, 26, 9);
        columns.put(Field.MACD_LINE, macd.macdLine());
        columns.put(Field.MACD_SIGNAL, macd.signalLine());
        columns.put(Field.MACD_HIST, macd.histogram());

        columns.put(Field.RSI_14, IndicatorCalculator.calculateRSI(close, RSI_PERIOD));

        double[] trueRange = IndicatorCalculator.calculateTrueRange(high, low, close);
        columns.put(Field.TR, trueRange);
        columns.put(Field.ATR_14, IndicatorCalculator.calculateATR(trueRange, ATR_PERIOD));

        ADXData adx = IndicatorCalculator.calculateADX(high, low, close, ADX_PERIOD);
        columns.put(Field.ADX_14, adx.adx());
        columns.put(Field.DI_PLUS_14, adx.plusDi());
        columns.put(Field.DI_MINUS_14, adx.minusDi());

        BollingerData bb = IndicatorCalculator.calculateBollingerBands(close, BB_PERIOD, BB_MULTIPLIER);
        columns.put(Field.BB_MID_20, bb.middle());
        columns.put(Field.BB_UP_20_2, bb.upper());
        columns.put(Field.BB_LO_20_2, bb.lower());
        columns.put(Field.BB_WIDTH_20, bb.width());
        columns.put(Field.STDEV_20, bb.stdDev());
        columns.put(Field.STDEV_10, IndicatorCalculator.calculateRollingStdDev(ret1, RETURN_VOLATILITY_PERIOD));

        // Percentile runs on the untrimmed width series
        columns.put(Field.BB_WIDTH_PCT_252,
                IndicatorCalculator.calculateRollingPercentile(bb.width(), WIDTH_PERCENTILE_WINDOW));

        // Volume
        double[] volumeMa = IndicatorCalculator.calculateSMA(volume, VOLUME_PERIOD);
        double[] volumeRatio = IndicatorCalculator.safeDivide(volume, volumeMa);
        boolean[] volumeSpike = new boolean[n];
        for (int i = 0; i < n; i++) {
            volumeSpike[i] = volumeRatio[i] >= VOLUME_SPIKE_RATIO;
        }
        columns.put(Field.VOL_MA20, volumeMa);
        columns.put(Field.VOL_RATIO, volumeRatio);

        addCandleAnatomy(bars, columns);
        addCalendar(bars, columns);

        columns.values().forEach(IndicatorEngine::replaceInfinite);

        FeatureTable.Builder builder = FeatureTable.builder(bars);
        columns.forEach(builder::numeric);
        builder.flag(Field.VOL_SPIKE_FLAG, volumeSpike);
        FeatureTable full = builder.build();

        int warmUp = warmUpRows(full);
        if (warmUp >= n) {
            throw new InsufficientHistoryException(
                    String.format("Warm-up trimming removes all %d bars", n), n, warmUp + 1);
        }

        FeatureTable trimmed = full.dropLeading(warmUp);
        log.info("Indicators calculated: {} bars in, {} warm-up rows trimmed, {} rows out",
                n, warmUp, trimmed.size());
        return trimmed;
    }

    /**
     * Index of the first row at which every warm-up column is defined.
     * Returns the table size when no such row exists.
     */
    int warmUpRows(FeatureTable table) {
        int n = table.size();
        int start = 0;
        for (Map.Entry<Field, Integer> entry : FULL_WINDOW.entrySet()) {
            start = Math.max(start, entry.getValue() - 1);
        }

        while (start < n && !isDefined(table, start)) {
            start++;
        }
        return start;
    }

    private boolean isDefined(FeatureTable table, int row) {
        for (Field field : Field.WARM_UP_SET) {
            if (Double.isNaN(table.value(field, row))) {
                return false;
            }
        }
        return true;
    }

    private void addCandleAnatomy(List<Bar> bars, Map<Field, double[]> columns) {
        int n = bars.size();
        double[] bodyPct = new double[n];
        double[] upperWickPct = new double[n];
        double[] lowerWickPct = new double[n];

        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            double range = bar.getRange();
            double body = bar.getBody();
            boolean green = bar.getClose() >= bar.getOpen();
            double upperWick = green ? bar.getHigh() - bar.getClose() : bar.getHigh() - bar.getOpen();
            double lowerWick = green ? bar.getOpen() - bar.getLow() : bar.getClose() - bar.getLow();

            bodyPct[i] = IndicatorCalculator.safeDivide(body, range);
            upperWickPct[i] = IndicatorCalculator.safeDivide(upperWick, range);
            lowerWickPct[i] = IndicatorCalculator.safeDivide(lowerWick, range);
        }

        columns.put(Field.BODY_PCT, bodyPct);
        columns.put(Field.UPPER_WICK_PCT, upperWickPct);
        columns.put(Field.LOWER_WICK_PCT, lowerWickPct);
    }

    private void addCalendar(List<Bar> bars, Map<Field, double[]> columns) {
        int n = bars.size();
        double[] dayOfWeek = new double[n];
        double[] month = new double[n];

        for (int i = 0; i < n; i++) {
            // 0 = Monday ... 6 = Sunday
            dayOfWeek[i] = bars.get(i).getTimestamp().getDayOfWeek().getValue() - 1;
            month[i] = bars.get(i).getTimestamp().getMonthValue();
        }

        columns.put(Field.DAY_OF_WEEK, dayOfWeek);
        columns.put(Field.MONTH, month);
    }

    private void validate(List<Bar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            int available = bars == null ? 0 : bars.size();
            log.warn("Not enough bars for indicators: {}", available);
            throw new InsufficientHistoryException(available, MIN_BARS);
        }

        Set<String> missing = new LinkedHashSet<>();
        for (Bar bar : bars) {
            if (bar.getTimestamp() == null) missing.add("date");
            if (bar.getOpen() == null) missing.add("open");
            if (bar.getHigh() == null) missing.add("high");
            if (bar.getLow() == null) missing.add("low");
            if (bar.getClose() == null) missing.add("close");
        }
        if (!missing.isEmpty()) {
            throw new MissingColumnException(new ArrayList<>(missing));
        }
    }

    private List<Bar> chronological(List<Bar> bars) {
        for (int i = 1; i < bars.size(); i++) {
            if (bars.get(i).getTimestamp().isBefore(bars.get(i - 1).getTimestamp())) {
                log.warn("Bars are not in chronological order, sorting {} bars", bars.size());
                List<Bar> sorted = new ArrayList<>(bars);
                sorted.sort(Comparator.comparing(Bar::getTimestamp));
                return sorted;
            }
        }
        return bars;
    }

    private static void replaceInfinite(double[] column) {
        for (int i = 0; i < column.length; i++) {
            if (Double.isInfinite(column[i])) {
                column[i] = Double.NaN;
            }
        }
    }
}
