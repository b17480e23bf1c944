package com.candle.analyzer.regime;

import com.candle.analyzer.model.FeatureTable;
import com.candle.analyzer.model.Field;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.PriorityQueue;

/**
 * Labels momentum and volatility regimes.
 *
 * Momentum:
 * 1. RSI(14) > 55 and MACD histogram > 0 -> BULLISH
 * 2. RSI(14) < 45 and MACD histogram < 0 -> BEARISH
 * 3. otherwise NEUTRAL
 *
 * Volatility (ATR(14) against its median):
 * 1. ATR > median * 1.2 -> HIGH
 * 2. ATR < median * 0.8 -> LOW
 * 3. otherwise NORMAL
 *
 * Trend is not classified here; it arrives on each bar from upstream.
 */
@Service
@Slf4j
public class RegimeClassifier {

    private static final double DEFAULT_RSI_BULLISH = 55.0;
    private static final double DEFAULT_RSI_BEARISH = 45.0;
    private static final double DEFAULT_ATR_HIGH_RATIO = 1.2;
    private static final double DEFAULT_ATR_LOW_RATIO = 0.8;

    private final double rsiBullish;
    private final double rsiBearish;
    private final double atrHighRatio;
    private final double atrLowRatio;
    private final RegimeMode mode;

    public RegimeClassifier() {
        this(RegimeMode.PER_ROW);
    }

    public RegimeClassifier(RegimeMode mode) {
        this(DEFAULT_RSI_BULLISH, DEFAULT_RSI_BEARISH, DEFAULT_ATR_HIGH_RATIO, DEFAULT_ATR_LOW_RATIO, mode);
    }

    @Autowired
    public RegimeClassifier(@Value("${analyzer.regime.rsi-bullish:55}") double rsiBullish,
                            @Value("${analyzer.regime.rsi-bearish:45}") double rsiBearish,
                            @Value("${analyzer.regime.atr-high-ratio:1.2}") double atrHighRatio,
                            @Value("${analyzer.regime.atr-low-ratio:0.8}") double atrLowRatio,
                            @Value("${analyzer.regime.mode:PER_ROW}") RegimeMode mode) {
        this.rsiBullish = rsiBullish;
        this.rsiBearish = rsiBearish;
        this.atrHighRatio = atrHighRatio;
        this.atrLowRatio = atrLowRatio;
        this.mode = mode;
    }

    /**
     * Returns a new table carrying a momentum and a volatility label per row.
     */
    public FeatureTable classify(FeatureTable table) {
        int n = table.size();
        MomentumState[] momentum = new MomentumState[n];
        VolatilityState[] volatility = new VolatilityState[n];

        if (n > 0) {
            if (mode == RegimeMode.BROADCAST) {
                Arrays.fill(momentum, latestMomentum(table));
                Arrays.fill(volatility, latestVolatility(table));
            } else {
                double[] rsi = table.column(Field.RSI_14);
                double[] histogram = table.column(Field.MACD_HIST);
                double[] atr = table.column(Field.ATR_14);
                double[] medians = expandingMedian(atr);

                for (int i = 0; i < n; i++) {
                    momentum[i] = momentumOf(rsi[i], histogram[i]);
                    volatility[i] = volatilityOf(atr[i], medians[i]);
                }
            }
        }

        FeatureTable result = table.toBuilder().regimes(momentum, volatility).build();
        if (n > 0) {
            log.info("Regimes classified ({}): latest momentum={}, volatility={}",
                    mode, momentum[n - 1], volatility[n - 1]);
            log.debug("{}; {}", momentum[n - 1].getDescription(), volatility[n - 1].getDescription());
        }
        return result;
    }

    /**
     * Momentum of the most recent row.
     */
    public MomentumState latestMomentum(FeatureTable table) {
        int last = table.lastIndex();
        return momentumOf(table.value(Field.RSI_14, last), table.value(Field.MACD_HIST, last));
    }

    /**
     * Volatility of the most recent row against the median ATR of the whole table.
     */
    public VolatilityState latestVolatility(FeatureTable table) {
        double[] atr = table.column(Field.ATR_14);
        return volatilityOf(atr[atr.length - 1], median(atr));
    }

    public MomentumState momentumOf(double rsi, double macdHistogram) {
        if (Double.isNaN(rsi) || Double.isNaN(macdHistogram)) {
            return MomentumState.UNDEFINED;
        }
        if (rsi > rsiBullish && macdHistogram > 0) {
            return MomentumState.BULLISH;
        }
        if (rsi < rsiBearish && macdHistogram < 0) {
            return MomentumState.BEARISH;
        }
        return MomentumState.NEUTRAL;
    }

    public VolatilityState volatilityOf(double atr, double medianAtr) {
        if (Double.isNaN(atr) || Double.isNaN(medianAtr)) {
            return VolatilityState.UNDEFINED;
        }
        if (atr > medianAtr * atrHighRatio) {
            return VolatilityState.HIGH;
        }
        if (atr < medianAtr * atrLowRatio) {
            return VolatilityState.LOW;
        }
        return VolatilityState.NORMAL;
    }

    public RegimeMode getMode() {
        return mode;
    }

    /**
     * Median of the defined values, NaN when there are none.
     */
    static double median(double[] values) {
        double[] defined = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        if (defined.length == 0) {
            return Double.NaN;
        }
        int mid = defined.length / 2;
        return defined.length % 2 == 1 ? defined[mid] : (defined[mid - 1] + defined[mid]) / 2.0;
    }

    /**
     * Median of the defined values in rows 0..i, for every i.
     */
    static double[] expandingMedian(double[] values) {
        double[] out = new double[values.length];
        // lower half as a max-heap, upper half as a min-heap
        PriorityQueue<Double> lower = new PriorityQueue<>(Collections.reverseOrder());
        PriorityQueue<Double> upper = new PriorityQueue<>();

        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (!Double.isNaN(value)) {
                if (lower.isEmpty() || value <= lower.peek()) {
                    lower.add(value);
                } else {
                    upper.add(value);
                }
                if (lower.size() > upper.size() + 1) {
                    upper.add(lower.poll());
                } else if (upper.size() > lower.size()) {
                    lower.add(upper.poll());
                }
            }

            if (lower.isEmpty()) {
                out[i] = Double.NaN;
            } else if (lower.size() > upper.size()) {
                out[i] = lower.peek();
            } else {
                out[i] = (lower.peek() + upper.peek()) / 2.0;
            }
        }
        return out;
    }
}
