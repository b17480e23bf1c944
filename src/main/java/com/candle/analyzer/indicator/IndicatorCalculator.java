package com.candle.analyzer.indicator;

/**
 * Whole-series indicator math over {@code double[]} columns.
 *
 * Every method returns a new array of the same length as its input, with
 * {@link Double#NaN} wherever the value is not yet defined. Row {@code i} of
 * an output only ever depends on rows {@code 0..i} of the inputs.
 */
public class IndicatorCalculator {

    private IndicatorCalculator() {}

    public record MACDData(double[] macdLine, double[] signalLine, double[] histogram) {}

    public record ADXData(double[] adx, double[] plusDi, double[] minusDi) {}

    public record BollingerData(double[] middle, double[] upper, double[] lower, double[] width, double[] stdDev) {}

    /**
     * Trailing mean that accepts partial windows: the first rows average
     * whatever observations exist so far.
     */
    public static double[] calculateSMA(double[] values, int period) {
        double[] out = new double[values.length];
        double sum = 0;
        int count = 0;

        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i];
                count++;
            }
            if (i >= period && !Double.isNaN(values[i - period])) {
                sum -= values[i - period];
                count--;
            }
            out[i] = count > 0 ? sum / count : Double.NaN;
        }
        return out;
    }

    /**
     * EMA = price * k + EMA_prev * (1 - k), k = 2 / (period + 1).
     * Seeded from the first observation, no bias correction.
     */
    public static double[] calculateEMA(double[] values, int period) {
        return exponentialSmoothing(values, 2.0 / (period + 1), 1);
    }

    /**
     * Wilder smoothing: k = 1 / period, undefined until {@code period}
     * observations have been seen.
     */
    public static double[] calculateWilder(double[] values, int period) {
        return exponentialSmoothing(values, 1.0 / period, period);
    }

    /**
     * Recursive smoothing without bias correction.
     *
     * A missing input leaves the running value in place but keeps decaying
     * its weight, so the next observation is blended as
     * {@code (w * prev + alpha * x) / (w + alpha)}.
     */
    static double[] exponentialSmoothing(double[] values, double alpha, int minPeriods) {
        double[] out = new double[values.length];
        double decay = 1.0 - alpha;
        double smoothed = Double.NaN;
        double oldWeight = 1.0;
        int observations = 0;

        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            boolean observed = !Double.isNaN(value);
            if (observed) {
                observations++;
            }

            if (!Double.isNaN(smoothed)) {
                oldWeight *= decay;
                if (observed) {
                    if (smoothed != value) {
                        smoothed = (oldWeight * smoothed + alpha * value) / (oldWeight + alpha);
                    }
                    oldWeight = 1.0;
                }
            } else if (observed) {
                smoothed = value;
            }

            out[i] = observations >= minPeriods ? smoothed : Double.NaN;
        }
        return out;
    }

    /**
     * Sample standard deviation over a full trailing window.
     */
    public static double[] calculateRollingStdDev(double[] values, int period) {
        double[] out = new double[values.length];

        for (int i = 0; i < values.length; i++) {
            if (i < period - 1) {
                out[i] = Double.NaN;
                continue;
            }

            double sum = 0;
            boolean complete = true;
            for (int j = i - period + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) {
                    complete = false;
                    break;
                }
                sum += values[j];
            }
            if (!complete || period < 2) {
                out[i] = Double.NaN;
                continue;
            }

            double mean = sum / period;
            double squares = 0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = values[j] - mean;
                squares += diff * diff;
            }
            out[i] = Math.sqrt(squares / (period - 1));
        }
        return out;
    }

    /**
     * True Range = max(high - low, |high - prev_close|, |low - prev_close|).
     * The first row has no previous close and uses high - low alone.
     */
    public static double[] calculateTrueRange(double[] high, double[] low, double[] close) {
        double[] out = new double[close.length];

        for (int i = 0; i < close.length; i++) {
            double highLow = high[i] - low[i];
            if (i == 0) {
                out[i] = highLow;
                continue;
            }
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            out[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }
        return out;
    }

    /**
     * RSI = 100 - (100 / (1 + RS)), RS = Wilder avg gain / Wilder avg loss.
     * RS is undefined while the average loss is zero; undefined rows read 50.
     */
    public static double[] calculateRSI(double[] close, int period) {
        double[] delta = calculateDiff(close);
        double[] gain = new double[close.length];
        double[] loss = new double[close.length];

        for (int i = 0; i < close.length; i++) {
            gain[i] = Double.isNaN(delta[i]) ? Double.NaN : Math.max(delta[i], 0.0);
            loss[i] = Double.isNaN(delta[i]) ? Double.NaN : Math.max(-delta[i], 0.0);
        }

        double[] rs = safeDivide(calculateWilder(gain, period), calculateWilder(loss, period));
        double[] rsi = new double[close.length];

        for (int i = 0; i < close.length; i++) {
            double value = 100.0 - (100.0 / (1.0 + rs[i]));
            rsi[i] = Double.isNaN(value) ? 50.0 : value;
        }
        return rsi;
    }

    /**
     * ATR = Wilder smoothing of True Range.
     */
    public static double[] calculateATR(double[] trueRange, int period) {
        return calculateWilder(trueRange, period);
    }

    /**
     * ADX with +DI / -DI.
     *
     * +DM counts the up move only when it is positive and larger than the
     * down move; -DM mirrors that.
     */
    public static ADXData calculateADX(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] plusDm = new double[n];
        double[] minusDm = new double[n];

        for (int i = 0; i < n; i++) {
            if (i == 0) {
                plusDm[i] = Double.NaN;
                minusDm[i] = Double.NaN;
                continue;
            }
            double upMove = high[i] - high[i - 1];
            double downMove = low[i - 1] - low[i];
            plusDm[i] = upMove > downMove && upMove > 0 ? upMove : 0.0;
            minusDm[i] = downMove > upMove && downMove > 0 ? downMove : 0.0;
        }

        double[] atr = calculateATR(calculateTrueRange(high, low, close), period);
        double[] plusDi = scale(safeDivide(calculateWilder(plusDm, period), atr), 100.0);
        double[] minusDi = scale(safeDivide(calculateWilder(minusDm, period), atr), 100.0);

        double[] spread = new double[n];
        double[] total = new double[n];
        for (int i = 0; i < n; i++) {
            spread[i] = Math.abs(plusDi[i] - minusDi[i]);
            total[i] = plusDi[i] + minusDi[i];
        }
        double[] dx = scale(safeDivide(spread, total), 100.0);

        return new ADXData(calculateWilder(dx, period), plusDi, minusDi);
    }

    /**
     * MACD line = EMA(fast) - EMA(slow), signal = EMA(line, signal), histogram = line - signal.
     */
    public static MACDData calculateMACD(double[] close, int fast, int slow, int signal) {
        double[] emaFast = calculateEMA(close, fast);
        double[] emaSlow = calculateEMA(close, slow);
        double[] line = new double[close.length];

        for (int i = 0; i < close.length; i++) {
            line[i] = emaFast[i] - emaSlow[i];
        }

        double[] signalLine = calculateEMA(line, signal);
        double[] histogram = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            histogram[i] = line[i] - signalLine[i];
        }
        return new MACDData(line, signalLine, histogram);
    }

    /**
     * Bollinger Bands
     * Middle = SMA(period), partial windows allowed
     * Upper / Lower = Middle +/- stdDev * multiplier, stdDev over a full window
     * Width = (Upper - Lower) / Middle
     */
    public static BollingerData calculateBollingerBands(double[] close, int period, double multiplier) {
        double[] middle = calculateSMA(close, period);
        double[] stdDev = calculateRollingStdDev(close, period);
        double[] upper = new double[close.length];
        double[] lower = new double[close.length];
        double[] bandSpread = new double[close.length];

        for (int i = 0; i < close.length; i++) {
            upper[i] = middle[i] + multiplier * stdDev[i];
            lower[i] = middle[i] - multiplier * stdDev[i];
            bandSpread[i] = upper[i] - lower[i];
        }
        return new BollingerData(middle, upper, lower, safeDivide(bandSpread, middle), stdDev);
    }

    /**
     * Fraction of the trailing window (current row included) holding values
     * less than or equal to the current value. Missing values in the window
     * still count toward its length.
     */
    public static double[] calculateRollingPercentile(double[] values, int window) {
        double[] out = new double[values.length];

        for (int i = 0; i < values.length; i++) {
            double current = values[i];
            if (Double.isNaN(current)) {
                out[i] = Double.NaN;
                continue;
            }

            int start = Math.max(0, i - window + 1);
            int belowOrEqual = 0;
            for (int j = start; j <= i; j++) {
                if (values[j] <= current) {
                    belowOrEqual++;
                }
            }
            out[i] = (double) belowOrEqual / (i - start + 1);
        }
        return out;
    }

    /**
     * Fractional change against the value {@code periodsBack} rows earlier.
     */
    public static double[] calculatePercentChange(double[] values, int periodsBack) {
        double[] change = new double[values.length];
        double[] base = new double[values.length];

        for (int i = 0; i < values.length; i++) {
            if (i < periodsBack) {
                change[i] = Double.NaN;
                base[i] = Double.NaN;
            } else {
                change[i] = values[i] - values[i - periodsBack];
                base[i] = values[i - periodsBack];
            }
        }
        return safeDivide(change, base);
    }

    public static double[] calculateDiff(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = i == 0 ? Double.NaN : values[i] - values[i - 1];
        }
        return out;
    }

    /**
     * Element-wise division; a zero denominator or an infinite result yields NaN.
     */
    public static double[] safeDivide(double[] numerator, double[] denominator) {
        double[] out = new double[numerator.length];
        for (int i = 0; i < numerator.length; i++) {
            out[i] = safeDivide(numerator[i], denominator[i]);
        }
        return out;
    }

    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0.0 || Double.isNaN(denominator)) {
            return Double.NaN;
        }
        double result = numerator / denominator;
        return Double.isInfinite(result) ? Double.NaN : result;
    }

    private static double[] scale(double[] values, double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * factor;
        }
        return out;
    }
}
