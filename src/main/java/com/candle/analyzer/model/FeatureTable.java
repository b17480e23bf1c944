package com.candle.analyzer.model;

import com.candle.analyzer.exception.MissingColumnException;
import com.candle.analyzer.regime.MomentumState;
import com.candle.analyzer.regime.VolatilityState;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable column-oriented table of bars and the fields computed from them.
 *
 * Numeric columns use {@link Double#NaN} as the missing-value marker.
 * Every stage extends a table through {@link #toBuilder()}, which leaves the
 * source table untouched.
 */
public final class FeatureTable {

    private final List<Bar> bars;
    private final Map<Field, double[]> numeric;
    private final Map<Field, boolean[]> flags;
    private final MomentumState[] momentum;
    private final VolatilityState[] volatility;

    private FeatureTable(List<Bar> bars,
                         Map<Field, double[]> numeric,
                         Map<Field, boolean[]> flags,
                         MomentumState[] momentum,
                         VolatilityState[] volatility) {
        this.bars = bars;
        this.numeric = numeric;
        this.flags = flags;
        this.momentum = momentum;
        this.volatility = volatility;
    }

    public static FeatureTable of(List<Bar> bars) {
        return builder(bars).build();
    }

    public static Builder builder(List<Bar> bars) {
        return new Builder(bars);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(bars);
        builder.numeric.putAll(numeric);
        builder.flags.putAll(flags);
        builder.momentum = momentum;
        builder.volatility = volatility;
        return builder;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public int lastIndex() {
        return bars.size() - 1;
    }

    public List<Bar> getBars() {
        return bars;
    }

    public Bar bar(int row) {
        return bars.get(row);
    }

    public String trend(int row) {
        return bars.get(row).getTrend();
    }

    public boolean has(Field field) {
        return field.isFlag() ? flags.containsKey(field) : numeric.containsKey(field);
    }

    public Set<Field> fields() {
        Set<Field> present = EnumSet.noneOf(Field.class);
        present.addAll(numeric.keySet());
        present.addAll(flags.keySet());
        return Collections.unmodifiableSet(present);
    }

    public double value(Field field, int row) {
        return numericColumn(field)[row];
    }

    public boolean flag(Field field, int row) {
        return flagColumn(field)[row];
    }

    /**
     * @return a copy of the numeric column
     */
    public double[] column(Field field) {
        return numericColumn(field).clone();
    }

    /**
     * @return a copy of the flag column
     */
    public boolean[] flags(Field field) {
        return flagColumn(field).clone();
    }

    public boolean hasRegimes() {
        return momentum != null && volatility != null;
    }

    public MomentumState momentum(int row) {
        requireRegimes();
        return momentum[row];
    }

    public VolatilityState volatility(int row) {
        requireRegimes();
        return volatility[row];
    }

    /**
     * Drops the first {@code from} rows and re-indexes the rest from zero.
     */
    public FeatureTable dropLeading(int from) {
        int n = bars.size();
        int start = Math.max(0, Math.min(from, n));
        Builder builder = new Builder(bars.subList(start, n));
        numeric.forEach((field, column) -> builder.numeric.put(field, Arrays.copyOfRange(column, start, n)));
        flags.forEach((field, column) -> builder.flags.put(field, Arrays.copyOfRange(column, start, n)));
        if (hasRegimes()) {
            builder.momentum = Arrays.copyOfRange(momentum, start, n);
            builder.volatility = Arrays.copyOfRange(volatility, start, n);
        }
        return builder.build();
    }

    private double[] numericColumn(Field field) {
        double[] column = numeric.get(field);
        if (column == null) {
            throw new MissingColumnException(field.getKey());
        }
        return column;
    }

    private boolean[] flagColumn(Field field) {
        boolean[] column = flags.get(field);
        if (column == null) {
            throw new MissingColumnException(field.getKey());
        }
        return column;
    }

    private void requireRegimes() {
        if (!hasRegimes()) {
            throw new MissingColumnException("momentum_state", "volatility_state");
        }
    }

    public static final class Builder {

        private final List<Bar> bars;
        private final Map<Field, double[]> numeric = new EnumMap<>(Field.class);
        private final Map<Field, boolean[]> flags = new EnumMap<>(Field.class);
        private MomentumState[] momentum;
        private VolatilityState[] volatility;

        private Builder(List<Bar> bars) {
            this.bars = List.copyOf(bars);
        }

        public Builder numeric(Field field, double[] column) {
            if (field.isFlag()) {
                throw new IllegalArgumentException(field.getKey() + " is a flag column");
            }
            requireLength(field, column.length);
            numeric.put(field, column.clone());
            return this;
        }

        public Builder flag(Field field, boolean[] column) {
            if (!field.isFlag()) {
                throw new IllegalArgumentException(field.getKey() + " is a numeric column");
            }
            requireLength(field, column.length);
            flags.put(field, column.clone());
            return this;
        }

        public Builder regimes(MomentumState[] momentumStates, VolatilityState[] volatilityStates) {
            requireLength(null, momentumStates.length);
            requireLength(null, volatilityStates.length);
            this.momentum = momentumStates.clone();
            this.volatility = volatilityStates.clone();
            return this;
        }

        public FeatureTable build() {
            return new FeatureTable(bars,
                    Collections.unmodifiableMap(new EnumMap<>(numeric)),
                    Collections.unmodifiableMap(new EnumMap<>(flags)),
                    momentum, volatility);
        }

        private void requireLength(Field field, int length) {
            if (length != bars.size()) {
                throw new IllegalArgumentException(String.format("Column %s has %d rows, table has %d",
                        field != null ? field.getKey() : "regime", length, bars.size()));
            }
        }
    }
}
