package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.TotalEffect;
import com.timeseries.dsem.api.VariableSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.ejml.data.DMatrixRMaj;

/**
 * Table of {@code (from, to, lag, value)} rows, keyed for lookup.
 *
 * <p>
 * Rows are ordered by lag, then response, then predictor, following variable
 * order.
 */
public final class EffectTable {
    private final VariableSet variables;
    private final List<TotalEffect> rows;
    private final Map<Key, TotalEffect> index;

    private EffectTable(VariableSet variables, List<TotalEffect> rows) {
        this.variables = variables;
        this.rows = Collections.unmodifiableList(rows);
        this.index = new HashMap<>(rows.size() * 2);
        for (TotalEffect e : rows)
            index.put(new Key(e.from(), e.to(), e.lag()), e);
    }

    public VariableSet variables() {
        return variables;
    }

    public List<TotalEffect> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @throws IllegalArgumentException if the table has no such row
     */
    public double value(String from, String to, int lag) {
        TotalEffect e = index.get(new Key(from, to, lag));
        if (e == null)
            throw new IllegalArgumentException("No effect " + from + " -> " + to + " at lag " + lag);
        return e.value();
    }

    public boolean contains(String from, String to, int lag) {
        return index.containsKey(new Key(from, to, lag));
    }

    public List<TotalEffect> forLag(int lag) {
        return rows.stream().filter(e -> e.lag() == lag).toList();
    }

    /** Rows whose value is not exactly zero. */
    public List<TotalEffect> nonZero() {
        return rows.stream().filter(e -> e.value() != 0.0).toList();
    }

    static Builder builder(VariableSet variables) {
        return new Builder(variables);
    }

    static final class Builder {
        private final VariableSet variables;
        private final List<TotalEffect> rows = new ArrayList<>();

        private Builder(VariableSet variables) {
            this.variables = variables;
        }

        /** Adds one row per {@code (to, from)} cell of {@code m[to][from]}. */
        Builder addMatrix(int lag, DMatrixRMaj m) {
            int v = variables.size();
            for (int to = 0; to < v; to++)
                for (int from = 0; from < v; from++)
                    rows.add(new TotalEffect(variables.name(from), variables.name(to), lag, m.get(to, from)));
            return this;
        }

        EffectTable build() {
            return new EffectTable(variables, new ArrayList<>(rows));
        }
    }

    private record Key(String from, String to, int lag) {
    }
}
