package com.timeseries.dsem.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated, ordered set of free parameters.
 *
 * <p>
 * Order is first appearance in the model text, so compiling the same text
 * twice yields the same indexing. A parameter's position is its index into
 * the flat vector exchanged with the optimizer.
 */
public final class ParameterTable {
    private final List<Parameter> parameters;
    private final Map<String, Integer> nameToIndex;

    private ParameterTable(List<Parameter> parameters, Map<String, Integer> nameToIndex) {
        this.parameters = parameters;
        this.nameToIndex = nameToIndex;
    }

    public int size() {
        return parameters.size();
    }

    public Parameter parameter(int index) {
        return parameters.get(index);
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** Returns the vector index of {@code name}, or -1 when it is not a free parameter. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        return idx == null ? -1 : idx;
    }

    public List<String> names() {
        return parameters.stream().map(Parameter::name).toList();
    }

    /** A fresh copy of the starting parameter vector. */
    public double[] startValues() {
        double[] v = new double[parameters.size()];
        for (int i = 0; i < v.length; i++)
            v[i] = parameters.get(i).startValue();
        return v;
    }

    /**
     * Builds a parameter vector from named values, e.g. estimates from a previous
     * fit. Parameters absent from {@code values} keep their start value.
     *
     * @throws IllegalArgumentException if {@code values} names an unknown parameter
     */
    public double[] vectorOf(Map<String, Double> values) {
        double[] v = startValues();
        for (Map.Entry<String, Double> e : values.entrySet()) {
            int idx = indexOf(e.getKey());
            if (idx < 0)
                throw new IllegalArgumentException("Unknown parameter: " + e.getKey());
            if (e.getValue() == null)
                throw new IllegalArgumentException("Null value for parameter: " + e.getKey());
            v[idx] = e.getValue();
        }
        return v;
    }

    /** Keys a parameter vector back to names, in table order. */
    public Map<String, Double> namesOf(double[] vector) {
        requireLength(vector);
        Map<String, Double> out = new LinkedHashMap<>(vector.length * 2);
        for (int i = 0; i < vector.length; i++)
            out.put(parameters.get(i).name(), vector[i]);
        return out;
    }

    /** Fails unless {@code vector} has exactly one entry per parameter. */
    public void requireLength(double[] vector) {
        if (vector == null || vector.length != parameters.size())
            throw new IllegalArgumentException("Parameter vector length "
                    + (vector == null ? "null" : vector.length) + " does not match table size " + parameters.size());
    }

    @Override
    public String toString() {
        return names().toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Pass-one symbol table. Declaring an existing name returns its index and
     * leaves the first declaration untouched.
     */
    public static final class Builder {
        private final List<Parameter> parameters = new ArrayList<>();
        private final Map<String, Integer> nameToIndex = new HashMap<>();

        public boolean contains(String name) {
            return nameToIndex.containsKey(name);
        }

        public Parameter get(String name) {
            Integer idx = nameToIndex.get(name);
            return idx == null ? null : parameters.get(idx);
        }

        public int declare(String name, ArrowKind kind, double startValue, int lineNumber) {
            Integer existing = nameToIndex.get(name);
            if (existing != null)
                return existing;
            int idx = parameters.size();
            parameters.add(new Parameter(idx, name, kind, startValue, lineNumber));
            nameToIndex.put(name, idx);
            return idx;
        }

        public ParameterTable build() {
            return new ParameterTable(Collections.unmodifiableList(new ArrayList<>(parameters)),
                    Collections.unmodifiableMap(new HashMap<>(nameToIndex)));
        }
    }
}
