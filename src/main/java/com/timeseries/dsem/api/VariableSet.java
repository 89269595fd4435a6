package com.timeseries.dsem.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, duplicate-free universe of time-series variables.
 *
 * <p>
 * Position in this set is the row/column index of every matrix the engine
 * builds, so callers must preserve the column order of their data panel.
 */
public final class VariableSet {
    private final String[] names;
    private final Map<String, Integer> nameToIndex;

    private VariableSet(String[] names) {
        this.names = names;
        this.nameToIndex = new HashMap<>(names.length * 2);
        for (int i = 0; i < names.length; i++) {
            String n = names[i];
            if (n == null || n.isBlank())
                throw new IllegalArgumentException("Blank variable name at position " + i);
            if (nameToIndex.put(n, i) != null)
                throw new IllegalArgumentException("Duplicate variable name: " + n);
        }
    }

    public static VariableSet of(String... names) {
        return new VariableSet(names.clone());
    }

    public static VariableSet of(List<String> names) {
        return new VariableSet(names.toArray(new String[0]));
    }

    public int size() {
        return names.length;
    }

    public String name(int index) {
        return names[index];
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    /** Returns the matrix index of {@code name}, or -1 when unknown. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        return idx == null ? -1 : idx;
    }

    /** Like {@link #indexOf(String)} but fails for unknown names. */
    public int requireIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown variable: " + name);
        return idx;
    }

    public List<String> names() {
        return Collections.unmodifiableList(Arrays.asList(names));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableSet other && Arrays.equals(names, other.names);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(names);
    }

    @Override
    public String toString() {
        return Arrays.toString(names);
    }
}
