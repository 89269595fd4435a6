package com.timeseries.dsem.io;

import java.util.Locale;

/** The two accepted input notations. */
public enum Notation {
    ARROW, EQUATION;

    public static Notation fromString(String s) {
        if (s == null || s.isBlank())
            return ARROW;
        try {
            return valueOf(s.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown notation '" + s + "'; expected 'arrow' or 'equation'", e);
        }
    }
}
