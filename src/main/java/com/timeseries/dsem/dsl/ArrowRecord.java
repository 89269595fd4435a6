package com.timeseries.dsem.dsl;

import com.timeseries.dsem.api.ArrowKind;

/**
 * One arrow as written, before parameter identities are resolved.
 *
 * @param parameter  parameter token: a symbol, a numeric literal or {@code NA}
 * @param startValue explicit start value, or null when none was given
 * @param lineNumber 1-based source line, 0 for arrows generated from
 *                   covariance groups
 * @param line       source text the arrow came from
 */
public record ArrowRecord(
        ArrowKind kind, String from, String to, int lag, String parameter, Double startValue,
        int lineNumber, String line) {

    /** Renders this record as an arrow-notation line. */
    public String toArrowLine() {
        String s = from + " " + kind.operator() + " " + to + ", " + lag + ", " + parameter;
        return startValue == null ? s : s + ", " + startValue;
    }
}
