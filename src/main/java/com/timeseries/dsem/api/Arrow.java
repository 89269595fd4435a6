package com.timeseries.dsem.api;

/**
 * One compiled arrow: an edge of the structural graph with its parameter
 * identity already resolved.
 *
 * <p>
 * Free arrows reference their parameter by {@code parameterIndex}, the
 * position in the {@link ParameterTable} and therefore in the flat parameter
 * vector. Fixed arrows carry {@code parameterIndex == -1} and their literal in
 * {@code fixedValue}.
 *
 * @param kind           path or covariance
 * @param from           predictor (or first variable of a covariance pair)
 * @param to             response (or second variable of a covariance pair)
 * @param fromIndex      matrix index of {@code from}
 * @param toIndex        matrix index of {@code to}
 * @param lag            time steps between predictor and response, {@code >= 0}
 * @param label          parameter token as written (a name, a number or {@code NA})
 * @param parameterIndex index into the parameter vector, or -1 if fixed
 * @param fixedValue     the fixed value, {@code NaN} for free arrows
 * @param lineNumber     1-based source line the arrow was compiled from
 */
public record Arrow(
        ArrowKind kind, String from, String to, int fromIndex, int toIndex, int lag,
        String label, int parameterIndex, double fixedValue, int lineNumber) {

    public boolean isFixed() {
        return parameterIndex < 0;
    }

    /** Renders the arrow back in arrow notation. */
    public String toNotation() {
        return from + " " + kind.operator() + " " + to + ", " + lag + ", " + label;
    }
}
