package com.timeseries.dsem.api;

/**
 * A free parameter of the model.
 *
 * @param index      position in the flat parameter vector
 * @param name       symbol shared by every arrow that references it
 * @param kind       kind of the arrow that first introduced the symbol
 * @param startValue starting value for optimization
 * @param lineNumber line of first appearance
 */
public record Parameter(int index, String name, ArrowKind kind, double startValue, int lineNumber) {
}
