package com.timeseries.dsem.error;

/** The lag field does not parse as a non-negative integer. */
public class InvalidLagException extends SpecificationException {
    public InvalidLagException(String lag, int lineNumber, String line) {
        super("Lag must be a non-negative integer", lineNumber, line, lag);
    }
}
