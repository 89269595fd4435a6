package com.timeseries.dsem.error;

/** An arrow or group names a variable outside the variable universe. */
public class UnknownVariableException extends SpecificationException {
    public UnknownVariableException(String variable, int lineNumber, String line) {
        super("Unknown variable", lineNumber, line, variable);
    }
}
