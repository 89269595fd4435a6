package com.timeseries.dsem.error;

/** A directed arrow from a variable to itself at lag 0. */
public class SelfLoopException extends SpecificationException {
    public SelfLoopException(String variable, int lineNumber, String line) {
        super("Contemporaneous self-loop not allowed", lineNumber, line, variable);
    }
}
