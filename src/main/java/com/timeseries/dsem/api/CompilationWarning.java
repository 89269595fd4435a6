package com.timeseries.dsem.api;

/**
 * A condition that compilation resolved deterministically but that the
 * author probably did not intend, such as a shared parameter given two
 * different start values.
 */
public record CompilationWarning(int lineNumber, String line, String message) {
    @Override
    public String toString() {
        return "line " + lineNumber + ": " + message + (line != null ? " (" + line.strip() + ")" : "");
    }
}
