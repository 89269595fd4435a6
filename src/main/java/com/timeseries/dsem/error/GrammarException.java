package com.timeseries.dsem.error;

/**
 * Malformed model text: a bad equation, an unsigned-term violation, a record
 * with the wrong number of fields or an operator that is neither {@code ->}
 * nor {@code <->}.
 */
public class GrammarException extends SpecificationException {
    public GrammarException(String message, int lineNumber, String line, String token) {
        super(message, lineNumber, line, token);
    }
}
