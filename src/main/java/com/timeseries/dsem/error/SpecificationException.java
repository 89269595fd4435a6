package com.timeseries.dsem.error;

/**
 * Base class for every failure raised while compiling model text.
 *
 * <p>
 * Carries the 1-based source line number, the raw line and the offending
 * token so that the message can be surfaced verbatim to the author of the
 * specification. Compilation errors are always fatal to that compilation and
 * are never retried.
 */
public class SpecificationException extends IllegalArgumentException {
    private final int lineNumber;
    private final String line;
    private final String token;

    public SpecificationException(String message, int lineNumber, String line, String token) {
        super(format(message, lineNumber, line, token));
        this.lineNumber = lineNumber;
        this.line = line;
        this.token = token;
    }

    private static String format(String message, int lineNumber, String line, String token) {
        StringBuilder sb = new StringBuilder(message);
        if (token != null)
            sb.append(" [token '").append(token).append("']");
        if (lineNumber > 0)
            sb.append(" at line ").append(lineNumber);
        if (line != null)
            sb.append(": ").append(line.strip());
        return sb.toString();
    }

    /** 1-based line number, or 0 when the failure is not tied to a line. */
    public int lineNumber() {
        return lineNumber;
    }

    public String line() {
        return line;
    }

    public String token() {
        return token;
    }
}
