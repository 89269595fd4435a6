package com.timeseries.dsem.dsl;

import com.timeseries.dsem.api.ArrowKind;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.error.GrammarException;
import com.timeseries.dsem.error.InvalidLagException;
import com.timeseries.dsem.error.SelfLoopException;
import com.timeseries.dsem.error.UnknownVariableException;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes arrow notation into validated {@link ArrowRecord}s.
 *
 * <p>
 * One record per non-blank line:
 *
 * <pre>
 * from -> to, lag, parameter [, start]
 * from <-> to, lag, parameter [, start]
 * </pre>
 *
 * Text after {@code #} is a comment. Whitespace around tokens is ignored. A
 * start value of {@code NA} or an empty field means "use the default".
 */
public final class ArrowNotationParser {
    private final VariableSet variables;

    public ArrowNotationParser(VariableSet variables) {
        this.variables = variables;
    }

    /** Parses and validates every record in {@code text}, in source order. */
    public List<ArrowRecord> parse(String text) {
        List<ArrowRecord> records = new ArrayList<>();
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String body = Tokens.stripComment(lines[i]).strip();
            if (body.isEmpty())
                continue;
            ArrowRecord r = parseRecord(body, i + 1, lines[i]);
            validate(r);
            records.add(r);
        }
        return records;
    }

    /**
     * Parses a single record without checking it against the variable universe.
     *
     * @param record     the record body, comment already stripped
     * @param lineNumber line reported in errors
     * @param sourceLine line text reported in errors
     */
    public ArrowRecord parseRecord(String record, int lineNumber, String sourceLine) {
        String[] fields = record.split(",", -1);
        if (fields.length < 3 || fields.length > 4)
            throw new GrammarException("Expected 'from -> to, lag, parameter [, start]' but found "
                    + fields.length + " fields", lineNumber, sourceLine, null);

        String edge = fields[0].strip();
        ArrowKind kind;
        int opAt = edge.indexOf(ArrowKind.COVARIANCE.operator());
        if (opAt >= 0) {
            kind = ArrowKind.COVARIANCE;
        } else {
            opAt = edge.indexOf(ArrowKind.PATH.operator());
            if (opAt < 0)
                throw new GrammarException("Missing arrow operator '->' or '<->'", lineNumber, sourceLine, edge);
            kind = ArrowKind.PATH;
        }
        String from = edge.substring(0, opAt).strip();
        String to = edge.substring(opAt + kind.operator().length()).strip();
        if (from.isEmpty() || to.isEmpty())
            throw new GrammarException("Arrow needs a variable on both sides", lineNumber, sourceLine, edge);

        int lag = parseLag(fields[1].strip(), lineNumber, sourceLine);

        String parameter = fields[2].strip();
        if (parameter.isEmpty())
            throw new GrammarException("Missing parameter name", lineNumber, sourceLine, null);
        if (parameter.contains(" ") || parameter.contains("\t"))
            throw new GrammarException("Parameter name contains whitespace", lineNumber, sourceLine, parameter);

        Double start = null;
        if (fields.length == 4) {
            String s = fields[3].strip();
            if (!s.isEmpty() && !s.equals(Tokens.FIXED_AT_START)) {
                if (!Tokens.isNumber(s))
                    throw new GrammarException("Start value is not a number", lineNumber, sourceLine, s);
                start = Double.parseDouble(s);
            }
        }
        return new ArrowRecord(kind, from, to, lag, parameter, start, lineNumber, sourceLine);
    }

    /** Checks a record against the variable universe and the self-loop rule. */
    public void validate(ArrowRecord r) {
        if (!variables.contains(r.from()))
            throw new UnknownVariableException(r.from(), r.lineNumber(), r.line());
        if (!variables.contains(r.to()))
            throw new UnknownVariableException(r.to(), r.lineNumber(), r.line());
        if (r.kind() == ArrowKind.PATH && r.lag() == 0 && r.from().equals(r.to()))
            throw new SelfLoopException(r.from(), r.lineNumber(), r.line());
    }

    static int parseLag(String token, int lineNumber, String sourceLine) {
        int lag;
        try {
            lag = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidLagException(token, lineNumber, sourceLine);
        }
        if (lag < 0)
            throw new InvalidLagException(token, lineNumber, sourceLine);
        return lag;
    }

    public VariableSet variables() {
        return variables;
    }
}
