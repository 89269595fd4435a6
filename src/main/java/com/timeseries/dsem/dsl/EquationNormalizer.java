package com.timeseries.dsem.dsl;

import com.timeseries.dsem.api.ArrowKind;
import com.timeseries.dsem.error.GrammarException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites equation notation into arrow records.
 *
 * <p>
 * Accepted lines:
 *
 * <pre>
 * y = a*x + b*lag[y, 1] + z      # structural equation for y
 * V(y) = sigma_y                 # variance
 * C(x, y) = rho                  # covariance
 * </pre>
 *
 * Terms are joined by {@code +} only; a minus sign anywhere in a term is
 * rejected because signs are estimated. A coefficient may be a symbol or an
 * unsigned number (fixed). A bare term receives a generated name
 * {@code b_<response>_<predictor>[_lag<k>]}, made unique with a numeric suffix.
 * Equations for the same response on several lines are concatenated.
 *
 * <p>
 * The normalizer is purely syntactic: variable names are checked later by
 * {@link ArrowNotationParser#validate(ArrowRecord)}.
 */
public final class EquationNormalizer {
    private static final Pattern LAG = Pattern.compile("lag\\s*\\[\\s*([^,\\]]+?)\\s*,\\s*([^\\]]*?)\\s*\\]");
    private static final Pattern VARIANCE = Pattern.compile("V\\s*\\(\\s*([^,()]+?)\\s*\\)");
    private static final Pattern COVARIANCE = Pattern.compile("C\\s*\\(\\s*([^,()]+?)\\s*,\\s*([^,()]+?)\\s*\\)");

    /** Normalizes {@code text} into arrow records, in source order. */
    public List<ArrowRecord> normalize(String text) {
        List<Term> terms = new ArrayList<>();
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String body = Tokens.stripComment(lines[i]).strip();
            if (!body.isEmpty())
                parseLine(body, i + 1, lines[i], terms);
        }

        // Generated names must not capture an explicit coefficient written anywhere in the text.
        Set<String> taken = new HashSet<>();
        for (Term t : terms)
            if (t.coefficient != null)
                taken.add(t.coefficient);

        List<ArrowRecord> out = new ArrayList<>(terms.size());
        for (Term t : terms) {
            String coef = t.coefficient;
            if (coef == null) {
                coef = uniqueName(t, taken);
                taken.add(coef);
            }
            out.add(new ArrowRecord(t.kind, t.from, t.to, t.lag, coef, null, t.lineNumber, t.line));
        }
        return out;
    }

    /** Normalizes {@code text} and renders the result as arrow notation. */
    public String toArrowNotation(String text) {
        return normalize(text).stream().map(ArrowRecord::toArrowLine).collect(Collectors.joining("\n"));
    }

    private void parseLine(String body, int lineNumber, String line, List<Term> terms) {
        int eq = body.indexOf('=');
        if (eq < 0 || body.indexOf('=', eq + 1) >= 0)
            throw new GrammarException("Equation must contain exactly one '='", lineNumber, line, null);
        String lhs = body.substring(0, eq).strip();
        String rhs = body.substring(eq + 1).strip();
        if (lhs.isEmpty())
            throw new GrammarException("Missing response on left-hand side", lineNumber, line, null);
        if (rhs.isEmpty())
            throw new GrammarException("Missing right-hand side", lineNumber, line, null);

        Matcher m;
        if ((m = VARIANCE.matcher(lhs)).matches()) {
            String v = m.group(1);
            terms.add(new Term(ArrowKind.COVARIANCE, v, v, 0, coefficientOnly(rhs, lineNumber, line), lineNumber, line));
            return;
        }
        if ((m = COVARIANCE.matcher(lhs)).matches()) {
            terms.add(new Term(ArrowKind.COVARIANCE, m.group(1), m.group(2), 0,
                    coefficientOnly(rhs, lineNumber, line), lineNumber, line));
            return;
        }
        if (!Tokens.isIdentifier(lhs))
            throw new GrammarException("Response is not a variable name", lineNumber, line, lhs);

        for (String raw : splitTerms(rhs)) {
            String term = raw.strip();
            if (term.isEmpty())
                throw new GrammarException("Empty term", lineNumber, line, rhs);
            if (term.startsWith("-"))
                throw new GrammarException("Unary minus is not allowed; signs are estimated", lineNumber, line, term);
            terms.add(parseTerm(term, lhs, lineNumber, line));
        }
    }

    private Term parseTerm(String term, String response, int lineNumber, String line) {
        String coef = null;
        String factor = term;
        int star = term.indexOf('*');
        if (star >= 0) {
            coef = term.substring(0, star).strip();
            factor = term.substring(star + 1).strip();
            if (!Tokens.isIdentifier(coef) && !Tokens.isUnsignedNumber(coef))
                throw badTerm("Coefficient must be a name or an unsigned number", term, lineNumber, line);
            if (factor.indexOf('*') >= 0)
                throw badTerm("A term may have only one coefficient", term, lineNumber, line);
        }

        String predictor;
        int lag = 0;
        Matcher m = LAG.matcher(factor);
        if (m.matches()) {
            predictor = m.group(1);
            lag = ArrowNotationParser.parseLag(m.group(2), lineNumber, line);
        } else {
            predictor = factor;
        }
        if (!Tokens.isIdentifier(predictor))
            throw badTerm("Predictor must be a variable name or lag[variable, k]", term, lineNumber, line);
        return new Term(ArrowKind.PATH, predictor, response, lag, coef, lineNumber, line);
    }

    private static GrammarException badTerm(String message, String term, int lineNumber, String line) {
        if (term.indexOf('-') >= 0)
            message = "Subtraction and negative literals are not allowed; signs are estimated";
        return new GrammarException(message, lineNumber, line, term);
    }

    private String coefficientOnly(String rhs, int lineNumber, String line) {
        if (rhs.startsWith("-"))
            throw new GrammarException("Unary minus is not allowed; signs are estimated", lineNumber, line, rhs);
        if (!Tokens.isIdentifier(rhs) && !Tokens.isUnsignedNumber(rhs))
            throw new GrammarException("Variance or covariance must be a single name or number", lineNumber, line, rhs);
        return rhs;
    }

    /** Splits on top-level '+' while keeping exponents such as {@code 1e+3} intact. */
    static List<String> splitTerms(String rhs) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < rhs.length(); i++) {
            char c = rhs.charAt(i);
            if (c == '[' || c == '(') {
                depth++;
            } else if (c == ']' || c == ')') {
                depth--;
            } else if (c == '+' && depth == 0 && !isExponentSign(rhs, start, i)) {
                out.add(rhs.substring(start, i));
                start = i + 1;
            }
        }
        out.add(rhs.substring(start));
        return out;
    }

    private static boolean isExponentSign(String s, int termStart, int plusAt) {
        String before = s.substring(termStart, plusAt).strip();
        return before.matches("(\\d+\\.?\\d*|\\.\\d+)[eE]");
    }

    private static String uniqueName(Term t, Set<String> taken) {
        String base = "b_" + t.to + "_" + t.from + (t.lag > 0 ? "_lag" + t.lag : "");
        if (!taken.contains(base))
            return base;
        int suffix = 2;
        while (taken.contains(base + "_" + suffix))
            suffix++;
        return base + "_" + suffix;
    }

    private record Term(ArrowKind kind, String from, String to, int lag, String coefficient,
            int lineNumber, String line) {
    }
}
