package com.timeseries.dsem.dsl;

import java.util.regex.Pattern;

/** Lexical helpers shared by both notations. */
final class Tokens {
    /** Token that fixes an arrow at its start value. */
    static final String FIXED_AT_START = "NA";

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern UNSIGNED_NUMBER = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_.][A-Za-z0-9_.]*");

    private Tokens() {
    }

    static boolean isNumber(String token) {
        return NUMBER.matcher(token).matches();
    }

    static boolean isUnsignedNumber(String token) {
        return UNSIGNED_NUMBER.matcher(token).matches();
    }

    static boolean isIdentifier(String token) {
        return IDENTIFIER.matcher(token).matches();
    }

    /** Removes a trailing {@code #} comment. */
    static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }
}
