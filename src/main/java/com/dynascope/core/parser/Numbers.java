package com.dynascope.core.parser;

import java.util.regex.Pattern;

/**
 * Number parsing for solver output.
 */
final class Numbers {

    /** Fortran drops the exponent letter for three-digit exponents: {@code 1.234-100}. */
    private static final Pattern BARE_EXPONENT = Pattern.compile("^([+-]?\\d*\\.\\d*)([+-]\\d{2,3})$");

    private Numbers() {}

    /**
     * Parses a solver floating-point field.
     *
     * @throws NumberFormatException when the text is not a number (for example an overflow field of asterisks)
     */
    static double parseDouble(String text) {
        String trimmed = text.trim();
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            var m = BARE_EXPONENT.matcher(trimmed);
            if (m.matches()) {
                return Double.parseDouble(m.group(1) + "E" + m.group(2));
            }
            throw e;
        }
    }

    static int parseInt(String text) {
        return Integer.parseInt(text.trim());
    }

    static long parseLong(String text) {
        return Long.parseLong(text.trim());
    }

    /** Parses a field that is allowed to be absent or broken, returning {@code fallback} instead. */
    static double parseDoubleOr(String text, double fallback) {
        if (text == null) {
            return fallback;
        }
        try {
            return parseDouble(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static int parseIntOr(String text, int fallback) {
        if (text == null) {
            return fallback;
        }
        try {
            return parseInt(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static long parseLongOr(String text, long fallback) {
        if (text == null) {
            return fallback;
        }
        try {
            return parseLong(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
