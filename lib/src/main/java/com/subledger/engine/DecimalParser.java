package com.subledger.engine;

import java.math.BigDecimal;

/**
 * Parses decimals as CSV exports and property files write them: '.' is the only decimal separator
 * and an exponent such as {@code 1e-05} is allowed. A comma is rejected rather than guessed at,
 * since {@code 1,000} may be a grouped thousand or a decimal comma.
 */
public final class DecimalParser {

    private DecimalParser() {}

    /** Returns null for null or blank text; throws {@link NumberFormatException} for anything unparseable. */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        if (value.indexOf(',') >= 0) {
            throw new NumberFormatException("Comma in decimal not allowed: " + text);
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException ex) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
    }
}
