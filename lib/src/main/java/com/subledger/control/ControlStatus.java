package com.subledger.control;

import java.math.BigDecimal;

/**
 * Outcome of one reconciliation comparison.
 *
 * <p>MISSING_SOURCE = the externally sourced feed has no row for a derived figure.
 * MISSING_DERIVED = the feed has a row the derived ledger cannot account for.
 * A difference within tolerance is always MATCHED, whichever side was absent.
 */
public enum ControlStatus {
    MATCHED,
    BREAK,
    MISSING_SOURCE,
    MISSING_DERIVED;

    public static ControlStatus classify(
            boolean sourcePresent, boolean derivedPresent, BigDecimal difference, BigDecimal tolerance) {
        if (difference.abs().compareTo(tolerance) <= 0) {
            return MATCHED;
        }
        if (!sourcePresent) {
            return MISSING_SOURCE;
        }
        if (!derivedPresent) {
            return MISSING_DERIVED;
        }
        return BREAK;
    }

    public boolean isBreak() {
        return this != MATCHED;
    }
}
