package com.subledger.posting;

import java.util.Locale;

/**
 * Treatment of a cost basis driven negative by selling out of a flat or short position, where
 * the sell price stands in for the missing average cost.
 */
public enum CostBasisPolicy {
    /** Keep the negative balance as computed. */
    PRESERVE,
    /** Floor the cost basis at zero when the sell leaves the position flat or short. */
    CLAMP,
    /** Keep the negative balance and report the sell. */
    FLAG;

    public static CostBasisPolicy fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return CostBasisPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
