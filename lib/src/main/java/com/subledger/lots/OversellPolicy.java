package com.subledger.lots;

import java.util.Locale;

/**
 * What the lot matcher does with sell quantity that finds no open buy lot to consume.
 *
 * <ul>
 *   <li>{@link #IGNORE}: drop the unmatched quantity silently.</li>
 *   <li>{@link #REPORT}: drop it from inventory but record an {@link OversoldSell}.</li>
 *   <li>{@link #REJECT}: fail the run with {@link OversellException}.</li>
 * </ul>
 */
public enum OversellPolicy {
    IGNORE,
    REPORT,
    REJECT;

    public static OversellPolicy fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OversellPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
