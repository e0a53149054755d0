package com.subledger.ledger;

import java.util.Locale;

public enum TradeSide {
    BUY,
    SELL;

    public static TradeSide fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return TradeSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
