package com.subledger.ledger;

import java.util.Comparator;
import java.util.Objects;

/** Thin-ledger series key. */
public record LedgerAccountKey(String accountCode, String currency) implements Comparable<LedgerAccountKey> {

    private static final Comparator<LedgerAccountKey> ORDER =
            Comparator.comparing(LedgerAccountKey::accountCode).thenComparing(LedgerAccountKey::currency);

    public LedgerAccountKey {
        Objects.requireNonNull(accountCode, "accountCode");
        Objects.requireNonNull(currency, "currency");
    }

    @Override
    public int compareTo(LedgerAccountKey other) {
        return ORDER.compare(this, other);
    }
}
