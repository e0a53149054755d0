package com.subledger.ledger;

import java.util.Comparator;
import java.util.Objects;

/**
 * Grouping key of the subledger: every lot queue, cost-basis accumulator and valuation series is
 * scoped to one (customer, instrument, currency) triple.
 */
public record PositionKey(String customerId, String instrumentId, String currency)
        implements Comparable<PositionKey> {

    private static final Comparator<PositionKey> ORDER =
            Comparator.comparing(PositionKey::customerId)
                    .thenComparing(PositionKey::instrumentId)
                    .thenComparing(PositionKey::currency);

    public PositionKey {
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(instrumentId, "instrumentId");
        Objects.requireNonNull(currency, "currency");
    }

    @Override
    public int compareTo(PositionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return customerId + "/" + instrumentId + "/" + currency;
    }
}
