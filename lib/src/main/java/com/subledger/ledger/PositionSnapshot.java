package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Independently sourced position quantity used as ground truth by the position control. */
public final class PositionSnapshot {
    private final String customerId;
    private final String instrumentId;
    private final String currency;
    private final LocalDate asOfDate;
    private final BigDecimal quantity;

    public PositionSnapshot(
            String customerId, String instrumentId, String currency, LocalDate asOfDate, BigDecimal quantity) {
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.instrumentId = Objects.requireNonNull(instrumentId, "instrumentId");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.asOfDate = asOfDate;
        this.quantity = Objects.requireNonNull(quantity, "quantity");
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public String getCurrency() {
        return currency;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public PositionKey getKey() {
        return new PositionKey(customerId, instrumentId, currency);
    }
}
