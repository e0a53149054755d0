package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Front-office mark-to-market at position level. Single-date feeds may leave {@code asOfDate}
 * null; time series carry one row per (position, date).
 */
public final class ValuationSnapshot {
    private final String customerId;
    private final String instrumentId;
    private final String currency;
    private final LocalDate asOfDate;
    private final BigDecimal mtmAmount;

    public ValuationSnapshot(
            String customerId, String instrumentId, String currency, LocalDate asOfDate, BigDecimal mtmAmount) {
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.instrumentId = Objects.requireNonNull(instrumentId, "instrumentId");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.asOfDate = asOfDate;
        this.mtmAmount = Objects.requireNonNull(mtmAmount, "mtmAmount");
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

    public BigDecimal getMtmAmount() {
        return mtmAmount;
    }

    public PositionKey getKey() {
        return new PositionKey(customerId, instrumentId, currency);
    }
}
