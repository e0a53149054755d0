package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * An open trade carrying its share of the position-level valuation. {@code valuationAmount} and
 * {@code snapshotDate} are null when no valuation row matched the trade's position.
 */
public final class AllocatedTrade {
    private final OpenTrade openTrade;
    private final BigDecimal openNotional;
    private final LocalDate snapshotDate;
    private final BigDecimal valuationAmount;
    private final BigDecimal mtmAllocated;

    public AllocatedTrade(
            OpenTrade openTrade,
            BigDecimal openNotional,
            LocalDate snapshotDate,
            BigDecimal valuationAmount,
            BigDecimal mtmAllocated) {
        this.openTrade = Objects.requireNonNull(openTrade, "openTrade");
        this.openNotional = Objects.requireNonNull(openNotional, "openNotional");
        this.snapshotDate = snapshotDate;
        this.valuationAmount = valuationAmount;
        this.mtmAllocated = Objects.requireNonNull(mtmAllocated, "mtmAllocated");
    }

    public OpenTrade getOpenTrade() {
        return openTrade;
    }

    public String getTradeId() {
        return openTrade.getTradeId();
    }

    public PositionKey getKey() {
        return openTrade.getKey();
    }

    public BigDecimal getOpenNotional() {
        return openNotional;
    }

    public LocalDate getSnapshotDate() {
        return snapshotDate;
    }

    public BigDecimal getValuationAmount() {
        return valuationAmount;
    }

    public boolean hasValuation() {
        return valuationAmount != null;
    }

    public BigDecimal getMtmAllocated() {
        return mtmAllocated;
    }
}
