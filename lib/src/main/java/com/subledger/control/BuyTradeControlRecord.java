package com.subledger.control;

import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.util.Objects;

/** Purchase notional of one buy against its asset debit and cash credit. */
public final class BuyTradeControlRecord extends AbstractControlRecord {
    private final Trade trade;
    private final BigDecimal glCash;
    private final BigDecimal diffCash;

    public BuyTradeControlRecord(Trade trade, BigDecimal glAsset, BigDecimal glCash, ControlStatus status) {
        super(trade.notional(), glAsset, status);
        this.trade = Objects.requireNonNull(trade, "trade");
        this.glCash = Objects.requireNonNull(glCash, "glCash");
        this.diffCash = glCash.subtract(trade.notional());
    }

    public Trade getTrade() {
        return trade;
    }

    public String getTradeId() {
        return trade.getTradeId();
    }

    public BigDecimal getNotional() {
        return getExpected();
    }

    /** Net debit booked to the security asset account for the deal. */
    public BigDecimal getGlAsset() {
        return getDerived();
    }

    /** Net credit booked to the cash account for the deal. */
    public BigDecimal getGlCash() {
        return glCash;
    }

    public BigDecimal getDiffAsset() {
        return getDifference();
    }

    public BigDecimal getDiffCash() {
        return diffCash;
    }
}
