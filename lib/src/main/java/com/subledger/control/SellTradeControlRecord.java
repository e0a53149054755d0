package com.subledger.control;

import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Sale proceeds of one sell against its cash debit, plus the balance check
 * {@code cash - (asset + pnl)}. P&amp;L is signed: gains positive, losses negative.
 */
public final class SellTradeControlRecord extends AbstractControlRecord {
    private final Trade trade;
    private final BigDecimal glAsset;
    private final BigDecimal glPnl;
    private final BigDecimal balanceCheck;

    public SellTradeControlRecord(
            Trade trade, BigDecimal glCash, BigDecimal glAsset, BigDecimal glPnl, ControlStatus status) {
        super(trade.notional(), glCash, status);
        this.trade = Objects.requireNonNull(trade, "trade");
        this.glAsset = Objects.requireNonNull(glAsset, "glAsset");
        this.glPnl = Objects.requireNonNull(glPnl, "glPnl");
        this.balanceCheck = glCash.subtract(glAsset.add(glPnl));
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

    /** Net debit booked to cash. */
    public BigDecimal getGlCash() {
        return getDerived();
    }

    /** Net credit booked to the security asset account. */
    public BigDecimal getGlAsset() {
        return glAsset;
    }

    /** Net credit booked to realised P&amp;L. */
    public BigDecimal getGlPnl() {
        return glPnl;
    }

    public BigDecimal getDiffCash() {
        return getDifference();
    }

    public BigDecimal getBalanceCheck() {
        return balanceCheck;
    }
}
