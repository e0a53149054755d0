package com.subledger.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/** A trade that still carries open inventory after FIFO matching. */
public final class OpenTrade {
    private final Trade trade;
    private final BigDecimal remainingQuantity;

    public OpenTrade(Trade trade, BigDecimal remainingQuantity) {
        this.trade = Objects.requireNonNull(trade, "trade");
        this.remainingQuantity = Objects.requireNonNull(remainingQuantity, "remainingQuantity");
    }

    public Trade getTrade() {
        return trade;
    }

    public String getTradeId() {
        return trade.getTradeId();
    }

    public PositionKey getKey() {
        return trade.getKey();
    }

    public BigDecimal getRemainingQuantity() {
        return remainingQuantity;
    }

    public boolean isOpen() {
        return remainingQuantity.signum() > 0;
    }

    /** Remaining quantity valued at the original trade price. */
    public BigDecimal openNotional() {
        return remainingQuantity.multiply(trade.getPrice());
    }
}
