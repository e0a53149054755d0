package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single securities trade from the blotter. Quantity and price are expected to be positive; the
 * engine does not reject malformed values, it only reports them through validation diagnostics.
 */
public final class Trade {
    private final String tradeId;
    private final String customerId;
    private final String instrumentId;
    private final String currency;
    private final LocalDate tradeDate;
    private final TradeSide side;
    private final BigDecimal quantity;
    private final BigDecimal price;

    public Trade(
            String tradeId,
            String customerId,
            String instrumentId,
            String currency,
            LocalDate tradeDate,
            TradeSide side,
            BigDecimal quantity,
            BigDecimal price) {
        this.tradeId = Objects.requireNonNull(tradeId, "tradeId");
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.instrumentId = Objects.requireNonNull(instrumentId, "instrumentId");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.tradeDate = Objects.requireNonNull(tradeDate, "tradeDate");
        this.side = Objects.requireNonNull(side, "side");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.price = Objects.requireNonNull(price, "price");
    }

    public String getTradeId() {
        return tradeId;
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

    public LocalDate getTradeDate() {
        return tradeDate;
    }

    public TradeSide getSide() {
        return side;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public boolean isBuy() {
        return side == TradeSide.BUY;
    }

    public PositionKey getKey() {
        return new PositionKey(customerId, instrumentId, currency);
    }

    /** Quantity times price, unrounded. */
    public BigDecimal notional() {
        return quantity.multiply(price);
    }

    @Override
    public String toString() {
        return "Trade[" + tradeId + " " + side + " " + quantity + "@" + price + " " + getKey() + " " + tradeDate + "]";
    }
}
