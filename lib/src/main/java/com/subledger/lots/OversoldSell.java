package com.subledger.lots;

import com.subledger.ledger.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** A sell whose quantity exceeded the open buy inventory of its position. */
public final class OversoldSell {
    private final String tradeId;
    private final PositionKey key;
    private final LocalDate tradeDate;
    private final BigDecimal sellQuantity;
    private final BigDecimal unmatchedQuantity;

    public OversoldSell(
            String tradeId, PositionKey key, LocalDate tradeDate, BigDecimal sellQuantity, BigDecimal unmatchedQuantity) {
        this.tradeId = Objects.requireNonNull(tradeId, "tradeId");
        this.key = Objects.requireNonNull(key, "key");
        this.tradeDate = Objects.requireNonNull(tradeDate, "tradeDate");
        this.sellQuantity = Objects.requireNonNull(sellQuantity, "sellQuantity");
        this.unmatchedQuantity = Objects.requireNonNull(unmatchedQuantity, "unmatchedQuantity");
    }

    public String getTradeId() {
        return tradeId;
    }

    public PositionKey getKey() {
        return key;
    }

    public LocalDate getTradeDate() {
        return tradeDate;
    }

    public BigDecimal getSellQuantity() {
        return sellQuantity;
    }

    public BigDecimal getUnmatchedQuantity() {
        return unmatchedQuantity;
    }
}
