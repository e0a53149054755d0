package com.subledger.lots;

import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Outcome of matching one position: remaining quantity per trade, in FIFO order. */
public final class LotMatchResult {
    private final PositionKey key;
    private final List<Trade> orderedTrades;
    private final Map<String, BigDecimal> remainingByTradeId;
    private final List<OversoldSell> oversoldSells;

    LotMatchResult(
            PositionKey key,
            List<Trade> orderedTrades,
            Map<String, BigDecimal> remainingByTradeId,
            List<OversoldSell> oversoldSells) {
        this.key = Objects.requireNonNull(key, "key");
        this.orderedTrades = List.copyOf(orderedTrades);
        this.remainingByTradeId = Collections.unmodifiableMap(remainingByTradeId);
        this.oversoldSells = List.copyOf(oversoldSells);
    }

    public PositionKey getKey() {
        return key;
    }

    /** Trades sorted by (trade date, trade id). */
    public List<Trade> getOrderedTrades() {
        return orderedTrades;
    }

    public Map<String, BigDecimal> getRemainingByTradeId() {
        return remainingByTradeId;
    }

    public BigDecimal remainingQuantity(String tradeId) {
        BigDecimal remaining = remainingByTradeId.get(tradeId);
        return remaining != null ? remaining : BigDecimal.ZERO;
    }

    /** FIFO-derived open position: the sum of all remaining quantities. */
    public BigDecimal openQuantity() {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal remaining : remainingByTradeId.values()) {
            total = total.add(remaining);
        }
        return total;
    }

    public List<OpenTrade> openTrades() {
        List<OpenTrade> open = new ArrayList<>();
        for (Trade trade : orderedTrades) {
            BigDecimal remaining = remainingQuantity(trade.getTradeId());
            if (remaining.signum() > 0) {
                open.add(new OpenTrade(trade, remaining));
            }
        }
        return open;
    }

    public List<OversoldSell> getOversoldSells() {
        return oversoldSells;
    }
}
