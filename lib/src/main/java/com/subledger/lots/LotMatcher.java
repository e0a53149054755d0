package com.subledger.lots;

import com.subledger.ledger.PositionKey;
import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FIFO lot matcher for a single position.
 *
 * <p>Trades are ordered by (trade date, trade id). Every buy seeds a lot at the back of the queue;
 * sells are then applied in the same order and consume lots from the front until they are filled
 * or the queue runs dry. Sells never carry open inventory themselves.
 */
public final class LotMatcher {

    static final Comparator<Trade> FIFO_ORDER =
            Comparator.comparing(Trade::getTradeDate).thenComparing(Trade::getTradeId);

    private final OversellPolicy oversellPolicy;

    public LotMatcher() {
        this(OversellPolicy.REPORT);
    }

    public LotMatcher(OversellPolicy oversellPolicy) {
        this.oversellPolicy = Objects.requireNonNull(oversellPolicy, "oversellPolicy");
    }

    public LotMatchResult match(PositionKey key, List<Trade> groupTrades) {
        List<Trade> ordered = new ArrayList<>(groupTrades);
        ordered.sort(FIFO_ORDER);

        Map<String, BigDecimal> remaining = new LinkedHashMap<>();
        Deque<Lot> lots = new ArrayDeque<>();
        for (Trade trade : ordered) {
            remaining.put(trade.getTradeId(), BigDecimal.ZERO);
        }
        for (Trade trade : ordered) {
            if (trade.isBuy()) {
                lots.addLast(new Lot(trade.getTradeId(), trade.getQuantity()));
                remaining.put(trade.getTradeId(), trade.getQuantity());
            }
        }

        List<OversoldSell> oversold = new ArrayList<>();
        for (Trade trade : ordered) {
            if (trade.isBuy()) {
                continue;
            }
            BigDecimal toMatch = trade.getQuantity();
            while (toMatch.signum() > 0 && !lots.isEmpty()) {
                Lot head = lots.peekFirst();
                BigDecimal used = head.remaining.min(toMatch);
                head.remaining = head.remaining.subtract(used);
                toMatch = toMatch.subtract(used);
                remaining.merge(head.tradeId, used.negate(), BigDecimal::add);
                if (head.remaining.signum() == 0) {
                    lots.removeFirst();
                }
            }
            remaining.put(trade.getTradeId(), BigDecimal.ZERO);
            if (toMatch.signum() > 0) {
                handleOversell(key, trade, toMatch, oversold);
            }
        }
        return new LotMatchResult(key, ordered, remaining, oversold);
    }

    private void handleOversell(PositionKey key, Trade sell, BigDecimal unmatched, List<OversoldSell> out) {
        switch (oversellPolicy) {
            case IGNORE -> {
                // Unmatched quantity is dropped.
            }
            case REPORT -> out.add(
                    new OversoldSell(sell.getTradeId(), key, sell.getTradeDate(), sell.getQuantity(), unmatched));
            case REJECT -> throw new OversellException(
                    "Sell " + sell.getTradeId() + " exceeds open inventory of " + key + " by "
                            + unmatched.toPlainString());
            default -> throw new IllegalStateException("Unhandled oversell policy " + oversellPolicy);
        }
    }

    private static final class Lot {
        private final String tradeId;
        private BigDecimal remaining;

        Lot(String tradeId, BigDecimal quantity) {
            this.tradeId = tradeId;
            this.remaining = quantity;
        }
    }
}
