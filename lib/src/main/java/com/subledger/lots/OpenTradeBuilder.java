package com.subledger.lots;

import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.Partitions;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.Trade;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** Runs the lot matcher over a whole blotter, optionally cut off at an as-of date. */
public final class OpenTradeBuilder {

    private final LotMatcher matcher;

    public OpenTradeBuilder(LotMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public SortedMap<PositionKey, LotMatchResult> matchAll(List<Trade> trades, LocalDate asOfDate) {
        SortedMap<PositionKey, LotMatchResult> results = new TreeMap<>();
        for (Map.Entry<PositionKey, List<Trade>> group :
                Partitions.byPosition(tradesAsOf(trades, asOfDate), Trade::getKey).entrySet()) {
            results.put(group.getKey(), matcher.match(group.getKey(), group.getValue()));
        }
        return results;
    }

    public List<OpenTrade> openTrades(List<Trade> trades, LocalDate asOfDate) {
        return openTrades(matchAll(trades, asOfDate).values());
    }

    public static List<OpenTrade> openTrades(Collection<LotMatchResult> results) {
        List<OpenTrade> open = new ArrayList<>();
        for (LotMatchResult result : results) {
            open.addAll(result.openTrades());
        }
        return open;
    }

    /** Trades dated on or before {@code asOfDate}; all trades when it is null. */
    public static List<Trade> tradesAsOf(List<Trade> trades, LocalDate asOfDate) {
        if (asOfDate == null) {
            return trades;
        }
        List<Trade> filtered = new ArrayList<>(trades.size());
        for (Trade trade : trades) {
            if (!trade.getTradeDate().isAfter(asOfDate)) {
                filtered.add(trade);
            }
        }
        return filtered;
    }
}
