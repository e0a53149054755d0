package com.subledger.valuation;

import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.Partitions;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Spreads position-level MTM across the open lots of each position, pro rata on open notional
 * (remaining quantity times trade price).
 *
 * <p>Each open trade is joined to every valuation row of its position; a single-date feed has one
 * row per position, a time series one per date. Shares are rounded to {@code scale} decimals and
 * the last lot in FIFO order takes the rounding residual, so a position's shares always add up to
 * its valuation exactly. Positions with zero total notional allocate zero everywhere, and trades
 * with no valuation row carry a null valuation and a zero allocation.
 */
public final class ValuationAllocator {

    static final Comparator<OpenTrade> LOT_ORDER =
            Comparator.comparing((OpenTrade open) -> open.getTrade().getTradeDate())
                    .thenComparing(OpenTrade::getTradeId);

    static final Comparator<ValuationSnapshot> SNAPSHOT_ORDER =
            Comparator.comparing(ValuationSnapshot::getAsOfDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final int scale;

    public ValuationAllocator(int scale) {
        if (scale < 0) {
            throw new IllegalArgumentException("scale must not be negative: " + scale);
        }
        this.scale = scale;
    }

    public List<AllocatedTrade> allocate(
            List<OpenTrade> openTrades, List<ValuationSnapshot> valuations, LocalDate asOfDate) {
        SortedMap<PositionKey, List<ValuationSnapshot>> valuationsByKey =
                Partitions.byPosition(valuationsAsOf(valuations, asOfDate), ValuationSnapshot::getKey);
        List<AllocatedTrade> allocated = new ArrayList<>(openTrades.size());
        for (Map.Entry<PositionKey, List<OpenTrade>> group :
                Partitions.byPosition(openTrades, OpenTrade::getKey).entrySet()) {
            allocated.addAll(allocateGroup(group.getValue(), valuationsByKey.get(group.getKey())));
        }
        return allocated;
    }

    /** Allocation for the lots of one position against that position's valuation rows. */
    public List<AllocatedTrade> allocateGroup(List<OpenTrade> lots, List<ValuationSnapshot> valuationRows) {
        List<OpenTrade> ordered = new ArrayList<>(lots);
        ordered.sort(LOT_ORDER);
        List<AllocatedTrade> result = new ArrayList<>();
        if (valuationRows == null || valuationRows.isEmpty()) {
            for (OpenTrade lot : ordered) {
                result.add(new AllocatedTrade(lot, lot.openNotional(), null, null, BigDecimal.ZERO));
            }
            return result;
        }
        List<ValuationSnapshot> rows = new ArrayList<>(valuationRows);
        rows.sort(SNAPSHOT_ORDER);
        for (ValuationSnapshot row : rows) {
            result.addAll(allocateSnapshot(ordered, row.getAsOfDate(), row.getMtmAmount()));
        }
        return result;
    }

    private List<AllocatedTrade> allocateSnapshot(List<OpenTrade> ordered, LocalDate snapshotDate, BigDecimal valuation) {
        BigDecimal totalNotional = BigDecimal.ZERO;
        for (OpenTrade lot : ordered) {
            totalNotional = totalNotional.add(lot.openNotional());
        }
        List<AllocatedTrade> result = new ArrayList<>(ordered.size());
        if (totalNotional.signum() == 0) {
            for (OpenTrade lot : ordered) {
                result.add(new AllocatedTrade(lot, lot.openNotional(), snapshotDate, valuation, BigDecimal.ZERO));
            }
            return result;
        }
        BigDecimal allocatedSoFar = BigDecimal.ZERO;
        for (int i = 0; i < ordered.size(); i++) {
            OpenTrade lot = ordered.get(i);
            BigDecimal notional = lot.openNotional();
            BigDecimal share;
            if (i == ordered.size() - 1) {
                share = valuation.subtract(allocatedSoFar);
            } else {
                share = valuation.multiply(notional).divide(totalNotional, scale, RoundingMode.HALF_EVEN);
                allocatedSoFar = allocatedSoFar.add(share);
            }
            result.add(new AllocatedTrade(lot, notional, snapshotDate, valuation, share));
        }
        return result;
    }

    /** Valuation rows for {@code asOfDate}; undated rows always qualify. All rows when it is null. */
    public static List<ValuationSnapshot> valuationsAsOf(List<ValuationSnapshot> valuations, LocalDate asOfDate) {
        if (asOfDate == null) {
            return valuations;
        }
        List<ValuationSnapshot> filtered = new ArrayList<>();
        for (ValuationSnapshot valuation : valuations) {
            if (valuation.getAsOfDate() == null || valuation.getAsOfDate().equals(asOfDate)) {
                filtered.add(valuation);
            }
        }
        return filtered;
    }
}
