package com.subledger.control;

import com.subledger.ledger.PositionKey;
import com.subledger.ledger.PositionSnapshot;
import com.subledger.lots.LotMatchResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares the FIFO open quantity per position with the position feed. Positions present on only
 * one side are compared against zero.
 *
 * <p>When no as-of date is given and the feed holds several dates for a position, the latest one
 * is used; rows sharing a date are summed.
 */
public final class PositionControl {

    private final BigDecimal tolerance;

    public PositionControl(BigDecimal tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<PositionControlRecord> reconcile(
            Collection<LotMatchResult> matches, List<PositionSnapshot> snapshots, LocalDate asOfDate) {
        SortedMap<PositionKey, BigDecimal> derived = new TreeMap<>();
        for (LotMatchResult match : matches) {
            derived.merge(match.getKey(), match.openQuantity(), BigDecimal::add);
        }
        Map<PositionKey, Snapshot> expected = latestSnapshots(snapshots, asOfDate);

        TreeSet<PositionKey> keys = new TreeSet<>(derived.keySet());
        keys.addAll(expected.keySet());
        List<PositionControlRecord> records = new ArrayList<>(keys.size());
        for (PositionKey key : keys) {
            records.add(compare(key, derived.get(key), expected.get(key)));
        }
        return records;
    }

    public PositionControlRecord compare(PositionKey key, BigDecimal fifoQuantity, Snapshot snapshot) {
        BigDecimal derivedQty = fifoQuantity != null ? fifoQuantity : BigDecimal.ZERO;
        BigDecimal expectedQty = snapshot != null ? snapshot.quantity() : BigDecimal.ZERO;
        ControlStatus status =
                ControlStatus.classify(
                        snapshot != null, fifoQuantity != null, derivedQty.subtract(expectedQty), tolerance);
        return new PositionControlRecord(
                key, snapshot != null ? snapshot.date() : null, expectedQty, derivedQty, status);
    }

    static Map<PositionKey, Snapshot> latestSnapshots(List<PositionSnapshot> snapshots, LocalDate asOfDate) {
        Map<PositionKey, Snapshot> result = new TreeMap<>();
        for (PositionSnapshot row : snapshots) {
            LocalDate date = row.getAsOfDate();
            if (asOfDate != null && date != null && !asOfDate.equals(date)) {
                continue;
            }
            Snapshot current = result.get(row.getKey());
            if (current == null || isLater(date, current.date())) {
                result.put(row.getKey(), new Snapshot(date, row.getQuantity()));
            } else if (Objects.equals(date, current.date())) {
                result.put(row.getKey(), new Snapshot(date, current.quantity().add(row.getQuantity())));
            }
        }
        return result;
    }

    private static boolean isLater(LocalDate candidate, LocalDate current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }

    /** Quantity the feed reports for one position. */
    public record Snapshot(LocalDate date, BigDecimal quantity) {}
}
