package com.subledger.control;

import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Checks that allocations add back up to the position valuation, per position and snapshot date.
 * Valuations without open lots and lots without a valuation both show up as rows.
 */
public final class AllocationControl {

    private final BigDecimal tolerance;

    public AllocationControl(BigDecimal tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<AllocationControlRecord> reconcile(List<AllocatedTrade> allocated, List<ValuationSnapshot> valuations) {
        Map<SnapshotKey, BigDecimal> derived = new TreeMap<>();
        for (AllocatedTrade trade : allocated) {
            derived.merge(new SnapshotKey(trade.getKey(), trade.getSnapshotDate()), trade.getMtmAllocated(), BigDecimal::add);
        }
        Map<SnapshotKey, BigDecimal> expected = new TreeMap<>();
        for (ValuationSnapshot valuation : valuations) {
            expected.merge(
                    new SnapshotKey(valuation.getKey(), valuation.getAsOfDate()), valuation.getMtmAmount(), BigDecimal::add);
        }

        TreeSet<SnapshotKey> keys = new TreeSet<>(derived.keySet());
        keys.addAll(expected.keySet());
        List<AllocationControlRecord> records = new ArrayList<>(keys.size());
        for (SnapshotKey key : keys) {
            BigDecimal allocatedSum = derived.getOrDefault(key, BigDecimal.ZERO);
            BigDecimal valuation = expected.getOrDefault(key, BigDecimal.ZERO);
            ControlStatus status =
                    ControlStatus.classify(
                            expected.containsKey(key),
                            derived.containsKey(key),
                            allocatedSum.subtract(valuation),
                            tolerance);
            records.add(new AllocationControlRecord(key.key(), key.date(), valuation, allocatedSum, status));
        }
        return records;
    }
}
