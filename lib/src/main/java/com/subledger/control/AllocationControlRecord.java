package com.subledger.control;

import com.subledger.ledger.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Sum of lot allocations of one position and snapshot date against the position valuation. */
public final class AllocationControlRecord extends AbstractControlRecord {
    private final PositionKey key;
    private final LocalDate snapshotDate;

    public AllocationControlRecord(
            PositionKey key,
            LocalDate snapshotDate,
            BigDecimal valuationAmount,
            BigDecimal allocatedSum,
            ControlStatus status) {
        super(valuationAmount, allocatedSum, status);
        this.key = Objects.requireNonNull(key, "key");
        this.snapshotDate = snapshotDate;
    }

    public PositionKey getKey() {
        return key;
    }

    public LocalDate getSnapshotDate() {
        return snapshotDate;
    }

    public BigDecimal getValuationAmount() {
        return getExpected();
    }

    public BigDecimal getAllocatedSum() {
        return getDerived();
    }
}
