package com.subledger.control;

import com.subledger.ledger.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** FIFO open quantity of one position against the position feed. */
public final class PositionControlRecord extends AbstractControlRecord {
    private final PositionKey key;
    private final LocalDate snapshotDate;

    public PositionControlRecord(
            PositionKey key,
            LocalDate snapshotDate,
            BigDecimal snapshotQuantity,
            BigDecimal fifoQuantity,
            ControlStatus status) {
        super(snapshotQuantity, fifoQuantity, status);
        this.key = Objects.requireNonNull(key, "key");
        this.snapshotDate = snapshotDate;
    }

    public PositionKey getKey() {
        return key;
    }

    /** Date of the snapshot row compared, null when the feed had none or it was undated. */
    public LocalDate getSnapshotDate() {
        return snapshotDate;
    }

    public BigDecimal getSnapshotQuantity() {
        return getExpected();
    }

    public BigDecimal getFifoQuantity() {
        return getDerived();
    }

    @Override
    public String toString() {
        return "PositionControlRecord[" + key + ", fifo=" + getFifoQuantity().toPlainString()
                + ", snapshot=" + getSnapshotQuantity().toPlainString() + ", " + getStatus() + "]";
    }
}
