package com.subledger.control;

import com.subledger.ledger.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Day-on-day MTM change of one position against that day's net revaluation journal. */
public final class MtmDeltaRecord extends AbstractControlRecord {
    private final PositionKey key;
    private final LocalDate date;

    public MtmDeltaRecord(
            PositionKey key, LocalDate date, BigDecimal foChange, BigDecimal journalChange, ControlStatus status) {
        super(foChange, journalChange, status);
        this.key = Objects.requireNonNull(key, "key");
        this.date = Objects.requireNonNull(date, "date");
    }

    public PositionKey getKey() {
        return key;
    }

    public LocalDate getDate() {
        return date;
    }

    public BigDecimal getFoChange() {
        return getExpected();
    }

    public BigDecimal getJournalChange() {
        return getDerived();
    }
}
