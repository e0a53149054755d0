package com.subledger.control;

import com.subledger.ledger.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Front-office MTM level of one position on one date against the GL revaluation balance. */
public final class MtmControlRecord extends AbstractControlRecord {
    private final PositionKey key;
    private final LocalDate date;

    public MtmControlRecord(
            PositionKey key, LocalDate date, BigDecimal foMtm, BigDecimal glBalance, ControlStatus status) {
        super(foMtm, glBalance, status);
        this.key = Objects.requireNonNull(key, "key");
        this.date = Objects.requireNonNull(date, "date");
    }

    public PositionKey getKey() {
        return key;
    }

    public LocalDate getDate() {
        return date;
    }

    public BigDecimal getFoMtm() {
        return getExpected();
    }

    public BigDecimal getGlBalance() {
        return getDerived();
    }

    @Override
    public String toString() {
        return "MtmControlRecord[" + key + " " + date + ", fo=" + getFoMtm().toPlainString()
                + ", gl=" + getGlBalance().toPlainString() + ", " + getStatus() + "]";
    }
}
