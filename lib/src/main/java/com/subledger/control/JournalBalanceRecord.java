package com.subledger.control;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Debit and credit totals of all journals of one currency on one posting date. */
public final class JournalBalanceRecord extends AbstractControlRecord {
    private final LocalDate postingDate;
    private final String currency;

    public JournalBalanceRecord(
            LocalDate postingDate, String currency, BigDecimal totalDebit, BigDecimal totalCredit, ControlStatus status) {
        super(totalDebit, totalCredit, status);
        this.postingDate = Objects.requireNonNull(postingDate, "postingDate");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public LocalDate getPostingDate() {
        return postingDate;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getTotalDebit() {
        return getExpected();
    }

    public BigDecimal getTotalCredit() {
        return getDerived();
    }

    /** Debits minus credits; zero for a balanced day. */
    public BigDecimal getNet() {
        return getDifference().negate();
    }
}
