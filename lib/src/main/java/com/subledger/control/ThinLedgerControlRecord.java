package com.subledger.control;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** A supplied thin-ledger balance against the balance rebuilt from journals up to the same date. */
public final class ThinLedgerControlRecord extends AbstractControlRecord {
    private final LocalDate date;
    private final String accountCode;
    private final String currency;

    public ThinLedgerControlRecord(
            LocalDate date,
            String accountCode,
            String currency,
            BigDecimal ledgerBalance,
            BigDecimal rebuiltBalance,
            ControlStatus status) {
        super(ledgerBalance, rebuiltBalance, status);
        this.date = Objects.requireNonNull(date, "date");
        this.accountCode = Objects.requireNonNull(accountCode, "accountCode");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public LocalDate getDate() {
        return date;
    }

    public String getAccountCode() {
        return accountCode;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getLedgerBalance() {
        return getExpected();
    }

    public BigDecimal getRebuiltBalance() {
        return getDerived();
    }
}
