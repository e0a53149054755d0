package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Thin-ledger row: the signed movement of one account/currency on one date and its running balance. */
public final class LedgerBalance {
    private final LocalDate date;
    private final String accountCode;
    private final String currency;
    private final BigDecimal dayChange;
    private final BigDecimal balance;

    public LedgerBalance(
            LocalDate date, String accountCode, String currency, BigDecimal dayChange, BigDecimal balance) {
        this.date = Objects.requireNonNull(date, "date");
        this.accountCode = Objects.requireNonNull(accountCode, "accountCode");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.dayChange = Objects.requireNonNull(dayChange, "dayChange");
        this.balance = Objects.requireNonNull(balance, "balance");
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

    public BigDecimal getDayChange() {
        return dayChange;
    }

    public BigDecimal getBalance() {
        return balance;
    }
}
