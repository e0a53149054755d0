package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One leg of a double-entry journal. Trade postings carry the originating trade id as deal id;
 * MTM postings have none and balance per (position, posting date) instead.
 */
public final class GlPosting {
    private final LocalDate postingDate;
    private final String dealId;
    private final String customerId;
    private final String instrumentId;
    private final String currency;
    private final String accountCode;
    private final DebitCredit debitCredit;
    private final BigDecimal amount;
    private final PostingType postingType;

    public GlPosting(
            LocalDate postingDate,
            String dealId,
            String customerId,
            String instrumentId,
            String currency,
            String accountCode,
            DebitCredit debitCredit,
            BigDecimal amount,
            PostingType postingType) {
        this.postingDate = Objects.requireNonNull(postingDate, "postingDate");
        this.dealId = dealId;
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.instrumentId = Objects.requireNonNull(instrumentId, "instrumentId");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.accountCode = Objects.requireNonNull(accountCode, "accountCode");
        this.debitCredit = Objects.requireNonNull(debitCredit, "debitCredit");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.postingType = Objects.requireNonNull(postingType, "postingType");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Posting amount must not be negative: " + amount);
        }
    }

    public LocalDate getPostingDate() {
        return postingDate;
    }

    public String getDealId() {
        return dealId;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public String getCurrency() {
        return currency;
    }

    public PositionKey getKey() {
        return new PositionKey(customerId, instrumentId, currency);
    }

    public String getAccountCode() {
        return accountCode;
    }

    public DebitCredit getDebitCredit() {
        return debitCredit;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public PostingType getPostingType() {
        return postingType;
    }

    public BigDecimal signedAmount() {
        return debitCredit.sign(amount);
    }

    @Override
    public String toString() {
        return postingDate + " " + (dealId != null ? dealId : "-") + " " + accountCode + " " + debitCredit + " "
                + amount.toPlainString() + " " + postingType;
    }
}
