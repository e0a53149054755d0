package com.subledger.posting;

import com.subledger.ledger.DebitCredit;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.PostingType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/** Appends the legs of one balanced journal (one deal, or one position and date) to a posting list. */
final class JournalBuilder {

    private final LocalDate postingDate;
    private final String dealId;
    private final PositionKey key;
    private final List<GlPosting> out;

    JournalBuilder(LocalDate postingDate, String dealId, PositionKey key, List<GlPosting> out) {
        this.postingDate = Objects.requireNonNull(postingDate, "postingDate");
        this.dealId = dealId;
        this.key = Objects.requireNonNull(key, "key");
        this.out = Objects.requireNonNull(out, "out");
    }

    JournalBuilder debit(String account, BigDecimal amount, PostingType type) {
        return add(account, DebitCredit.DR, amount, type);
    }

    JournalBuilder credit(String account, BigDecimal amount, PostingType type) {
        return add(account, DebitCredit.CR, amount, type);
    }

    /** Positive amounts are debited, zero and negative amounts credited at their absolute value. */
    JournalBuilder signed(String account, BigDecimal signedAmount, PostingType type) {
        return signedAmount.signum() > 0
                ? debit(account, signedAmount, type)
                : credit(account, signedAmount.abs(), type);
    }

    private JournalBuilder add(String account, DebitCredit side, BigDecimal amount, PostingType type) {
        out.add(
                new GlPosting(
                        postingDate,
                        dealId,
                        key.customerId(),
                        key.instrumentId(),
                        key.currency(),
                        account,
                        side,
                        amount,
                        type));
        return this;
    }
}
