package com.subledger.validation;

import com.subledger.engine.SubledgerMessage;
import com.subledger.engine.SubledgerMessage.Level;
import com.subledger.ledger.GlPosting;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every journal must net to zero: trade journals per deal id, MTM journals (which carry no deal
 * id) per position and posting date.
 */
final class DoubleEntryBalanceRule implements ValidationRule {

    private final BigDecimal tolerance;

    DoubleEntryBalanceRule(BigDecimal tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    @Override
    public List<SubledgerMessage> validate(ValidationContext context) {
        Map<String, BigDecimal> nets = new LinkedHashMap<>();
        for (GlPosting posting : context.postings()) {
            String journal =
                    posting.getDealId() != null
                            ? posting.getDealId()
                            : posting.getKey() + "@" + posting.getPostingDate();
            nets.merge(journal, posting.signedAmount(), BigDecimal::add);
        }
        List<SubledgerMessage> messages = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> net : nets.entrySet()) {
            if (net.getValue().abs().compareTo(tolerance) > 0) {
                messages.add(
                        new SubledgerMessage(
                                Level.ERROR,
                                "Journal does not balance, debits minus credits = " + net.getValue().toPlainString(),
                                net.getKey()));
            }
        }
        return messages;
    }
}
