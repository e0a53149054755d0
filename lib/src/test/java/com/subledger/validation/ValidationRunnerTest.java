package com.subledger.validation;

import static com.subledger.testing.Fixtures.GB01;
import static com.subledger.testing.Fixtures.buy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.engine.SubledgerMessage;
import com.subledger.ledger.DebitCredit;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.PostingType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ValidationRunnerTest {

    private final ValidationRunner runner = ValidationRunner.defaultRules(new BigDecimal("0.000001"));

    @Test
    void duplicateTradeIdsAndZeroPricesAreWarnings() {
        List<SubledgerMessage> messages =
                runner.run(
                        new ValidationContext(
                                List.of(
                                        buy("T1", GB01, "2025-01-02", "10", "5"),
                                        buy("T1", GB01, "2025-01-03", "10", "0")),
                                List.of()));

        assertEquals(2, messages.size());
        for (SubledgerMessage message : messages) {
            assertEquals(SubledgerMessage.Level.WARNING, message.getLevel());
            assertEquals("T1", message.getSubject());
        }
        assertTrue(messages.get(0).getMessage().startsWith("Duplicate"));
    }

    @Test
    void unbalancedJournalIsAnError() {
        List<GlPosting> postings =
                List.of(
                        leg("D1", DebitCredit.DR, "100"),
                        leg("D1", DebitCredit.CR, "100"),
                        leg("D2", DebitCredit.DR, "100"),
                        leg("D2", DebitCredit.CR, "99.5"));

        List<SubledgerMessage> messages = runner.run(new ValidationContext(List.of(), postings));

        assertEquals(1, messages.size());
        assertEquals(SubledgerMessage.Level.ERROR, messages.get(0).getLevel());
        assertEquals("D2", messages.get(0).getSubject());
    }

    @Test
    void mtmLegsBalancePerPositionAndDate() {
        List<GlPosting> postings =
                List.of(leg(null, DebitCredit.DR, "7"), leg(null, DebitCredit.CR, "7"));

        assertTrue(runner.run(new ValidationContext(List.of(), postings)).isEmpty());
    }

    private static GlPosting leg(String dealId, DebitCredit side, String amount) {
        return new GlPosting(
                LocalDate.of(2025, 1, 6),
                dealId,
                GB01.customerId(),
                GB01.instrumentId(),
                GB01.currency(),
                side == DebitCredit.DR ? "200100" : "100000",
                side,
                new BigDecimal(amount),
                dealId == null ? PostingType.MTM : PostingType.PURCHASE);
    }
}
