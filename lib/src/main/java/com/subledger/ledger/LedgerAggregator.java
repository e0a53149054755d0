package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rolls every posting, trade and MTM alike, into the thin ledger: one signed movement per
 * (account, currency, date) and the cumulative balance per (account, currency).
 */
public final class LedgerAggregator {

    public List<LedgerBalance> aggregate(List<GlPosting> postings) {
        return toBalances(movements(postings));
    }

    public DailyMovements<LedgerAccountKey> movements(List<GlPosting> postings) {
        DailyMovements<LedgerAccountKey> movements = new DailyMovements<>();
        for (GlPosting posting : postings) {
            movements.add(
                    new LedgerAccountKey(posting.getAccountCode(), posting.getCurrency()),
                    posting.getPostingDate(),
                    posting.signedAmount());
        }
        return movements;
    }

    private static List<LedgerBalance> toBalances(DailyMovements<LedgerAccountKey> movements) {
        List<LedgerBalance> rows = new ArrayList<>();
        for (LedgerAccountKey key : movements.keys()) {
            BigDecimal running = BigDecimal.ZERO;
            for (Map.Entry<LocalDate, BigDecimal> day : movements.dayChanges(key).entrySet()) {
                running = running.add(day.getValue());
                rows.add(new LedgerBalance(day.getKey(), key.accountCode(), key.currency(), day.getValue(), running));
            }
        }
        return rows;
    }
}
