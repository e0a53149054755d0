package com.subledger.control;

import com.subledger.ledger.DailyMovements;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.LedgerAccountKey;
import com.subledger.ledger.LedgerAggregator;
import com.subledger.ledger.LedgerBalance;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds balances as the cumulative sum of journal movements and compares them with a thin
 * ledger maintained elsewhere, one row per supplied balance.
 */
public final class ThinLedgerControl {

    private static final Comparator<LedgerBalance> LEDGER_ORDER =
            Comparator.comparing(LedgerBalance::getDate)
                    .thenComparing(LedgerBalance::getAccountCode)
                    .thenComparing(LedgerBalance::getCurrency);

    private final LedgerAggregator aggregator;
    private final BigDecimal tolerance;

    public ThinLedgerControl(LedgerAggregator aggregator, BigDecimal tolerance) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<ThinLedgerControlRecord> reconcile(List<LedgerBalance> thinLedger, List<GlPosting> postings) {
        DailyMovements<LedgerAccountKey> movements = aggregator.movements(postings);
        List<LedgerAccountKey> postedKeys = movements.keys();
        List<LedgerBalance> ordered = new ArrayList<>(thinLedger);
        ordered.sort(LEDGER_ORDER);
        List<ThinLedgerControlRecord> records = new ArrayList<>(ordered.size());
        for (LedgerBalance row : ordered) {
            LedgerAccountKey key = new LedgerAccountKey(row.getAccountCode(), row.getCurrency());
            BigDecimal rebuilt = movements.balanceAsOf(key, row.getDate());
            ControlStatus status =
                    ControlStatus.classify(true, postedKeys.contains(key), rebuilt.subtract(row.getBalance()), tolerance);
            records.add(
                    new ThinLedgerControlRecord(
                            row.getDate(), row.getAccountCode(), row.getCurrency(), row.getBalance(), rebuilt, status));
        }
        return records;
    }
}
