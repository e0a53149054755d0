package com.subledger.control;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.DailyMovements;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Checks that the revaluation account of every position carries the front-office MTM level on each
 * valuation date: the cumulative revaluation balance up to and including that date must equal the
 * day's MTM.
 */
public final class MtmGlControl {

    static final Comparator<ValuationSnapshot> SERIES_ORDER =
            Comparator.comparing(ValuationSnapshot::getKey).thenComparing(ValuationSnapshot::getAsOfDate);

    private final ChartOfAccounts accounts;
    private final BigDecimal tolerance;

    public MtmGlControl(ChartOfAccounts accounts, BigDecimal tolerance) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<MtmControlRecord> reconcile(List<ValuationSnapshot> series, List<GlPosting> postings) {
        DailyMovements<PositionKey> revaluation = revaluationMovements(accounts, postings);
        List<PositionKey> postedKeys = revaluation.keys();
        List<ValuationSnapshot> ordered = new ArrayList<>(series);
        ordered.sort(SERIES_ORDER);
        List<MtmControlRecord> records = new ArrayList<>(ordered.size());
        for (ValuationSnapshot row : ordered) {
            PositionKey key = row.getKey();
            BigDecimal glBalance = revaluation.balanceAsOf(key, row.getAsOfDate());
            ControlStatus status =
                    ControlStatus.classify(
                            true, postedKeys.contains(key), glBalance.subtract(row.getMtmAmount()), tolerance);
            records.add(new MtmControlRecord(key, row.getAsOfDate(), row.getMtmAmount(), glBalance, status));
        }
        return records;
    }

    /** Signed revaluation-account movements per position and posting date. */
    public static DailyMovements<PositionKey> revaluationMovements(ChartOfAccounts accounts, List<GlPosting> postings) {
        DailyMovements<PositionKey> movements = new DailyMovements<>();
        for (GlPosting posting : postings) {
            if (posting.getAccountCode().equals(accounts.getRevaluation())) {
                movements.add(posting.getKey(), posting.getPostingDate(), posting.signedAmount());
            }
        }
        return movements;
    }
}
