package com.subledger.control;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.DailyMovements;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.Partitions;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explains MTM movements day by day: for each position and each valuation date after its first,
 * the change in front-office MTM since the previous date must equal the net revaluation posted on
 * the day. Pinpoints which slice a level break in {@link MtmGlControl} comes from.
 */
public final class MtmDeltaControl {

    private final ChartOfAccounts accounts;
    private final BigDecimal tolerance;

    public MtmDeltaControl(ChartOfAccounts accounts, BigDecimal tolerance) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<MtmDeltaRecord> reconcile(List<ValuationSnapshot> series, List<GlPosting> postings) {
        DailyMovements<PositionKey> revaluation = MtmGlControl.revaluationMovements(accounts, postings);
        List<MtmDeltaRecord> records = new ArrayList<>();
        for (Map.Entry<PositionKey, List<ValuationSnapshot>> group :
                Partitions.byPosition(series, ValuationSnapshot::getKey).entrySet()) {
            List<ValuationSnapshot> ordered = new ArrayList<>(group.getValue());
            ordered.sort(MtmGlControl.SERIES_ORDER);
            for (int i = 1; i < ordered.size(); i++) {
                ValuationSnapshot today = ordered.get(i);
                BigDecimal foChange = today.getMtmAmount().subtract(ordered.get(i - 1).getMtmAmount());
                BigDecimal journalChange = revaluation.dayChange(group.getKey(), today.getAsOfDate());
                boolean posted = revaluation.dayChanges(group.getKey()).containsKey(today.getAsOfDate());
                ControlStatus status =
                        ControlStatus.classify(true, posted, journalChange.subtract(foChange), tolerance);
                records.add(new MtmDeltaRecord(group.getKey(), today.getAsOfDate(), foChange, journalChange, status));
            }
        }
        return records;
    }
}
