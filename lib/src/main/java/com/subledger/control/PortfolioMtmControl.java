package com.subledger.control;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.DailyMovements;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Portfolio-level MTM check: per date and currency, summed over every position. */
public final class PortfolioMtmControl {

    private final ChartOfAccounts accounts;
    private final BigDecimal tolerance;

    public PortfolioMtmControl(ChartOfAccounts accounts, BigDecimal tolerance) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<PortfolioMtmRecord> reconcile(List<ValuationSnapshot> series, List<GlPosting> postings) {
        Map<LocalDate, Map<String, BigDecimal>> foTotals = new TreeMap<>();
        for (ValuationSnapshot row : series) {
            foTotals.computeIfAbsent(row.getAsOfDate(), ignored -> new TreeMap<>())
                    .merge(row.getCurrency(), row.getMtmAmount(), BigDecimal::add);
        }
        DailyMovements<PositionKey> revaluation = MtmGlControl.revaluationMovements(accounts, postings);
        List<PortfolioMtmRecord> records = new ArrayList<>();
        for (Map.Entry<LocalDate, Map<String, BigDecimal>> day : foTotals.entrySet()) {
            for (Map.Entry<String, BigDecimal> currency : day.getValue().entrySet()) {
                boolean posted = false;
                BigDecimal glTotal = BigDecimal.ZERO;
                for (PositionKey key : revaluation.keys()) {
                    if (key.currency().equals(currency.getKey())) {
                        posted = true;
                        glTotal = glTotal.add(revaluation.balanceAsOf(key, day.getKey()));
                    }
                }
                ControlStatus status =
                        ControlStatus.classify(true, posted, glTotal.subtract(currency.getValue()), tolerance);
                records.add(new PortfolioMtmRecord(day.getKey(), currency.getKey(), currency.getValue(), glTotal, status));
            }
        }
        return records;
    }
}
