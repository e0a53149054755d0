package com.subledger.control;

import com.subledger.ledger.DebitCredit;
import com.subledger.ledger.GlPosting;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Daily debit/credit totals per currency; any net other than zero is a break. */
public final class JournalBalanceControl {

    private final BigDecimal tolerance;

    public JournalBalanceControl(BigDecimal tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<JournalBalanceRecord> reconcile(List<GlPosting> postings) {
        Map<LocalDate, Map<String, BigDecimal[]>> totals = new TreeMap<>();
        for (GlPosting posting : postings) {
            BigDecimal[] drCr =
                    totals.computeIfAbsent(posting.getPostingDate(), ignored -> new TreeMap<>())
                            .computeIfAbsent(posting.getCurrency(), ignored -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            int slot = posting.getDebitCredit() == DebitCredit.DR ? 0 : 1;
            drCr[slot] = drCr[slot].add(posting.getAmount());
        }
        List<JournalBalanceRecord> records = new ArrayList<>();
        for (Map.Entry<LocalDate, Map<String, BigDecimal[]>> day : totals.entrySet()) {
            for (Map.Entry<String, BigDecimal[]> currency : day.getValue().entrySet()) {
                BigDecimal debit = currency.getValue()[0];
                BigDecimal credit = currency.getValue()[1];
                ControlStatus status = ControlStatus.classify(true, true, debit.subtract(credit), tolerance);
                records.add(new JournalBalanceRecord(day.getKey(), currency.getKey(), debit, credit, status));
            }
        }
        return records;
    }
}
