package com.subledger.posting;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.Partitions;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.PostingType;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Books a position's MTM time series into the GL with a full reversal every day: the previous
 * day's level is reversed, then today's level booked. The revaluation account therefore always
 * holds the latest level while unrealised P&amp;L moves by the day-over-day change.
 *
 * <pre>
 *   amount &gt; 0   Dr revaluation / Cr unrealised P&amp;L
 *   amount &lt; 0   Dr unrealised P&amp;L / Cr revaluation
 * </pre>
 */
public final class MtmRollForwardPoster {

    private final ChartOfAccounts accounts;

    public MtmRollForwardPoster(ChartOfAccounts accounts) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
    }

    public List<GlPosting> post(List<ValuationSnapshot> series) {
        List<GlPosting> postings = new ArrayList<>();
        for (Map.Entry<PositionKey, List<ValuationSnapshot>> group :
                Partitions.byPosition(series, ValuationSnapshot::getKey).entrySet()) {
            postings.addAll(postGroup(group.getKey(), group.getValue()));
        }
        return postings;
    }

    public List<GlPosting> postGroup(PositionKey key, List<ValuationSnapshot> groupSeries) {
        List<ValuationSnapshot> ordered = new ArrayList<>(groupSeries);
        for (ValuationSnapshot row : ordered) {
            Objects.requireNonNull(row.getAsOfDate(), "MTM time series row without as-of date for " + key);
        }
        ordered.sort(Comparator.comparing(ValuationSnapshot::getAsOfDate));
        List<GlPosting> postings = new ArrayList<>();
        BigDecimal previous = BigDecimal.ZERO;
        for (ValuationSnapshot row : ordered) {
            LocalDate date = row.getAsOfDate();
            BigDecimal today = row.getMtmAmount();
            if (previous.signum() != 0) {
                book(key, date, previous.negate(), PostingType.MTM_REVERSAL, postings);
            }
            if (today.signum() != 0) {
                book(key, date, today, PostingType.MTM, postings);
            }
            previous = today;
        }
        return postings;
    }

    private void book(PositionKey key, LocalDate date, BigDecimal amount, PostingType type, List<GlPosting> out) {
        JournalBuilder journal = new JournalBuilder(date, null, key, out);
        BigDecimal absolute = amount.abs();
        if (amount.signum() > 0) {
            journal.debit(accounts.getRevaluation(), absolute, type)
                    .credit(accounts.getUnrealizedPnl(), absolute, type);
        } else if (amount.signum() < 0) {
            journal.debit(accounts.getUnrealizedPnl(), absolute, type)
                    .credit(accounts.getRevaluation(), absolute, type);
        }
    }
}
