package com.subledger.posting;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.Partitions;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.PostingType;
import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates purchase and sale journals under the weighted-average cost method.
 *
 * <pre>
 *   BUY   Dr security asset / Cr cash                       (notional)
 *   SELL  Dr cash (proceeds) / Cr security asset (cost of sale) / Cr or Dr realised P&amp;L
 * </pre>
 *
 * Each position is folded independently through a {@link CostBasis} in (trade date, trade id)
 * order; the order matters because the average cost is path dependent.
 */
public final class AverageCostPoster {

    private static final Logger LOGGER = Logger.getLogger(AverageCostPoster.class.getName());

    static final Comparator<Trade> POSTING_ORDER =
            Comparator.comparing(Trade::getCustomerId)
                    .thenComparing(Trade::getInstrumentId)
                    .thenComparing(Trade::getTradeDate)
                    .thenComparing(Trade::getTradeId);

    private final ChartOfAccounts accounts;
    private final CostBasisPolicy costBasisPolicy;
    private final int scale;

    public AverageCostPoster(ChartOfAccounts accounts, CostBasisPolicy costBasisPolicy, int scale) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.costBasisPolicy = Objects.requireNonNull(costBasisPolicy, "costBasisPolicy");
        this.scale = scale;
    }

    public List<GlPosting> post(List<Trade> trades) {
        List<GlPosting> postings = new ArrayList<>();
        for (Map.Entry<PositionKey, List<Trade>> group : Partitions.byPosition(trades, Trade::getKey).entrySet()) {
            postings.addAll(postGroup(group.getKey(), group.getValue()).postings());
        }
        return postings;
    }

    public GroupPostings postGroup(PositionKey key, List<Trade> groupTrades) {
        List<Trade> ordered = new ArrayList<>(groupTrades);
        ordered.sort(POSTING_ORDER);
        List<GlPosting> postings = new ArrayList<>();
        List<String> negativeCostSells = new ArrayList<>();
        CostBasis basis = CostBasis.EMPTY;
        for (Trade trade : ordered) {
            JournalBuilder journal = new JournalBuilder(trade.getTradeDate(), trade.getTradeId(), key, postings);
            if (trade.isBuy()) {
                BigDecimal notional = trade.notional();
                basis = basis.afterBuy(trade.getQuantity(), notional);
                journal.debit(accounts.getSecurityAsset(), notional, PostingType.PURCHASE)
                        .credit(accounts.getCash(), notional, PostingType.PURCHASE);
                continue;
            }
            BigDecimal proceeds = trade.notional();
            BigDecimal costOfSale = basis.costOfSale(trade.getQuantity(), trade.getPrice(), scale);
            BigDecimal pnl = proceeds.subtract(costOfSale);
            basis = basis.afterSale(trade.getQuantity(), costOfSale);
            if (basis.getCost().signum() < 0) {
                basis = applyPolicy(key, trade, basis, negativeCostSells);
            }
            journal.debit(accounts.getCash(), proceeds, PostingType.SALE)
                    .signed(accounts.getSecurityAsset(), costOfSale.negate(), PostingType.SALE);
            if (pnl.signum() != 0) {
                journal.signed(accounts.getRealizedPnl(), pnl.negate(), PostingType.SALE_PNL);
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Posted " + ordered.size() + " trades for " + key + ", closing " + basis);
        }
        return new GroupPostings(key, postings, basis, negativeCostSells);
    }

    private CostBasis applyPolicy(PositionKey key, Trade sell, CostBasis basis, List<String> negativeCostSells) {
        return switch (costBasisPolicy) {
            case CLAMP -> basis.getQuantity().signum() <= 0 ? new CostBasis(basis.getQuantity(), BigDecimal.ZERO) : basis;
            case FLAG -> {
                negativeCostSells.add(sell.getTradeId());
                LOGGER.warning("Sell " + sell.getTradeId() + " left a negative cost basis on " + key + ": " + basis);
                yield basis;
            }
            case PRESERVE -> basis;
        };
    }

    /** Journals of one position plus the state its cost basis closed at. */
    public record GroupPostings(
            PositionKey key, List<GlPosting> postings, CostBasis closingBasis, List<String> negativeCostSells) {}
}
