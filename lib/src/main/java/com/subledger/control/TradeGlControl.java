package com.subledger.control;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.PostingType;
import com.subledger.ledger.Trade;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ties every trade to the journal posted under its trade id. Buys must show the notional as asset
 * debit and cash credit; sells must show the proceeds as cash debit and balance against asset
 * credit plus realised P&amp;L. A trade with no journal is compared against zeros.
 */
public final class TradeGlControl {

    private final ChartOfAccounts accounts;
    private final BigDecimal tolerance;

    public TradeGlControl(ChartOfAccounts accounts, BigDecimal tolerance) {
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public List<BuyTradeControlRecord> reconcileBuys(List<Trade> trades, List<GlPosting> postings) {
        Map<String, List<GlPosting>> byDeal = postingsByDeal(postings);
        List<BuyTradeControlRecord> records = new ArrayList<>();
        for (Trade trade : trades) {
            if (!trade.isBuy()) {
                continue;
            }
            List<GlPosting> journal = byDeal.getOrDefault(trade.getTradeId(), Collections.emptyList());
            BigDecimal asset = netDebit(journal, accounts.getSecurityAsset(), PostingType.PURCHASE);
            BigDecimal cash = netDebit(journal, accounts.getCash(), PostingType.PURCHASE).negate();
            BigDecimal worst = worst(asset.subtract(trade.notional()), cash.subtract(trade.notional()));
            ControlStatus status = ControlStatus.classify(true, !journal.isEmpty(), worst, tolerance);
            records.add(new BuyTradeControlRecord(trade, asset, cash, status));
        }
        return records;
    }

    public List<SellTradeControlRecord> reconcileSells(List<Trade> trades, List<GlPosting> postings) {
        Map<String, List<GlPosting>> byDeal = postingsByDeal(postings);
        List<SellTradeControlRecord> records = new ArrayList<>();
        for (Trade trade : trades) {
            if (trade.isBuy()) {
                continue;
            }
            List<GlPosting> journal = byDeal.getOrDefault(trade.getTradeId(), Collections.emptyList());
            BigDecimal cash = netDebit(journal, accounts.getCash(), PostingType.SALE);
            BigDecimal asset = netDebit(journal, accounts.getSecurityAsset(), PostingType.SALE).negate();
            BigDecimal pnl = netDebit(journal, accounts.getRealizedPnl(), PostingType.SALE_PNL).negate();
            BigDecimal worst = worst(cash.subtract(trade.notional()), cash.subtract(asset.add(pnl)));
            ControlStatus status = ControlStatus.classify(true, !journal.isEmpty(), worst, tolerance);
            records.add(new SellTradeControlRecord(trade, cash, asset, pnl, status));
        }
        return records;
    }

    private static Map<String, List<GlPosting>> postingsByDeal(List<GlPosting> postings) {
        Map<String, List<GlPosting>> byDeal = new HashMap<>();
        for (GlPosting posting : postings) {
            if (posting.getDealId() != null && posting.getPostingType().isTradePosting()) {
                byDeal.computeIfAbsent(posting.getDealId(), ignored -> new ArrayList<>()).add(posting);
            }
        }
        return byDeal;
    }

    private static BigDecimal netDebit(List<GlPosting> journal, String account, PostingType type) {
        BigDecimal total = BigDecimal.ZERO;
        for (GlPosting posting : journal) {
            if (posting.getPostingType() == type && posting.getAccountCode().equals(account)) {
                total = total.add(posting.signedAmount());
            }
        }
        return total;
    }

    private static BigDecimal worst(BigDecimal first, BigDecimal second) {
        return first.abs().compareTo(second.abs()) >= 0 ? first : second;
    }
}
