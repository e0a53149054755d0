package com.subledger.engine;

import com.subledger.control.AllocationControlRecord;
import com.subledger.control.BuyTradeControlRecord;
import com.subledger.control.ControlRecord;
import com.subledger.control.JournalBalanceRecord;
import com.subledger.control.MtmControlRecord;
import com.subledger.control.MtmDeltaRecord;
import com.subledger.control.PortfolioMtmRecord;
import com.subledger.control.PositionControlRecord;
import com.subledger.control.SellTradeControlRecord;
import com.subledger.control.ThinLedgerControlRecord;
import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.LedgerBalance;
import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.Trade;
import com.subledger.lots.OversoldSell;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Every record set produced by one {@link SubledgerEngine} run. Lists are immutable. */
public final class SubledgerResult {
    private final SubledgerOptions options;
    private final List<Trade> trades;
    private final List<OpenTrade> openTrades;
    private final List<OversoldSell> oversoldSells;
    private final List<PositionControlRecord> positionControl;
    private final List<AllocatedTrade> allocatedTrades;
    private final List<AllocationControlRecord> allocationControl;
    private final List<GlPosting> tradePostings;
    private final List<GlPosting> mtmPostings;
    private final List<BuyTradeControlRecord> buyTradeControl;
    private final List<SellTradeControlRecord> sellTradeControl;
    private final List<MtmControlRecord> mtmControl;
    private final List<MtmDeltaRecord> mtmDeltaControl;
    private final List<PortfolioMtmRecord> portfolioMtmControl;
    private final List<LedgerBalance> thinLedger;
    private final List<ThinLedgerControlRecord> thinLedgerControl;
    private final List<JournalBalanceRecord> journalBalanceControl;
    private final List<SubledgerMessage> messages;

    private SubledgerResult(Builder builder) {
        this.options = Objects.requireNonNull(builder.options, "options");
        this.trades = List.copyOf(builder.trades);
        this.openTrades = List.copyOf(builder.openTrades);
        this.oversoldSells = List.copyOf(builder.oversoldSells);
        this.positionControl = List.copyOf(builder.positionControl);
        this.allocatedTrades = List.copyOf(builder.allocatedTrades);
        this.allocationControl = List.copyOf(builder.allocationControl);
        this.tradePostings = List.copyOf(builder.tradePostings);
        this.mtmPostings = List.copyOf(builder.mtmPostings);
        this.buyTradeControl = List.copyOf(builder.buyTradeControl);
        this.sellTradeControl = List.copyOf(builder.sellTradeControl);
        this.mtmControl = List.copyOf(builder.mtmControl);
        this.mtmDeltaControl = List.copyOf(builder.mtmDeltaControl);
        this.portfolioMtmControl = List.copyOf(builder.portfolioMtmControl);
        this.thinLedger = List.copyOf(builder.thinLedger);
        this.thinLedgerControl = List.copyOf(builder.thinLedgerControl);
        this.journalBalanceControl = List.copyOf(builder.journalBalanceControl);
        this.messages = List.copyOf(builder.messages);
    }

    static Builder builder(SubledgerOptions options) {
        Builder builder = new Builder();
        builder.options = options;
        return builder;
    }

    public SubledgerOptions getOptions() {
        return options;
    }

    /** Trades inside the as-of cut-off, in input order. */
    public List<Trade> getTrades() {
        return trades;
    }

    public List<OpenTrade> getOpenTrades() {
        return openTrades;
    }

    public List<OversoldSell> getOversoldSells() {
        return oversoldSells;
    }

    public List<PositionControlRecord> getPositionControl() {
        return positionControl;
    }

    public List<AllocatedTrade> getAllocatedTrades() {
        return allocatedTrades;
    }

    public List<AllocationControlRecord> getAllocationControl() {
        return allocationControl;
    }

    public List<GlPosting> getTradePostings() {
        return tradePostings;
    }

    public List<GlPosting> getMtmPostings() {
        return mtmPostings;
    }

    public List<BuyTradeControlRecord> getBuyTradeControl() {
        return buyTradeControl;
    }

    public List<SellTradeControlRecord> getSellTradeControl() {
        return sellTradeControl;
    }

    public List<MtmControlRecord> getMtmControl() {
        return mtmControl;
    }

    public List<MtmDeltaRecord> getMtmDeltaControl() {
        return mtmDeltaControl;
    }

    public List<PortfolioMtmRecord> getPortfolioMtmControl() {
        return portfolioMtmControl;
    }

    public List<LedgerBalance> getThinLedger() {
        return thinLedger;
    }

    /** Empty unless a thin ledger was supplied. */
    public List<ThinLedgerControlRecord> getThinLedgerControl() {
        return thinLedgerControl;
    }

    public List<JournalBalanceRecord> getJournalBalanceControl() {
        return journalBalanceControl;
    }

    public List<SubledgerMessage> getMessages() {
        return messages;
    }

    /** Trade postings followed by MTM postings. */
    public List<GlPosting> getGlPostings() {
        List<GlPosting> all = new ArrayList<>(tradePostings.size() + mtmPostings.size());
        all.addAll(tradePostings);
        all.addAll(mtmPostings);
        return all;
    }

    /** Number of control rows, across all controls, whose status is not MATCHED. */
    public int breakCount() {
        return countBreaks(positionControl)
                + countBreaks(allocationControl)
                + countBreaks(buyTradeControl)
                + countBreaks(sellTradeControl)
                + countBreaks(mtmControl)
                + countBreaks(mtmDeltaControl)
                + countBreaks(portfolioMtmControl)
                + countBreaks(thinLedgerControl)
                + countBreaks(journalBalanceControl);
    }

    private static int countBreaks(List<? extends ControlRecord> records) {
        int breaks = 0;
        for (ControlRecord record : records) {
            if (record.isBreak()) {
                breaks++;
            }
        }
        return breaks;
    }

    static final class Builder {
        private SubledgerOptions options;
        List<Trade> trades = List.of();
        List<OpenTrade> openTrades = List.of();
        List<OversoldSell> oversoldSells = List.of();
        List<PositionControlRecord> positionControl = List.of();
        List<AllocatedTrade> allocatedTrades = List.of();
        List<AllocationControlRecord> allocationControl = List.of();
        List<GlPosting> tradePostings = List.of();
        List<GlPosting> mtmPostings = List.of();
        List<BuyTradeControlRecord> buyTradeControl = List.of();
        List<SellTradeControlRecord> sellTradeControl = List.of();
        List<MtmControlRecord> mtmControl = List.of();
        List<MtmDeltaRecord> mtmDeltaControl = List.of();
        List<PortfolioMtmRecord> portfolioMtmControl = List.of();
        List<LedgerBalance> thinLedger = List.of();
        List<ThinLedgerControlRecord> thinLedgerControl = List.of();
        List<JournalBalanceRecord> journalBalanceControl = List.of();
        List<SubledgerMessage> messages = List.of();

        private Builder() {}

        SubledgerResult build() {
            return new SubledgerResult(this);
        }
    }
}
