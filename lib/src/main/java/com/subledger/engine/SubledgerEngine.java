package com.subledger.engine;

import com.subledger.control.AllocationControl;
import com.subledger.control.JournalBalanceControl;
import com.subledger.control.MtmDeltaControl;
import com.subledger.control.MtmGlControl;
import com.subledger.control.PortfolioMtmControl;
import com.subledger.control.PositionControl;
import com.subledger.control.ThinLedgerControl;
import com.subledger.control.TradeGlControl;
import com.subledger.engine.SubledgerMessage.Level;
import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.LedgerAggregator;
import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.Partitions;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.Trade;
import com.subledger.ledger.ValuationSnapshot;
import com.subledger.lots.LotMatchResult;
import com.subledger.lots.LotMatcher;
import com.subledger.lots.OpenTradeBuilder;
import com.subledger.lots.OversoldSell;
import com.subledger.posting.AverageCostPoster;
import com.subledger.posting.MtmRollForwardPoster;
import com.subledger.validation.ValidationContext;
import com.subledger.validation.ValidationRunner;
import com.subledger.valuation.ValuationAllocator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Runs the whole subledger over one set of feeds.
 *
 * <p>Lot matching, allocation and posting are independent per position, so they run per
 * {@link PositionKey} partition, on a thread pool when {@code parallelism > 1}. Partition results
 * are always concatenated in key order, which makes the output the same for any parallelism.
 * Controls, the thin ledger and validation then run once over the concatenated record sets.
 */
public final class SubledgerEngine {

    private static final Logger LOGGER = Logger.getLogger(SubledgerEngine.class.getName());

    private final SubledgerOptions options;
    private final LotMatcher lotMatcher;
    private final ValuationAllocator allocator;
    private final AverageCostPoster tradePoster;
    private final MtmRollForwardPoster mtmPoster;
    private final LedgerAggregator aggregator = new LedgerAggregator();

    public SubledgerEngine(SubledgerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        ChartOfAccounts accounts = options.getAccounts();
        this.lotMatcher = new LotMatcher(options.getOversellPolicy());
        this.allocator = new ValuationAllocator(options.getScale());
        this.tradePoster = new AverageCostPoster(accounts, options.getCostBasisPolicy(), options.getScale());
        this.mtmPoster = new MtmRollForwardPoster(accounts);
    }

    public SubledgerOptions getOptions() {
        return options;
    }

    public SubledgerResult run(SubledgerInput input) throws SubledgerException {
        Objects.requireNonNull(input, "input");
        long started = System.nanoTime();
        List<Trade> trades = OpenTradeBuilder.tradesAsOf(input.getTrades(), options.getAsOfDate());
        List<ValuationSnapshot> valuations =
                ValuationAllocator.valuationsAsOf(input.getValuations(), options.getAsOfDate());

        List<GroupOutput> groups = runGroups(partition(trades, valuations, input.getMtmSeries()));

        SubledgerResult.Builder result = SubledgerResult.builder(options);
        List<LotMatchResult> matches = new ArrayList<>();
        List<OpenTrade> openTrades = new ArrayList<>();
        List<OversoldSell> oversold = new ArrayList<>();
        List<AllocatedTrade> allocated = new ArrayList<>();
        List<GlPosting> tradePostings = new ArrayList<>();
        List<GlPosting> mtmPostings = new ArrayList<>();
        List<SubledgerMessage> messages = new ArrayList<>();
        for (GroupOutput group : groups) {
            if (group.match() != null) {
                matches.add(group.match());
                openTrades.addAll(group.match().openTrades());
                oversold.addAll(group.match().getOversoldSells());
            }
            allocated.addAll(group.allocated());
            if (group.postings() != null) {
                tradePostings.addAll(group.postings().postings());
                for (String tradeId : group.postings().negativeCostSells()) {
                    messages.add(
                            new SubledgerMessage(
                                    Level.WARNING, "Sell left a negative cost basis on " + group.key(), tradeId));
                }
            }
            mtmPostings.addAll(group.mtmPostings());
        }
        for (OversoldSell sell : oversold) {
            LOGGER.warning(
                    "Sell " + sell.getTradeId() + " exceeds open inventory of " + sell.getKey() + " by "
                            + sell.getUnmatchedQuantity().toPlainString());
            messages.add(
                    new SubledgerMessage(
                            Level.WARNING,
                            "Sell exceeds open inventory by " + sell.getUnmatchedQuantity().toPlainString(),
                            sell.getTradeId()));
        }

        ChartOfAccounts accounts = options.getAccounts();
        List<GlPosting> allPostings = new ArrayList<>(tradePostings);
        allPostings.addAll(mtmPostings);
        TradeGlControl tradeControl = new TradeGlControl(accounts, options.getTolerance());

        result.trades = trades;
        result.openTrades = openTrades;
        result.oversoldSells = oversold;
        result.positionControl =
                new PositionControl(options.getTolerance())
                        .reconcile(matches, input.getPositions(), options.getAsOfDate());
        result.allocatedTrades = allocated;
        result.allocationControl = new AllocationControl(options.getTolerance()).reconcile(allocated, valuations);
        result.tradePostings = tradePostings;
        result.mtmPostings = mtmPostings;
        result.buyTradeControl = tradeControl.reconcileBuys(trades, tradePostings);
        result.sellTradeControl = tradeControl.reconcileSells(trades, tradePostings);
        result.mtmControl = new MtmGlControl(accounts, options.getTolerance()).reconcile(input.getMtmSeries(), mtmPostings);
        result.mtmDeltaControl =
                new MtmDeltaControl(accounts, options.getTolerance()).reconcile(input.getMtmSeries(), mtmPostings);
        result.portfolioMtmControl =
                new PortfolioMtmControl(accounts, options.getTolerance()).reconcile(input.getMtmSeries(), mtmPostings);
        result.thinLedger = aggregator.aggregate(allPostings);
        result.thinLedgerControl =
                new ThinLedgerControl(aggregator, options.getTolerance()).reconcile(input.getThinLedger(), allPostings);
        result.journalBalanceControl = new JournalBalanceControl(options.getTolerance()).reconcile(allPostings);

        messages.addAll(
                ValidationRunner.defaultRules(options.getTolerance())
                        .run(new ValidationContext(trades, allPostings)));
        result.messages = messages;

        SubledgerResult completed = result.build();
        if (LOGGER.isLoggable(java.util.logging.Level.INFO)) {
            LOGGER.info(
                    String.format(
                            "Subledger run: %d trades, %d positions, %d open lots, %d postings, %d breaks, %d messages in %d ms",
                            trades.size(),
                            groups.size(),
                            openTrades.size(),
                            allPostings.size(),
                            completed.breakCount(),
                            messages.size(),
                            (System.nanoTime() - started) / 1_000_000));
        }
        return completed;
    }

    private List<GroupInput> partition(
            List<Trade> trades, List<ValuationSnapshot> valuations, List<ValuationSnapshot> mtmSeries) {
        SortedMap<PositionKey, List<Trade>> tradesByKey = Partitions.byPosition(trades, Trade::getKey);
        SortedMap<PositionKey, List<ValuationSnapshot>> valuationsByKey =
                Partitions.byPosition(valuations, ValuationSnapshot::getKey);
        SortedMap<PositionKey, List<ValuationSnapshot>> seriesByKey =
                Partitions.byPosition(mtmSeries, ValuationSnapshot::getKey);
        TreeSet<PositionKey> keys = new TreeSet<>(tradesByKey.keySet());
        keys.addAll(seriesByKey.keySet());
        List<GroupInput> groups = new ArrayList<>(keys.size());
        for (PositionKey key : keys) {
            groups.add(
                    new GroupInput(
                            key,
                            tradesByKey.getOrDefault(key, List.of()),
                            valuationsByKey.getOrDefault(key, List.of()),
                            seriesByKey.getOrDefault(key, List.of())));
        }
        return groups;
    }

    private List<GroupOutput> runGroups(List<GroupInput> groups) throws SubledgerException {
        if (options.getParallelism() <= 1 || groups.size() <= 1) {
            List<GroupOutput> outputs = new ArrayList<>(groups.size());
            for (GroupInput group : groups) {
                try {
                    outputs.add(process(group));
                } catch (RuntimeException ex) {
                    throw failure(group.key(), ex);
                }
            }
            return outputs;
        }
        List<Callable<GroupOutput>> tasks = new ArrayList<>(groups.size());
        for (GroupInput group : groups) {
            tasks.add(() -> process(group));
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.getParallelism(), groups.size()));
        try {
            List<Future<GroupOutput>> futures = executor.invokeAll(tasks);
            List<GroupOutput> outputs = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outputs.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    throw failure(groups.get(i).key(), ex.getCause());
                }
            }
            return outputs;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SubledgerException("Subledger run interrupted", ex);
        } finally {
            executor.shutdownNow();
        }
    }

    private GroupOutput process(GroupInput group) {
        LotMatchResult match = null;
        List<AllocatedTrade> allocated = List.of();
        AverageCostPoster.GroupPostings postings = null;
        if (!group.trades().isEmpty()) {
            match = lotMatcher.match(group.key(), group.trades());
            allocated = allocator.allocateGroup(match.openTrades(), group.valuations());
            postings = tradePoster.postGroup(group.key(), group.trades());
        }
        List<GlPosting> mtmPostings = mtmPoster.postGroup(group.key(), group.mtmSeries());
        if (LOGGER.isLoggable(java.util.logging.Level.FINE)) {
            LOGGER.fine(
                    "Position " + group.key() + ": " + group.trades().size() + " trades, " + allocated.size()
                            + " allocations, " + mtmPostings.size() + " MTM postings");
        }
        return new GroupOutput(group.key(), match, allocated, postings, mtmPostings);
    }

    private static SubledgerException failure(PositionKey key, Throwable cause) {
        return new SubledgerException("Subledger run failed for position " + key + ": " + cause.getMessage(), cause);
    }

    private record GroupInput(
            PositionKey key, List<Trade> trades, List<ValuationSnapshot> valuations, List<ValuationSnapshot> mtmSeries) {}

    private record GroupOutput(
            PositionKey key,
            LotMatchResult match,
            List<AllocatedTrade> allocated,
            AverageCostPoster.GroupPostings postings,
            List<GlPosting> mtmPostings) {}
}
