package com.subledger.control;

import static com.subledger.testing.Fixtures.GB01;
import static com.subledger.testing.Fixtures.buy;
import static com.subledger.testing.Fixtures.sameAmount;
import static com.subledger.testing.Fixtures.sell;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.ledger.ChartOfAccounts;
import com.subledger.ledger.GlPosting;
import com.subledger.ledger.PostingType;
import com.subledger.ledger.Trade;
import com.subledger.posting.AverageCostPoster;
import com.subledger.posting.CostBasisPolicy;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TradeGlControlTest {

    private static final List<Trade> TRADES =
            List.of(
                    buy("B1", GB01, "2025-01-02", "100", "10"),
                    buy("B2", GB01, "2025-01-03", "100", "20"),
                    sell("S1", GB01, "2025-01-06", "100", "18"),
                    sell("S2", GB01, "2025-01-07", "50", "12"));

    private final ChartOfAccounts accounts = ChartOfAccounts.defaults();
    private final TradeGlControl control = new TradeGlControl(accounts, new BigDecimal("0.000001"));
    private final List<GlPosting> postings =
            new AverageCostPoster(accounts, CostBasisPolicy.PRESERVE, 10).post(TRADES);

    @Test
    void buysTieToAssetAndCash() {
        List<BuyTradeControlRecord> buys = control.reconcileBuys(TRADES, postings);

        assertEquals(2, buys.size());
        for (BuyTradeControlRecord record : buys) {
            assertEquals(ControlStatus.MATCHED, record.getStatus());
            assertEquals(0, record.getDiffAsset().signum());
            assertEquals(0, record.getDiffCash().signum());
        }
        assertTrue(sameAmount("2000", buys.get(1).getGlCash()));
    }

    @Test
    void sellsBalanceCashAgainstAssetAndSignedPnl() {
        List<SellTradeControlRecord> sells = control.reconcileSells(TRADES, postings);

        SellTradeControlRecord gain = sells.get(0);
        assertTrue(sameAmount("1800", gain.getGlCash()));
        assertTrue(sameAmount("1500", gain.getGlAsset()));
        assertTrue(sameAmount("300", gain.getGlPnl()));
        assertEquals(0, gain.getBalanceCheck().signum());

        SellTradeControlRecord loss = sells.get(1);
        assertTrue(sameAmount("600", loss.getGlCash()));
        assertTrue(sameAmount("750", loss.getGlAsset()));
        assertTrue(sameAmount("-150", loss.getGlPnl()));
        assertEquals(0, loss.getBalanceCheck().signum());
        assertEquals(ControlStatus.MATCHED, loss.getStatus());
    }

    @Test
    void missingJournalIsReportedAgainstZeros() {
        List<GlPosting> withoutSale = new ArrayList<>();
        for (GlPosting posting : postings) {
            if (!"S1".equals(posting.getDealId())) {
                withoutSale.add(posting);
            }
        }

        SellTradeControlRecord record = control.reconcileSells(TRADES, withoutSale).get(0);

        assertEquals(ControlStatus.MISSING_DERIVED, record.getStatus());
        assertTrue(sameAmount("-1800", record.getDiffCash()));
    }

    @Test
    void droppedPnlLegBreaksTheBalanceCheck() {
        List<GlPosting> withoutPnl = new ArrayList<>();
        for (GlPosting posting : postings) {
            if (posting.getPostingType() != PostingType.SALE_PNL) {
                withoutPnl.add(posting);
            }
        }

        SellTradeControlRecord record = control.reconcileSells(TRADES, withoutPnl).get(0);

        assertEquals(ControlStatus.BREAK, record.getStatus());
        assertTrue(sameAmount("300", record.getBalanceCheck()));
    }
}
