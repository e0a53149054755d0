package com.subledger.jdbc.feed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.engine.SubledgerException;
import com.subledger.engine.SubledgerInput;
import com.subledger.jdbc.testing.TestResources;
import com.subledger.ledger.TradeSide;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

final class FeedLoaderTest {

    @Test
    void loadsEveryFeedOfTheSampleDirectory() throws Exception {
        SubledgerInput input = FeedLoader.load(TestResources.feedDirectory("sample"));

        assertEquals(8, input.getTrades().size());
        assertEquals(TradeSide.SELL, input.getTrades().get(5).getSide());
        assertEquals("GB0000000001", input.getTrades().get(0).getInstrumentId());
        assertEquals(4, input.getPositions().size());
        assertEquals(0, input.getPositions().get(1).getQuantity().compareTo(BigDecimal.valueOf(55)));
        assertEquals(3, input.getValuations().size());
        assertEquals(6, input.getMtmSeries().size());
        assertEquals(LocalDate.of(2025, 1, 6), input.getMtmSeries().get(0).getAsOfDate());
        assertEquals(2, input.getThinLedger().size());
    }

    @Test
    void optionalFeedsMayBeAbsent() throws Exception {
        SubledgerInput input = FeedLoader.load(copyTradesOnly());

        assertEquals(8, input.getTrades().size());
        assertTrue(input.getPositions().isEmpty());
        assertTrue(input.getMtmSeries().isEmpty());
    }

    @Test
    void badNumberReportsFileAndLine() {
        Path broken = TestResources.feedDirectory("broken");

        SubledgerException ex = assertThrows(SubledgerException.class, () -> FeedLoader.load(broken));
        assertTrue(ex.getMessage().contains("sec_trades.csv:3"), ex.getMessage());
    }

    @Test
    void quotedFieldMaySpanLines() throws Exception {
        Path dir = tradesFeed("\"T1\nX\",C1,I1,GBP,2025-01-01,BUY,10,5\n");

        SubledgerInput input = FeedLoader.load(dir);

        assertEquals(1, input.getTrades().size());
        assertEquals("T1\nX", input.getTrades().get(0).getTradeId());
        assertEquals(0, BigDecimal.TEN.compareTo(input.getTrades().get(0).getQuantity()));
    }

    @Test
    void exponentNotationIsRead() throws Exception {
        Path dir = tradesFeed("T1,C1,I1,GBP,2025-01-01,BUY,10,1e-05\n");

        SubledgerInput input = FeedLoader.load(dir);

        assertEquals(0, new BigDecimal("0.00001").compareTo(input.getTrades().get(0).getPrice()));
    }

    @Test
    void groupedNumberIsRejectedRatherThanRescaled() throws Exception {
        Path dir = tradesFeed("T1,C1,I1,GBP,2025-01-01,BUY,\"1,000\",5\n");

        SubledgerException ex = assertThrows(SubledgerException.class, () -> FeedLoader.load(dir));
        assertTrue(ex.getMessage().contains("sec_trades.csv:2"), ex.getMessage());
    }

    @Test
    void missingTradeFeedFails() throws Exception {
        Path empty = Files.createTempDirectory("subledger_empty");
        empty.toFile().deleteOnExit();

        assertThrows(SubledgerException.class, () -> FeedLoader.load(empty));
    }

    private static Path tradesFeed(String rows) throws Exception {
        Path dir = Files.createTempDirectory("subledger_trades");
        dir.toFile().deleteOnExit();
        Path target = dir.resolve(FeedLoader.TRADES);
        Files.writeString(target, "trade_id,customer_id,isin,ccy,trade_date,side,quantity,price\n" + rows);
        target.toFile().deleteOnExit();
        return dir;
    }

    private static Path copyTradesOnly() throws Exception {
        Path dir = Files.createTempDirectory("subledger_trades_only");
        dir.toFile().deleteOnExit();
        Path target = dir.resolve(FeedLoader.TRADES);
        Files.copy(TestResources.feedDirectory("sample").resolve(FeedLoader.TRADES), target);
        target.toFile().deleteOnExit();
        return dir;
    }
}
