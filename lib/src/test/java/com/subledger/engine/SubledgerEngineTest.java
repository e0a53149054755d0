package com.subledger.engine;

import static com.subledger.testing.Fixtures.AS_OF;
import static com.subledger.testing.Fixtures.GB01;
import static com.subledger.testing.Fixtures.GB03;
import static com.subledger.testing.Fixtures.US02;
import static com.subledger.testing.Fixtures.XS04;
import static com.subledger.testing.Fixtures.sameAmount;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.control.AllocationControlRecord;
import com.subledger.control.ControlRecord;
import com.subledger.control.ControlStatus;
import com.subledger.control.PositionControlRecord;
import com.subledger.ledger.AllocatedTrade;
import com.subledger.ledger.OpenTrade;
import com.subledger.lots.OversellException;
import com.subledger.schema.SubledgerTables;
import com.subledger.testing.Fixtures;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

final class SubledgerEngineTest {

    @Test
    void sampleBookProducesExpectedBreaks() throws Exception {
        SubledgerResult result = run(SubledgerOptions.defaults().withAsOfDate(AS_OF));

        List<PositionControlRecord> positions = result.getPositionControl();
        assertEquals(4, positions.size());
        assertEquals(GB01, positions.get(0).getKey());
        assertEquals(ControlStatus.MATCHED, positions.get(0).getStatus());
        assertEquals(US02, positions.get(1).getKey());
        assertEquals(ControlStatus.BREAK, positions.get(1).getStatus());
        assertTrue(sameAmount("60", positions.get(1).getFifoQuantity()));
        assertTrue(sameAmount("5", positions.get(1).getDifference()));
        assertEquals(GB03, positions.get(2).getKey());
        assertEquals(ControlStatus.MATCHED, positions.get(2).getStatus());
        assertEquals(XS04, positions.get(3).getKey());
        assertEquals(ControlStatus.MISSING_DERIVED, positions.get(3).getStatus());

        AllocationControlRecord gb03 = result.getAllocationControl().get(2);
        assertEquals(GB03, gb03.getKey());
        assertEquals(ControlStatus.MISSING_DERIVED, gb03.getStatus());
        assertTrue(sameAmount("40", gb03.getValuationAmount()));

        assertEquals(3, result.breakCount());
        assertAllMatched(result.getBuyTradeControl());
        assertAllMatched(result.getSellTradeControl());
        assertAllMatched(result.getMtmControl());
        assertAllMatched(result.getMtmDeltaControl());
        assertAllMatched(result.getPortfolioMtmControl());
        assertAllMatched(result.getJournalBalanceControl());
        assertTrue(result.getThinLedgerControl().isEmpty());
    }

    @Test
    void openLotsAndAllocationsFollowFifo() throws Exception {
        SubledgerResult result = run(SubledgerOptions.defaults().withAsOfDate(AS_OF));

        List<OpenTrade> open = result.getOpenTrades();
        assertEquals(List.of("T002", "T004", "T005"), open.stream().map(OpenTrade::getTradeId).toList());
        assertTrue(sameAmount("30", open.get(1).getRemainingQuantity()));

        List<AllocatedTrade> allocated = result.getAllocatedTrades();
        assertEquals(3, allocated.size());
        assertTrue(sameAmount("150", allocated.get(0).getMtmAllocated()));
        assertTrue(sameAmount("12", allocated.get(1).getMtmAllocated()));
        assertTrue(sameAmount("15", allocated.get(2).getMtmAllocated()));
    }

    @Test
    void oversoldSellIsReportedAsWarning() throws Exception {
        SubledgerResult result = run(SubledgerOptions.defaults());

        assertEquals(1, result.getOversoldSells().size());
        assertEquals("T008", result.getOversoldSells().get(0).getTradeId());
        assertTrue(
                result.getMessages().stream()
                        .anyMatch(m -> m.getLevel() == SubledgerMessage.Level.WARNING && "T008".equals(m.getSubject())));
        assertFalse(result.getMessages().stream().anyMatch(m -> m.getLevel() == SubledgerMessage.Level.ERROR));
    }

    @Test
    void asOfDateDropsLaterTrades() throws Exception {
        SubledgerResult result = run(SubledgerOptions.defaults().withAsOfDate(AS_OF.minusDays(1)));

        assertEquals(7, result.getTrades().size());
        assertTrue(result.getOversoldSells().isEmpty());
        assertTrue(result.getTrades().stream().noneMatch(t -> t.getTradeId().equals("T008")));
    }

    @Test
    void rejectPolicyFailsTheRun() {
        Properties properties = new Properties();
        properties.setProperty(SubledgerOptions.OVERSELL_POLICY, "reject");
        SubledgerEngine engine = new SubledgerEngine(SubledgerOptions.fromProperties(properties));

        SubledgerException ex = assertThrows(SubledgerException.class, () -> engine.run(Fixtures.sampleInput()));
        assertInstanceOf(OversellException.class, ex.getCause());
        assertTrue(ex.getMessage().contains(GB03.toString()));
    }

    @Test
    void parallelRunMatchesSequentialRun() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(SubledgerOptions.PARALLELISM, "4");
        Map<String, List<Object[]>> parallel =
                SubledgerTables.materialize(run(SubledgerOptions.fromProperties(properties)));
        Map<String, List<Object[]>> sequential = SubledgerTables.materialize(run(SubledgerOptions.defaults()));

        assertEquals(sequential.keySet(), parallel.keySet());
        for (String table : sequential.keySet()) {
            List<Object[]> expected = sequential.get(table);
            List<Object[]> actual = parallel.get(table);
            assertEquals(expected.size(), actual.size(), table);
            for (int i = 0; i < expected.size(); i++) {
                assertArrayEquals(expected.get(i), actual.get(i), table + " row " + i);
            }
        }
    }

    @Test
    void emptyInputRunsToEmptyResult() throws Exception {
        SubledgerResult result =
                new SubledgerEngine(SubledgerOptions.defaults()).run(SubledgerInput.builder().build());

        assertNotNull(result.getGlPostings());
        assertTrue(result.getGlPostings().isEmpty());
        assertEquals(0, result.breakCount());
    }

    private static SubledgerResult run(SubledgerOptions options) throws SubledgerException {
        return new SubledgerEngine(options).run(Fixtures.sampleInput());
    }

    private static void assertAllMatched(List<? extends ControlRecord> records) {
        assertFalse(records.isEmpty());
        for (ControlRecord record : records) {
            assertEquals(ControlStatus.MATCHED, record.getStatus(), record.toString());
        }
    }
}
