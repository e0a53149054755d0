package com.subledger.schema;

import static com.subledger.testing.Fixtures.AS_OF;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.engine.SubledgerEngine;
import com.subledger.engine.SubledgerInput;
import com.subledger.engine.SubledgerOptions;
import com.subledger.engine.SubledgerResult;
import com.subledger.ledger.Trade;
import com.subledger.ledger.TradeSide;
import com.subledger.ledger.ValuationSnapshot;
import com.subledger.testing.Fixtures;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class SubledgerTablesTest {

    @Test
    void everyTableIsMaterializedWithMatchingArity() throws Exception {
        SubledgerResult result = new SubledgerEngine(SubledgerOptions.defaults().withAsOfDate(AS_OF)).run(Fixtures.sampleInput());

        Map<String, TableDefinition> definitions = SubledgerTables.definitions();
        Map<String, List<Object[]>> rows = SubledgerTables.materialize(result);

        assertEquals(definitions.keySet(), rows.keySet());
        for (Map.Entry<String, List<Object[]>> table : rows.entrySet()) {
            int arity = definitions.get(table.getKey()).getColumns().size();
            for (Object[] row : table.getValue()) {
                assertEquals(arity, row.length, table.getKey());
            }
        }
    }

    @Test
    void controlTablesEndWithDifferenceAndStatus() {
        for (TableDefinition definition : ControlTables.getDefinitions()) {
            List<ColumnDescriptor> columns = definition.getColumns();
            assertEquals("difference", columns.get(columns.size() - 2).getName(), definition.getName());
            assertEquals("status", columns.get(columns.size() - 1).getName(), definition.getName());
        }
    }

    @Test
    void datesAreEpochDaysAndAmountsHaveFixedScale() throws Exception {
        SubledgerResult result = new SubledgerEngine(SubledgerOptions.defaults().withAsOfDate(AS_OF)).run(Fixtures.sampleInput());
        List<Object[]> positions = SubledgerTables.materialize(result).get(ControlTables.POSITION_CONTROL);
        TableDefinition definition = SubledgerTables.definitions().get(ControlTables.POSITION_CONTROL);

        Object[] first = positions.get(0);
        assertEquals(Math.toIntExact(AS_OF.toEpochDay()), first[definition.indexOf("snapshot_date")]);
        Object quantity = first[definition.indexOf("fifo_quantity")];
        assertInstanceOf(BigDecimal.class, quantity);
        assertEquals(8, ((BigDecimal) quantity).scale());
        assertEquals("MATCHED", first[definition.indexOf("status")]);

        Object[] missing = positions.get(3);
        assertEquals("MISSING_DERIVED", missing[definition.indexOf("status")]);
        assertTrue(definition.indexOf("no_such_column") < 0);
    }

    @Test
    void mtmPostingsHaveNoDealId() throws Exception {
        SubledgerResult result = new SubledgerEngine(SubledgerOptions.defaults()).run(Fixtures.sampleInput());
        List<Object[]> postings = SubledgerTables.materialize(result).get(GlPostingsTable.NAME);
        int dealId = GlPostingsTable.getDefinition().indexOf("deal_id");
        int type = GlPostingsTable.getDefinition().indexOf("posting_type");

        Object[] last = postings.get(postings.size() - 1);
        assertNull(last[dealId]);
        assertTrue(((String) last[type]).startsWith("MTM"));
    }

    @Test
    void defaultScaleKeepsAllocationsExactInTheAllocatedTradesTable() throws Exception {
        LocalDate day = LocalDate.of(2025, 1, 2);
        List<Trade> trades =
                List.of(
                        new Trade("L1", "CIF009", "GB0000000009", "GBP", day, TradeSide.BUY, BigDecimal.TEN, BigDecimal.TEN),
                        new Trade("L2", "CIF009", "GB0000000009", "GBP", day, TradeSide.BUY, BigDecimal.TEN, BigDecimal.TEN),
                        new Trade("L3", "CIF009", "GB0000000009", "GBP", day, TradeSide.BUY, BigDecimal.TEN, BigDecimal.TEN));
        SubledgerInput input =
                SubledgerInput.builder()
                        .trades(trades)
                        .valuations(List.of(new ValuationSnapshot("CIF009", "GB0000000009", "GBP", day, new BigDecimal("100"))))
                        .build();
        SubledgerResult result = new SubledgerEngine(SubledgerOptions.defaults()).run(input);

        List<Object[]> rows = SubledgerTables.materialize(result).get(AllocatedTradesTable.NAME);
        int allocatedColumn = AllocatedTradesTable.getDefinition().indexOf("mtm_allocated");

        assertEquals(3, rows.size());
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < rows.size(); i++) {
            BigDecimal materialized = (BigDecimal) rows.get(i)[allocatedColumn];
            assertEquals(0, result.getAllocatedTrades().get(i).getMtmAllocated().compareTo(materialized));
            total = total.add(materialized);
        }
        assertEquals(0, new BigDecimal("100").compareTo(total));
    }
}
