package com.subledger.schema;

import com.subledger.engine.SubledgerResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Materializes every record set of a run as rows of its table, keyed by table name. */
public final class SubledgerTables {

    private SubledgerTables() {}

    public static Map<String, TableDefinition> definitions() {
        Map<String, TableDefinition> definitions = new LinkedHashMap<>();
        definitions.put(TradesTable.NAME, TradesTable.getDefinition());
        definitions.put(OpenTradesTable.NAME, OpenTradesTable.getDefinition());
        definitions.put(OversoldSellsTable.NAME, OversoldSellsTable.getDefinition());
        definitions.put(AllocatedTradesTable.NAME, AllocatedTradesTable.getDefinition());
        definitions.put(GlPostingsTable.NAME, GlPostingsTable.getDefinition());
        definitions.put(ThinLedgerTable.NAME, ThinLedgerTable.getDefinition());
        for (TableDefinition control : ControlTables.getDefinitions()) {
            definitions.put(control.getName(), control);
        }
        return definitions;
    }

    public static Map<String, List<Object[]>> materialize(SubledgerResult result) {
        Map<String, List<Object[]>> rows = new LinkedHashMap<>();
        rows.put(TradesTable.NAME, TradesTable.materializeRows(result.getTrades()));
        rows.put(OpenTradesTable.NAME, OpenTradesTable.materializeRows(result.getOpenTrades()));
        rows.put(OversoldSellsTable.NAME, OversoldSellsTable.materializeRows(result.getOversoldSells()));
        rows.put(AllocatedTradesTable.NAME, AllocatedTradesTable.materializeRows(result.getAllocatedTrades()));
        rows.put(GlPostingsTable.NAME, GlPostingsTable.materializeRows(result.getGlPostings()));
        rows.put(ThinLedgerTable.NAME, ThinLedgerTable.materializeRows(result.getThinLedger()));
        rows.put(ControlTables.POSITION_CONTROL, ControlTables.positionRows(result.getPositionControl()));
        rows.put(ControlTables.ALLOCATION_CONTROL, ControlTables.allocationRows(result.getAllocationControl()));
        rows.put(ControlTables.BUY_TRADE_CONTROL, ControlTables.buyRows(result.getBuyTradeControl()));
        rows.put(ControlTables.SELL_TRADE_CONTROL, ControlTables.sellRows(result.getSellTradeControl()));
        rows.put(ControlTables.MTM_CONTROL, ControlTables.mtmRows(result.getMtmControl()));
        rows.put(ControlTables.MTM_DELTA_CONTROL, ControlTables.mtmDeltaRows(result.getMtmDeltaControl()));
        rows.put(ControlTables.PORTFOLIO_MTM_CONTROL, ControlTables.portfolioRows(result.getPortfolioMtmControl()));
        rows.put(ControlTables.THIN_LEDGER_CONTROL, ControlTables.thinLedgerRows(result.getThinLedgerControl()));
        rows.put(
                ControlTables.JOURNAL_BALANCE_CONTROL,
                ControlTables.journalBalanceRows(result.getJournalBalanceControl()));
        return rows;
    }
}
