package com.subledger.schema;

import com.subledger.ledger.AllocatedTrade;
import java.util.ArrayList;
import java.util.List;

/** Open lots with their share of the position valuation, one row per lot and snapshot date. */
public final class AllocatedTradesTable {
    public static final String NAME = "allocated_trades";

    private static final TableDefinition DEFINITION = createDefinition();

    private AllocatedTradesTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<AllocatedTrade> allocated) {
        List<Object[]> rows = new ArrayList<>(allocated.size());
        for (AllocatedTrade trade : allocated) {
            rows.add(
                    Columns.row(
                            trade.getKey(),
                            trade.getTradeId(),
                            Columns.epochDay(trade.getOpenTrade().getTrade().getTradeDate()),
                            Columns.amount(trade.getOpenTrade().getRemainingQuantity()),
                            Columns.amount(trade.getOpenTrade().getTrade().getPrice()),
                            Columns.amount(trade.getOpenNotional()),
                            Columns.epochDay(trade.getSnapshotDate()),
                            Columns.amount(trade.getValuationAmount()),
                            Columns.amount(trade.getMtmAllocated())));
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>(Columns.positionKey());
        columns.add(Columns.varchar("trade_id", false));
        columns.add(Columns.date("trade_date", false));
        columns.add(Columns.amount("remaining_quantity", false));
        columns.add(Columns.amount("price", false));
        columns.add(Columns.amount("open_notional", false));
        columns.add(Columns.date("snapshot_date", true));
        columns.add(Columns.amount("valuation_amount", true));
        columns.add(Columns.amount("mtm_allocated", false));
        return new TableDefinition(NAME, "Pro-rata MTM per open lot", columns);
    }
}
