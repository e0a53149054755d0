package com.subledger.schema;

import com.subledger.ledger.Trade;
import java.util.ArrayList;
import java.util.List;

/** The trades of a run, after the as-of cut-off. */
public final class TradesTable {
    public static final String NAME = "trades";

    private static final TableDefinition DEFINITION = createDefinition();

    private TradesTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<Trade> trades) {
        List<Object[]> rows = new ArrayList<>(trades.size());
        for (Trade trade : trades) {
            rows.add(
                    Columns.row(
                            trade.getKey(),
                            trade.getTradeId(),
                            Columns.epochDay(trade.getTradeDate()),
                            trade.getSide().name(),
                            Columns.amount(trade.getQuantity()),
                            Columns.amount(trade.getPrice()),
                            Columns.amount(trade.notional())));
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>(Columns.positionKey());
        columns.add(Columns.varchar("trade_id", false));
        columns.add(Columns.date("trade_date", false));
        columns.add(Columns.varchar("side", false));
        columns.add(Columns.amount("quantity", false));
        columns.add(Columns.amount("price", false));
        columns.add(Columns.amount("notional", false));
        return new TableDefinition(NAME, "Trade blotter", columns);
    }
}
