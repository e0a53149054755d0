package com.subledger.schema;

import com.subledger.ledger.OpenTrade;
import com.subledger.ledger.Trade;
import java.util.ArrayList;
import java.util.List;

/** Trades still holding FIFO inventory. */
public final class OpenTradesTable {
    public static final String NAME = "open_trades";

    private static final TableDefinition DEFINITION = createDefinition();

    private OpenTradesTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<OpenTrade> openTrades) {
        List<Object[]> rows = new ArrayList<>(openTrades.size());
        for (OpenTrade open : openTrades) {
            Trade trade = open.getTrade();
            rows.add(
                    Columns.row(
                            open.getKey(),
                            trade.getTradeId(),
                            Columns.epochDay(trade.getTradeDate()),
                            trade.getSide().name(),
                            Columns.amount(trade.getQuantity()),
                            Columns.amount(trade.getPrice()),
                            Columns.amount(open.getRemainingQuantity()),
                            open.isOpen(),
                            Columns.amount(open.openNotional())));
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
        columns.add(Columns.amount("remaining_quantity", false));
        columns.add(Columns.bool("open_flag"));
        columns.add(Columns.amount("open_notional", false));
        return new TableDefinition(NAME, "FIFO open lots", columns);
    }
}
