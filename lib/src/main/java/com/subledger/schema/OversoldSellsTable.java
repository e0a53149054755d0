package com.subledger.schema;

import com.subledger.lots.OversoldSell;
import java.util.ArrayList;
import java.util.List;

public final class OversoldSellsTable {
    public static final String NAME = "oversold_sells";

    private static final TableDefinition DEFINITION = createDefinition();

    private OversoldSellsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<OversoldSell> sells) {
        List<Object[]> rows = new ArrayList<>(sells.size());
        for (OversoldSell sell : sells) {
            rows.add(
                    Columns.row(
                            sell.getKey(),
                            sell.getTradeId(),
                            Columns.epochDay(sell.getTradeDate()),
                            Columns.amount(sell.getSellQuantity()),
                            Columns.amount(sell.getUnmatchedQuantity())));
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>(Columns.positionKey());
        columns.add(Columns.varchar("trade_id", false));
        columns.add(Columns.date("trade_date", false));
        columns.add(Columns.amount("sell_quantity", false));
        columns.add(Columns.amount("unmatched_quantity", false));
        return new TableDefinition(NAME, "Sells exceeding FIFO inventory", columns);
    }
}
