package com.subledger.schema;

import com.subledger.ledger.LedgerBalance;
import java.util.ArrayList;
import java.util.List;

/** Daily movement and running balance per account and currency. */
public final class ThinLedgerTable {
    public static final String NAME = "thin_ledger";

    private static final TableDefinition DEFINITION = createDefinition();

    private ThinLedgerTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<LedgerBalance> balances) {
        List<Object[]> rows = new ArrayList<>(balances.size());
        for (LedgerBalance balance : balances) {
            rows.add(
                    new Object[] {
                        Columns.epochDay(balance.getDate()),
                        balance.getAccountCode(),
                        balance.getCurrency(),
                        Columns.amount(balance.getDayChange()),
                        Columns.amount(balance.getBalance())
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.date("posting_date", false));
        columns.add(Columns.varchar("account_code", false));
        columns.add(Columns.varchar("currency", false));
        columns.add(Columns.amount("day_change", false));
        columns.add(Columns.amount("balance", false));
        return new TableDefinition(NAME, "Thin ledger", columns);
    }
}
