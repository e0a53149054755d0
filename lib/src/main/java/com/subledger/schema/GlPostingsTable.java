package com.subledger.schema;

import com.subledger.ledger.GlPosting;
import java.util.ArrayList;
import java.util.List;

/** Every journal leg: trade postings first, then MTM postings. */
public final class GlPostingsTable {
    public static final String NAME = "gl_postings";

    private static final TableDefinition DEFINITION = createDefinition();

    private GlPostingsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<GlPosting> postings) {
        List<Object[]> rows = new ArrayList<>(postings.size());
        for (GlPosting posting : postings) {
            rows.add(
                    new Object[] {
                        Columns.epochDay(posting.getPostingDate()),
                        posting.getDealId(),
                        posting.getCustomerId(),
                        posting.getInstrumentId(),
                        posting.getCurrency(),
                        posting.getAccountCode(),
                        posting.getDebitCredit().name(),
                        Columns.amount(posting.getAmount()),
                        posting.getPostingType().name()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.date("posting_date", false));
        columns.add(Columns.varchar("deal_id", true));
        columns.addAll(Columns.positionKey());
        columns.add(Columns.varchar("account_code", false));
        columns.add(Columns.varchar("dr_cr", false));
        columns.add(Columns.amount("amount", false));
        columns.add(Columns.varchar("posting_type", false));
        return new TableDefinition(NAME, "Double-entry journal legs", columns);
    }
}
