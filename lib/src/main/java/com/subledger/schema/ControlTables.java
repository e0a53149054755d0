package com.subledger.schema;

import com.subledger.control.AllocationControlRecord;
import com.subledger.control.BuyTradeControlRecord;
import com.subledger.control.JournalBalanceRecord;
import com.subledger.control.MtmControlRecord;
import com.subledger.control.MtmDeltaRecord;
import com.subledger.control.PortfolioMtmRecord;
import com.subledger.control.PositionControlRecord;
import com.subledger.control.SellTradeControlRecord;
import com.subledger.control.ThinLedgerControlRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Tables of the reconciliation controls. Every control table ends with {@code difference} and
 * {@code status}; the columns before them name the compared figures.
 */
public final class ControlTables {
    public static final String POSITION_CONTROL = "position_control";
    public static final String ALLOCATION_CONTROL = "allocation_control";
    public static final String BUY_TRADE_CONTROL = "buy_trade_control";
    public static final String SELL_TRADE_CONTROL = "sell_trade_control";
    public static final String MTM_CONTROL = "mtm_control";
    public static final String MTM_DELTA_CONTROL = "mtm_delta_control";
    public static final String PORTFOLIO_MTM_CONTROL = "portfolio_mtm_control";
    public static final String THIN_LEDGER_CONTROL = "thin_ledger_control";
    public static final String JOURNAL_BALANCE_CONTROL = "journal_balance_control";

    private static final TableDefinition POSITION =
            keyed(POSITION_CONTROL, "FIFO position vs position feed",
                    Columns.date("snapshot_date", true),
                    Columns.amount("fifo_quantity", false),
                    Columns.amount("snapshot_quantity", false));
    private static final TableDefinition ALLOCATION =
            keyed(ALLOCATION_CONTROL, "Sum of lot allocations vs position valuation",
                    Columns.date("snapshot_date", true),
                    Columns.amount("allocated_sum", false),
                    Columns.amount("valuation_amount", false));
    private static final TableDefinition BUY =
            keyed(BUY_TRADE_CONTROL, "Buy notional vs asset debit and cash credit",
                    Columns.varchar("trade_id", false),
                    Columns.date("trade_date", false),
                    Columns.amount("notional", false),
                    Columns.amount("gl_asset", false),
                    Columns.amount("gl_cash", false),
                    Columns.amount("diff_cash", false));
    private static final TableDefinition SELL =
            keyed(SELL_TRADE_CONTROL, "Sell proceeds vs cash debit, asset credit and realised P&L",
                    Columns.varchar("trade_id", false),
                    Columns.date("trade_date", false),
                    Columns.amount("notional", false),
                    Columns.amount("gl_cash", false),
                    Columns.amount("gl_asset", false),
                    Columns.amount("gl_pnl", false),
                    Columns.amount("balance_check", false));
    private static final TableDefinition MTM =
            keyed(MTM_CONTROL, "FO MTM level vs GL revaluation balance",
                    Columns.date("as_of_date", false),
                    Columns.amount("fo_mtm", false),
                    Columns.amount("gl_balance", false));
    private static final TableDefinition MTM_DELTA =
            keyed(MTM_DELTA_CONTROL, "FO MTM day-on-day change vs revaluation journal",
                    Columns.date("as_of_date", false),
                    Columns.amount("fo_change", false),
                    Columns.amount("journal_change", false));
    private static final TableDefinition PORTFOLIO =
            plain(PORTFOLIO_MTM_CONTROL, "Portfolio FO MTM vs GL revaluation per date and currency",
                    Columns.date("as_of_date", false),
                    Columns.varchar("currency", false),
                    Columns.amount("fo_total", false),
                    Columns.amount("gl_total", false));
    private static final TableDefinition THIN_LEDGER =
            plain(THIN_LEDGER_CONTROL, "Supplied thin ledger vs balance rebuilt from journals",
                    Columns.date("posting_date", false),
                    Columns.varchar("account_code", false),
                    Columns.varchar("currency", false),
                    Columns.amount("ledger_balance", false),
                    Columns.amount("rebuilt_balance", false));
    private static final TableDefinition JOURNAL_BALANCE =
            plain(JOURNAL_BALANCE_CONTROL, "Daily debit and credit totals per currency",
                    Columns.date("posting_date", false),
                    Columns.varchar("currency", false),
                    Columns.amount("total_dr", false),
                    Columns.amount("total_cr", false));

    private ControlTables() {}

    public static List<TableDefinition> getDefinitions() {
        return List.of(POSITION, ALLOCATION, BUY, SELL, MTM, MTM_DELTA, PORTFOLIO, THIN_LEDGER, JOURNAL_BALANCE);
    }

    public static List<Object[]> positionRows(List<PositionControlRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (PositionControlRecord record : records) {
            rows.add(
                    Columns.row(
                            record.getKey(),
                            Columns.epochDay(record.getSnapshotDate()),
                            Columns.amount(record.getFifoQuantity()),
                            Columns.amount(record.getSnapshotQuantity()),
                            Columns.amount(record.getDifference()),
                            record.getStatus().name()));
        }
        return rows;
    }

    public static List<Object[]> allocationRows(List<AllocationControlRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (AllocationControlRecord record : records) {
            rows.add(
                    Columns.row(
                            record.getKey(),
                            Columns.epochDay(record.getSnapshotDate()),
                            Columns.amount(record.getAllocatedSum()),
                            Columns.amount(record.getValuationAmount()),
                            Columns.amount(record.getDifference()),
                            record.getStatus().name()));
        }
        return rows;
    }

    /** {@code difference} of a buy row is the asset difference. */
    public static List<Object[]> buyRows(List<BuyTradeControlRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (BuyTradeControlRecord record : records) {
            rows.add(
                    Columns.row(
                            record.getTrade().getKey(),
                            record.getTradeId(),
                            Columns.epochDay(record.getTrade().getTradeDate()),
                            Columns.amount(record.getNotional()),
                            Columns.amount(record.getGlAsset()),
                            Columns.amount(record.getGlCash()),
                            Columns.amount(record.getDiffCash()),
                            Columns.amount(record.getDiffAsset()),
                            record.getStatus().name()));
        }
        return rows;
    }

    /** {@code difference} of a sell row is the cash difference. */
    public static List<Object[]> sellRows(List<SellTradeControlRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (SellTradeControlRecord record : records) {
            rows.add(
                    Columns.row(
                            record.getTrade().getKey(),
                            record.getTradeId(),
                            Columns.epochDay(record.getTrade().getTradeDate()),
                            Columns.amount(record.getNotional()),
                            Columns.amount(record.getGlCash()),
                            Columns.amount(record.getGlAsset()),
                            Columns.amount(record.getGlPnl()),
                            Columns.amount(record.getBalanceCheck()),
                            Columns.amount(record.getDiffCash()),
                            record.getStatus().name()));
        }
        return rows;
    }

    public static List<Object[]> mtmRows(List<MtmControlRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (MtmControlRecord record : records) {
            rows.add(
                    Columns.row(
                            record.getKey(),
                            Columns.epochDay(record.getDate()),
                            Columns.amount(record.getFoMtm()),
                            Columns.amount(record.getGlBalance()),
                            Columns.amount(record.getDifference()),
                            record.getStatus().name()));
        }
        return rows;
    }

    public static List<Object[]> mtmDeltaRows(List<MtmDeltaRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (MtmDeltaRecord record : records) {
            rows.add(
                    Columns.row(
                            record.getKey(),
                            Columns.epochDay(record.getDate()),
                            Columns.amount(record.getFoChange()),
                            Columns.amount(record.getJournalChange()),
                            Columns.amount(record.getDifference()),
                            record.getStatus().name()));
        }
        return rows;
    }

    public static List<Object[]> portfolioRows(List<PortfolioMtmRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (PortfolioMtmRecord record : records) {
            rows.add(
                    new Object[] {
                        Columns.epochDay(record.getDate()),
                        record.getCurrency(),
                        Columns.amount(record.getFoTotal()),
                        Columns.amount(record.getGlTotal()),
                        Columns.amount(record.getDifference()),
                        record.getStatus().name()
                    });
        }
        return rows;
    }

    public static List<Object[]> thinLedgerRows(List<ThinLedgerControlRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (ThinLedgerControlRecord record : records) {
            rows.add(
                    new Object[] {
                        Columns.epochDay(record.getDate()),
                        record.getAccountCode(),
                        record.getCurrency(),
                        Columns.amount(record.getLedgerBalance()),
                        Columns.amount(record.getRebuiltBalance()),
                        Columns.amount(record.getDifference()),
                        record.getStatus().name()
                    });
        }
        return rows;
    }

    /** {@code difference} of a journal balance row is debits minus credits. */
    public static List<Object[]> journalBalanceRows(List<JournalBalanceRecord> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        for (JournalBalanceRecord record : records) {
            rows.add(
                    new Object[] {
                        Columns.epochDay(record.getPostingDate()),
                        record.getCurrency(),
                        Columns.amount(record.getTotalDebit()),
                        Columns.amount(record.getTotalCredit()),
                        Columns.amount(record.getNet()),
                        record.getStatus().name()
                    });
        }
        return rows;
    }

    private static TableDefinition keyed(String name, String remarks, ColumnDescriptor... figures) {
        List<ColumnDescriptor> columns = new ArrayList<>(Columns.positionKey());
        return finish(name, remarks, columns, figures);
    }

    private static TableDefinition plain(String name, String remarks, ColumnDescriptor... figures) {
        return finish(name, remarks, new ArrayList<>(), figures);
    }

    private static TableDefinition finish(
            String name, String remarks, List<ColumnDescriptor> columns, ColumnDescriptor... figures) {
        columns.addAll(List.of(figures));
        columns.add(Columns.amount("difference", false));
        columns.add(Columns.varchar("status", false));
        return new TableDefinition(name, remarks, columns);
    }
}
