package com.subledger.jdbc.feed;

import com.subledger.engine.DecimalParser;
import com.subledger.engine.SubledgerException;
import com.subledger.engine.SubledgerInput;
import com.subledger.ledger.LedgerBalance;
import com.subledger.ledger.PositionSnapshot;
import com.subledger.ledger.Trade;
import com.subledger.ledger.TradeSide;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the staging feeds of one run from a directory:
 *
 * <pre>
 *   sec_trades.csv          trade blotter                         (required)
 *   sec_positions.csv       position feed                         (optional)
 *   fo_sec_positions.csv    front-office valuation per position   (optional)
 *   fo_mtm_timeseries.csv   daily front-office valuation series   (optional)
 *   thin_ledger.csv         externally kept thin ledger           (optional)
 * </pre>
 *
 * Instruments may be named {@code isin} or {@code instrument_id}, currencies {@code ccy} or
 * {@code currency}.
 */
public final class FeedLoader {

    public static final String TRADES = "sec_trades.csv";
    public static final String POSITIONS = "sec_positions.csv";
    public static final String VALUATIONS = "fo_sec_positions.csv";
    public static final String MTM_SERIES = "fo_mtm_timeseries.csv";
    public static final String THIN_LEDGER = "thin_ledger.csv";

    private static final Logger LOGGER = Logger.getLogger(FeedLoader.class.getName());

    private FeedLoader() {}

    public static SubledgerInput load(Path directory) throws SubledgerException {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new SubledgerException("Feed directory not found: " + directory);
        }
        Path tradesFile = directory.resolve(TRADES);
        if (!Files.isReadable(tradesFile)) {
            throw new SubledgerException("Trade feed not found: " + tradesFile);
        }
        SubledgerInput input =
                SubledgerInput.builder()
                        .trades(readTrades(CsvTable.read(tradesFile)))
                        .positions(readPositions(optional(directory.resolve(POSITIONS))))
                        .valuations(readValuations(optional(directory.resolve(VALUATIONS))))
                        .mtmSeries(readValuations(optional(directory.resolve(MTM_SERIES))))
                        .thinLedger(readThinLedger(optional(directory.resolve(THIN_LEDGER))))
                        .build();
        LOGGER.info(
                "Loaded feeds from " + directory + ": " + input.getTrades().size() + " trades, "
                        + input.getPositions().size() + " positions, " + input.getValuations().size()
                        + " valuations, " + input.getMtmSeries().size() + " MTM rows");
        return input;
    }

    private static CsvTable optional(Path file) throws SubledgerException {
        if (!Files.exists(file)) {
            LOGGER.fine("Optional feed absent: " + file);
            return null;
        }
        return CsvTable.read(file);
    }

    private static List<Trade> readTrades(CsvTable table) throws SubledgerException {
        String tradeId = table.column("trade_id", "deal_id");
        String customer = table.column("customer_id");
        String instrument = table.column("isin", "instrument_id");
        String currency = table.column("ccy", "currency");
        String tradeDate = table.column("trade_date");
        String side = table.column("side");
        String quantity = table.column("quantity");
        String price = table.column("price");
        List<Trade> trades = new ArrayList<>(table.getRecords().size());
        for (CsvTable.Record record : table.getRecords()) {
            TradeSide parsedSide = TradeSide.fromString(record.get(side));
            if (parsedSide == null) {
                throw error(table, record, "Unknown trade side '" + record.get(side) + "'", null);
            }
            trades.add(
                    new Trade(
                            required(table, record, tradeId, "trade_id"),
                            required(table, record, customer, "customer_id"),
                            required(table, record, instrument, "isin"),
                            required(table, record, currency, "ccy"),
                            requiredDate(table, record, tradeDate),
                            parsedSide,
                            requiredDecimal(table, record, quantity),
                            requiredDecimal(table, record, price)));
        }
        return trades;
    }

    private static List<PositionSnapshot> readPositions(CsvTable table) throws SubledgerException {
        if (table == null) {
            return List.of();
        }
        String customer = table.column("customer_id");
        String instrument = table.column("isin", "instrument_id");
        String currency = table.column("ccy", "currency");
        String asOf = table.optionalColumn("as_of_date");
        String quantity = table.column("position_quantity", "quantity");
        List<PositionSnapshot> positions = new ArrayList<>(table.getRecords().size());
        for (CsvTable.Record record : table.getRecords()) {
            positions.add(
                    new PositionSnapshot(
                            required(table, record, customer, "customer_id"),
                            required(table, record, instrument, "isin"),
                            required(table, record, currency, "ccy"),
                            optionalDate(table, record, asOf),
                            requiredDecimal(table, record, quantity)));
        }
        return positions;
    }

    private static List<ValuationSnapshot> readValuations(CsvTable table) throws SubledgerException {
        if (table == null) {
            return List.of();
        }
        String customer = table.column("customer_id");
        String instrument = table.column("isin", "instrument_id");
        String currency = table.column("ccy", "currency");
        String asOf = table.optionalColumn("as_of_date");
        String amount = table.column("fo_mtm", "mtm_amount");
        List<ValuationSnapshot> valuations = new ArrayList<>(table.getRecords().size());
        for (CsvTable.Record record : table.getRecords()) {
            valuations.add(
                    new ValuationSnapshot(
                            required(table, record, customer, "customer_id"),
                            required(table, record, instrument, "isin"),
                            required(table, record, currency, "ccy"),
                            optionalDate(table, record, asOf),
                            requiredDecimal(table, record, amount)));
        }
        return valuations;
    }

    private static List<LedgerBalance> readThinLedger(CsvTable table) throws SubledgerException {
        if (table == null) {
            return List.of();
        }
        String date = table.column("posting_date");
        String account = table.column("account_code");
        String currency = table.column("ccy", "currency");
        String dayChange = table.optionalColumn("day_change");
        String balance = table.column("balance");
        List<LedgerBalance> rows = new ArrayList<>(table.getRecords().size());
        for (CsvTable.Record record : table.getRecords()) {
            BigDecimal change = decimal(table, record, dayChange);
            rows.add(
                    new LedgerBalance(
                            requiredDate(table, record, date),
                            required(table, record, account, "account_code"),
                            required(table, record, currency, "ccy"),
                            change != null ? change : BigDecimal.ZERO,
                            requiredDecimal(table, record, balance)));
        }
        return rows;
    }

    private static String required(CsvTable table, CsvTable.Record record, String column, String name)
            throws SubledgerException {
        String value = record.get(column);
        if (value == null) {
            throw error(table, record, "Missing " + name, null);
        }
        return value;
    }

    private static LocalDate requiredDate(CsvTable table, CsvTable.Record record, String column)
            throws SubledgerException {
        LocalDate date = optionalDate(table, record, column);
        if (date == null) {
            throw error(table, record, "Missing date", null);
        }
        return date;
    }

    private static LocalDate optionalDate(CsvTable table, CsvTable.Record record, String column)
            throws SubledgerException {
        String value = record.get(column);
        if (value == null) {
            return null;
        }
        try {
            // Timestamps such as '2025-01-08 00:00:00' keep only their date.
            int space = value.indexOf(' ');
            return LocalDate.parse(space > 0 ? value.substring(0, space) : value);
        } catch (DateTimeParseException ex) {
            throw error(table, record, "Invalid date '" + value + "'", ex);
        }
    }

    private static BigDecimal requiredDecimal(CsvTable table, CsvTable.Record record, String column)
            throws SubledgerException {
        BigDecimal value = decimal(table, record, column);
        if (value == null) {
            throw error(table, record, "Missing number", null);
        }
        return value;
    }

    private static BigDecimal decimal(CsvTable table, CsvTable.Record record, String column) throws SubledgerException {
        try {
            return DecimalParser.parse(record.get(column));
        } catch (NumberFormatException ex) {
            throw error(table, record, ex.getMessage(), ex);
        }
    }

    private static SubledgerException error(CsvTable table, CsvTable.Record record, String message, Throwable cause) {
        String location = table.getFile().getFileName() + ":" + record.lineNumber();
        return cause == null
                ? new SubledgerException(message + " at " + location)
                : new SubledgerException(message + " at " + location, cause);
    }
}
