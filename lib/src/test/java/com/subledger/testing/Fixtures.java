package com.subledger.testing;

import com.subledger.engine.DecimalParser;
import com.subledger.engine.SubledgerInput;
import com.subledger.ledger.PositionKey;
import com.subledger.ledger.PositionSnapshot;
import com.subledger.ledger.Trade;
import com.subledger.ledger.TradeSide;
import com.subledger.ledger.ValuationSnapshot;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds of the sample book under {@code fixtures/} plus small record factories.
 *
 * <p>Book: GB01 buys 100@10 and 100@20 then sells 100@18; US02 buys 50@4 and 30@5 on one day then
 * sells 20@3; GB03 buys 10@100 then sells 15@110, overselling by 5.
 */
public final class Fixtures {
    public static final PositionKey GB01 = new PositionKey("CIF001", "GB0000000001", "GBP");
    public static final PositionKey US02 = new PositionKey("CIF001", "US0000000002", "USD");
    public static final PositionKey GB03 = new PositionKey("CIF002", "GB0000000003", "GBP");
    public static final PositionKey XS04 = new PositionKey("CIF003", "XS0000000004", "EUR");
    public static final LocalDate AS_OF = LocalDate.of(2025, 1, 8);

    private Fixtures() {}

    public static SubledgerInput sampleInput() {
        return SubledgerInput.builder()
                .trades(trades())
                .positions(positions())
                .valuations(valuations())
                .mtmSeries(mtmSeries())
                .build();
    }

    public static List<Trade> trades() {
        List<Trade> trades = new ArrayList<>();
        for (String[] cells : TestResources.readCsv("fixtures/trades.csv")) {
            trades.add(
                    new Trade(
                            cells[0],
                            cells[1],
                            cells[2],
                            cells[3],
                            LocalDate.parse(cells[4]),
                            TradeSide.fromString(cells[5]),
                            DecimalParser.parse(cells[6]),
                            DecimalParser.parse(cells[7])));
        }
        return trades;
    }

    public static List<PositionSnapshot> positions() {
        List<PositionSnapshot> positions = new ArrayList<>();
        for (String[] cells : TestResources.readCsv("fixtures/positions.csv")) {
            positions.add(
                    new PositionSnapshot(
                            cells[0], cells[1], cells[2], date(cells[3]), DecimalParser.parse(cells[4])));
        }
        return positions;
    }

    public static List<ValuationSnapshot> valuations() {
        return valuationFile("fixtures/valuations.csv");
    }

    public static List<ValuationSnapshot> mtmSeries() {
        return valuationFile("fixtures/mtm_series.csv");
    }

    public static Trade buy(String id, PositionKey key, String date, String quantity, String price) {
        return trade(id, key, date, TradeSide.BUY, quantity, price);
    }

    public static Trade sell(String id, PositionKey key, String date, String quantity, String price) {
        return trade(id, key, date, TradeSide.SELL, quantity, price);
    }

    public static ValuationSnapshot mtm(PositionKey key, String date, String amount) {
        return new ValuationSnapshot(
                key.customerId(), key.instrumentId(), key.currency(), date(date), new BigDecimal(amount));
    }

    public static PositionSnapshot position(PositionKey key, String date, String quantity) {
        return new PositionSnapshot(
                key.customerId(), key.instrumentId(), key.currency(), date(date), new BigDecimal(quantity));
    }

    /** Compares by value so that scale differences do not matter. */
    public static boolean sameAmount(String expected, BigDecimal actual) {
        return actual != null && new BigDecimal(expected).compareTo(actual) == 0;
    }

    private static Trade trade(String id, PositionKey key, String date, TradeSide side, String quantity, String price) {
        return new Trade(
                id,
                key.customerId(),
                key.instrumentId(),
                key.currency(),
                LocalDate.parse(date),
                side,
                new BigDecimal(quantity),
                new BigDecimal(price));
    }

    private static List<ValuationSnapshot> valuationFile(String resource) {
        List<ValuationSnapshot> rows = new ArrayList<>();
        for (String[] cells : TestResources.readCsv(resource)) {
            rows.add(new ValuationSnapshot(cells[0], cells[1], cells[2], date(cells[3]), DecimalParser.parse(cells[4])));
        }
        return rows;
    }

    private static LocalDate date(String text) {
        return text == null || text.isBlank() ? null : LocalDate.parse(text.trim());
    }
}
