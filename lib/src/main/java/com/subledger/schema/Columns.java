package com.subledger.schema;

import com.subledger.ledger.PositionKey;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;

/**
 * Column factories and value conversions shared by the table definitions. Dates are materialized
 * as epoch days and amounts as DECIMAL(19,8), the representations a scannable SQL table expects.
 */
final class Columns {
    static final int AMOUNT_PRECISION = 19;
    static final int AMOUNT_SCALE = 8;

    private Columns() {}

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "VARCHAR", 0, 0, nullable, String.class.getName());
    }

    static ColumnDescriptor date(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.DATE, "DATE", 0, 0, nullable, java.sql.Date.class.getName());
    }

    static ColumnDescriptor amount(String name, boolean nullable) {
        return new ColumnDescriptor(
                name,
                Types.DECIMAL,
                "DECIMAL(" + AMOUNT_PRECISION + "," + AMOUNT_SCALE + ")",
                AMOUNT_PRECISION,
                AMOUNT_SCALE,
                nullable,
                BigDecimal.class.getName());
    }

    static ColumnDescriptor bool(String name) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", 0, 0, false, Boolean.class.getName());
    }

    static List<ColumnDescriptor> positionKey() {
        return List.of(varchar("customer_id", false), varchar("instrument_id", false), varchar("currency", false));
    }

    static Integer epochDay(LocalDate date) {
        return date != null ? Math.toIntExact(date.toEpochDay()) : null;
    }

    static BigDecimal amount(BigDecimal value) {
        return value != null ? value.setScale(AMOUNT_SCALE, RoundingMode.HALF_EVEN) : null;
    }

    static Object[] row(PositionKey key, Object... rest) {
        Object[] row = new Object[3 + rest.length];
        row[0] = key.customerId();
        row[1] = key.instrumentId();
        row[2] = key.currency();
        System.arraycopy(rest, 0, row, 3, rest.length);
        return row;
    }
}
