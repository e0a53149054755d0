package com.subledger.jdbc.calcite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.schema.ColumnDescriptor;
import com.subledger.schema.SubledgerTables;
import com.subledger.schema.TableDefinition;
import java.sql.Types;
import org.apache.calcite.jdbc.JavaTypeFactoryImpl;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.Test;

final class CalciteTypeMapperTest {

    private final RelDataTypeFactory factory = new JavaTypeFactoryImpl();

    @Test
    void everySubledgerColumnHasAConcreteType() {
        for (TableDefinition table : SubledgerTables.definitions().values()) {
            for (ColumnDescriptor column : table.getColumns()) {
                RelDataType type = CalciteTypeMapper.toRelDataType(factory, column);
                assertEquals(column.isNullable(), type.isNullable(), table.getName() + "." + column.getName());
                if (column.getJdbcType() == Types.DECIMAL) {
                    assertEquals(SqlTypeName.DECIMAL, type.getSqlTypeName());
                    assertEquals(column.getSize(), type.getPrecision());
                    assertEquals(column.getScale(), type.getScale());
                }
            }
        }
    }

    @Test
    void amountKeepsPrecisionAndScale() {
        ColumnDescriptor amount =
                new ColumnDescriptor("amount", Types.DECIMAL, "DECIMAL(19,8)", 19, 8, false, "java.math.BigDecimal");

        RelDataType type = CalciteTypeMapper.toRelDataType(factory, amount);

        assertEquals(SqlTypeName.DECIMAL, type.getSqlTypeName());
        assertEquals(19, type.getPrecision());
        assertEquals(8, type.getScale());
        assertFalse(type.isNullable());
    }

    @Test
    void nullableDateStaysNullable() {
        ColumnDescriptor date = new ColumnDescriptor("snapshot_date", Types.DATE, "DATE", 0, 0, true, "java.sql.Date");

        RelDataType type = CalciteTypeMapper.toRelDataType(factory, date);

        assertEquals(SqlTypeName.DATE, type.getSqlTypeName());
        assertTrue(type.isNullable());
    }

    @Test
    void rejectsTypesNoTableUses() {
        ColumnDescriptor blob = new ColumnDescriptor("raw", Types.BLOB, "BLOB", 0, 0, true, "byte[]");
        ColumnDescriptor unsized =
                new ColumnDescriptor("amount", Types.DECIMAL, "DECIMAL", 0, 0, false, "java.math.BigDecimal");

        assertThrows(IllegalArgumentException.class, () -> CalciteTypeMapper.toRelDataType(factory, blob));
        assertThrows(IllegalArgumentException.class, () -> CalciteTypeMapper.toRelDataType(factory, unsized));
    }
}
