package com.subledger.jdbc.calcite;

import com.subledger.schema.ColumnDescriptor;
import java.sql.Types;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

/**
 * Maps the column types of the subledger record sets to Calcite. Only the four types the tables
 * use are accepted: codes and ids as VARCHAR, business dates as DATE, amounts and quantities as
 * DECIMAL with the column's fixed precision and scale, and flags as BOOLEAN.
 */
final class CalciteTypeMapper {

    private CalciteTypeMapper() {}

    static RelDataType toRelDataType(RelDataTypeFactory factory, ColumnDescriptor column) {
        RelDataType baseType =
                switch (column.getJdbcType()) {
                    case Types.VARCHAR -> factory.createSqlType(SqlTypeName.VARCHAR);
                    case Types.DATE -> factory.createSqlType(SqlTypeName.DATE);
                    case Types.BOOLEAN -> factory.createSqlType(SqlTypeName.BOOLEAN);
                    case Types.DECIMAL -> {
                        if (column.getSize() <= 0 || column.getScale() < 0) {
                            throw new IllegalArgumentException(
                                    "Amount column " + column.getName() + " needs a precision and scale");
                        }
                        yield factory.createSqlType(SqlTypeName.DECIMAL, column.getSize(), column.getScale());
                    }
                    default -> throw new IllegalArgumentException(
                            "Unsupported type " + column.getTypeName() + " for column " + column.getName());
                };
        return factory.createTypeWithNullability(baseType, column.isNullable());
    }
}
