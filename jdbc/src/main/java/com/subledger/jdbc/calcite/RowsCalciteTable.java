package com.subledger.jdbc.calcite;

import com.subledger.schema.ColumnDescriptor;
import com.subledger.schema.TableDefinition;
import java.util.List;
import java.util.Objects;
import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;

/** Scannable view of one materialized record set; the row layout follows its {@link TableDefinition}. */
final class RowsCalciteTable extends AbstractTable implements ScannableTable {

    private final TableDefinition definition;
    private final List<Object[]> rows;

    RowsCalciteTable(TableDefinition definition, List<Object[]> rows) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.rows = List.copyOf(rows);
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        RelDataTypeFactory.Builder builder = typeFactory.builder();
        for (ColumnDescriptor column : definition.getColumns()) {
            builder.add(column.getName(), CalciteTypeMapper.toRelDataType(typeFactory, column));
        }
        return builder.build();
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        return Linq4j.asEnumerable(rows);
    }
}
