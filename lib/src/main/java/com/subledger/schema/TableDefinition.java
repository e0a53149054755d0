package com.subledger.schema;

import java.util.List;
import java.util.Objects;

public final class TableDefinition {
    private final String name;
    private final String remarks;
    private final List<ColumnDescriptor> columns;

    public TableDefinition(String name, String remarks, List<ColumnDescriptor> columns) {
        this.name = Objects.requireNonNull(name, "name");
        this.remarks = remarks;
        this.columns = List.copyOf(columns);
    }

    public String getName() {
        return name;
    }

    public String getRemarks() {
        return remarks;
    }

    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public int indexOf(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equals(column)) {
                return i;
            }
        }
        return -1;
    }
}
