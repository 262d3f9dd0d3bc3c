package io.pricelake.financial.frame;

import java.util.List;
import java.util.Optional;

/**
 * Ordered column declarations of a partition family plus the columns forming the unique row key.
 */
public record Schema(String name, List<Column> columns, List<String> keyColumns) {
    public Schema {
        columns = List.copyOf(columns);
        keyColumns = List.copyOf(keyColumns);
    }

    public Optional<Column> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }
}
