package io.pricelake.financial.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented table as read from or written to a partition file. Values are typed per {@link ColumnType}
 * when they parsed cleanly, and left as the raw {@code String} otherwise so that validation can report them.
 */
public final class Frame {
    private final LinkedHashMap<String, List<Object>> columns;
    private final int rowCount;

    private Frame(LinkedHashMap<String, List<Object>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static Builder builder(List<String> columnNames) { return new Builder(columnNames); }

    public int rowCount() { return rowCount; }
    public boolean isEmpty() { return rowCount == 0; }
    public Set<String> columnNames() { return Collections.unmodifiableSet(columns.keySet()); }
    public boolean hasColumn(String name) { return columns.containsKey(name); }

    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) throw new IllegalArgumentException("No column '" + name + "'");
        return Collections.unmodifiableList(values);
    }

    public Object get(int row, String name) { return column(name).get(row); }

    public Frame withoutColumn(String name) {
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.remove(name);
        return new Frame(copy, rowCount);
    }

    public Frame withColumn(String name, List<?> values) {
        if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size() + " values, frame has " + rowCount + " rows");
        }
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.put(name, new ArrayList<>(values));
        return new Frame(copy, rowCount);
    }

    @Override
    public String toString() { return "Frame{columns=" + columns.keySet() + ", rows=" + rowCount + '}'; }

    public static final class Builder {
        private final List<String> names;
        private final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
        private int rows;

        private Builder(List<String> names) {
            this.names = List.copyOf(names);
            for (String n : this.names) {
                if (columns.put(n, new ArrayList<>()) != null) throw new IllegalArgumentException("Duplicate column '" + n + "'");
            }
        }

        public Builder addRow(Object... values) {
            if (values.length != names.size()) {
                throw new IllegalArgumentException("Expected " + names.size() + " values, got " + values.length);
            }
            for (int i = 0; i < values.length; i++) columns.get(names.get(i)).add(values[i]);
            rows++;
            return this;
        }

        public Builder addRow(List<?> values) { return addRow(values.toArray()); }

        public Frame build() {
            LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> e : columns.entrySet()) copy.put(e.getKey(), new ArrayList<>(e.getValue()));
            return new Frame(copy, rows);
        }
    }
}
