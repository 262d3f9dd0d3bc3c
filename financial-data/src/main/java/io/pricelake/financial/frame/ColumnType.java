package io.pricelake.financial.frame;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Logical column types of a partition file and their in-memory value classes.
 */
public enum ColumnType {
    STRING(String.class),
    DATE(LocalDate.class),
    FLOAT64(Double.class),
    INT64(Long.class),
    TIMESTAMP(Instant.class);

    private final Class<?> valueClass;

    ColumnType(Class<?> valueClass) { this.valueClass = valueClass; }

    public Class<?> valueClass() { return valueClass; }

    /** Nulls are accepted by every type; nullability is a separate constraint. */
    public boolean accepts(Object value) {
        return value == null || valueClass.isInstance(value);
    }

    /**
     * Parses a non-empty cell.
     *
     * @throws IllegalArgumentException  for malformed numbers
     * @throws java.time.format.DateTimeParseException for malformed dates and timestamps
     */
    public Object parse(String text) {
        return switch (this) {
            case STRING -> text;
            case DATE -> LocalDate.parse(text);
            case FLOAT64 -> Double.parseDouble(text);
            case INT64 -> Long.parseLong(text);
            case TIMESTAMP -> Instant.parse(text);
        };
    }

    public static String format(Object value) {
        return value == null ? "" : value.toString();
    }
}
