package io.pricelake.financial.model;

import io.pricelake.financial.frame.Column;
import io.pricelake.financial.frame.ColumnType;
import io.pricelake.financial.frame.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Column layouts of raw and enriched partition files.
 */
public final class Schemas {
    public static final String INSTRUMENT = "instrument";
    public static final String DATE = "date";
    public static final String OPEN = "open";
    public static final String HIGH = "high";
    public static final String LOW = "low";
    public static final String CLOSE = "close";
    public static final String VOLUME = "volume";
    public static final String INGEST_TS = "ingest_ts";
    public static final String DAILY_RETURN = "daily_return";
    public static final String ROLLING_VOL = "rolling_vol";

    private static final List<String> KEY = List.of(INSTRUMENT, DATE);

    public static final Schema RAW = new Schema("raw", priceColumns(), KEY);
    public static final Schema ENRICHED = new Schema("enriched", enrichedColumns(), KEY);

    private Schemas() {}

    public static Schema of(Domain domain) {
        return domain == Domain.RAW ? RAW : ENRICHED;
    }

    private static List<Column> priceColumns() {
        return List.of(
                Column.required(INSTRUMENT, ColumnType.STRING),
                Column.required(DATE, ColumnType.DATE),
                Column.optional(OPEN, ColumnType.FLOAT64),
                Column.optional(HIGH, ColumnType.FLOAT64),
                Column.optional(LOW, ColumnType.FLOAT64),
                Column.optional(CLOSE, ColumnType.FLOAT64),
                Column.optional(VOLUME, ColumnType.INT64),
                Column.optional(INGEST_TS, ColumnType.TIMESTAMP));
    }

    private static List<Column> enrichedColumns() {
        List<Column> cols = new ArrayList<>(priceColumns());
        cols.add(Column.optional(DAILY_RETURN, ColumnType.FLOAT64));
        cols.add(Column.optional(ROLLING_VOL, ColumnType.FLOAT64));
        return cols;
    }
}
