package io.pricelake.financial.quality;

import io.pricelake.financial.frame.Column;
import io.pricelake.financial.frame.ColumnType;
import io.pricelake.financial.frame.Frame;
import io.pricelake.financial.frame.Schema;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.Schemas;
import io.pricelake.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a partition frame against its schema before it is published. All checks run; the report lists every
 * violation found, at most {@link #MAX_PER_COLUMN} per column and check.
 * <ul>
 *   <li>every schema column is present</li>
 *   <li>non-null values have the column's declared type</li>
 *   <li>non-nullable columns ({@code instrument}, {@code date}) have no nulls</li>
 *   <li>float values are finite</li>
 *   <li>{@code (instrument, date)} is unique</li>
 *   <li>rows belong to the partition's instrument and year</li>
 * </ul>
 */
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);
    static final int MAX_PER_COLUMN = 5;

    private final Metrics metrics;

    public QualityGate(Metrics metrics) {
        this.metrics = metrics;
    }

    public QualityReport check(PartitionKey key, Frame frame) {
        return check(key, frame, Schemas.of(key.domain()));
    }

    public QualityReport check(PartitionKey key, Frame frame, Schema schema) {
        List<Violation> out = new ArrayList<>();
        for (Column c : schema.columns()) {
            if (!frame.hasColumn(c.name())) {
                out.add(Violation.column(Check.REQUIRED_COLUMN, c.name(), "missing required column '" + c.name() + "'"));
                continue;
            }
            checkValues(c, frame.column(c.name()), out);
        }
        checkKeys(key, frame, schema, out);
        QualityReport report = new QualityReport(key, frame.rowCount(), out);
        if (!report.passed()) {
            metrics.counter("quality.violations").inc(out.size());
            log.warn("Quality gate rejected {} ({} rows, {} violations)", key, frame.rowCount(), out.size());
            for (Violation v : out) log.warn("  {}: {}", key, v);
        }
        return report;
    }

    private static void checkValues(Column c, List<Object> values, List<Violation> out) {
        int typeErrors = 0;
        int nulls = 0;
        int nonFinite = 0;
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            if (v == null) {
                if (!c.nullable() && nulls++ < MAX_PER_COLUMN) {
                    out.add(new Violation(Check.NOT_NULL, c.name(), i, "null in non-nullable column"));
                }
            } else if (!c.type().accepts(v)) {
                if (typeErrors++ < MAX_PER_COLUMN) {
                    out.add(new Violation(Check.COLUMN_TYPE, c.name(), i, "expected " + c.type() + ", found '" + v + "'"));
                }
            } else if (c.type() == ColumnType.FLOAT64 && !Double.isFinite((Double) v)) {
                if (nonFinite++ < MAX_PER_COLUMN) {
                    out.add(new Violation(Check.FINITE, c.name(), i, "non-finite value " + v));
                }
            }
        }
    }

    private static void checkKeys(PartitionKey key, Frame frame, Schema schema, List<Violation> out) {
        if (!frame.hasColumn(Schemas.INSTRUMENT) || !frame.hasColumn(Schemas.DATE)) return;
        Set<List<Object>> seen = new HashSet<>();
        int duplicates = 0;
        int foreign = 0;
        for (int i = 0; i < frame.rowCount(); i++) {
            List<Object> rowKey = new ArrayList<>(schema.keyColumns().size());
            for (String k : schema.keyColumns()) rowKey.add(frame.get(i, k));
            if (!rowKey.contains(null) && !seen.add(rowKey) && duplicates++ < MAX_PER_COLUMN) {
                out.add(new Violation(Check.UNIQUE_KEY, String.join(",", schema.keyColumns()), i, "duplicate key " + rowKey));
            }
            Object instrument = frame.get(i, Schemas.INSTRUMENT);
            Object date = frame.get(i, Schemas.DATE);
            boolean wrongInstrument = instrument != null && !key.instrument().equals(instrument);
            boolean wrongYear = date instanceof LocalDate d && d.getYear() != key.year();
            if ((wrongInstrument || wrongYear) && foreign++ < MAX_PER_COLUMN) {
                out.add(new Violation(Check.PARTITION_MEMBERSHIP, Schemas.INSTRUMENT, i,
                        "row (" + instrument + ", " + date + ") is outside partition " + key));
            }
        }
    }
}
