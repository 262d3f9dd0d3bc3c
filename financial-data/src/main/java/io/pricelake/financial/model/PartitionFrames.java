package io.pricelake.financial.model;

import io.pricelake.error.DataQualityException;
import io.pricelake.financial.frame.Column;
import io.pricelake.financial.frame.Frame;
import io.pricelake.financial.frame.Schema;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static io.pricelake.financial.model.Schemas.*;

/**
 * Converts partitions to and from their file frames. Absent optional prices are NaN in memory and empty cells
 * on disk; an absent volume is 0.
 */
public final class PartitionFrames {
    private PartitionFrames() {}

    public static Frame toFrame(Partition partition) {
        Frame.Builder b = Frame.builder(RAW.columnNames());
        for (PriceRow r : partition.rows()) b.addRow(priceCells(r));
        return b.build();
    }

    public static Frame toFrame(EnrichedPartition partition) {
        Frame.Builder b = Frame.builder(ENRICHED.columnNames());
        for (EnrichedRow r : partition.rows()) {
            List<Object> cells = new ArrayList<>(priceCells(r.price()));
            cells.add(r.dailyReturn());
            cells.add(r.rollingVol());
            b.addRow(cells);
        }
        return b.build();
    }

    /**
     * @throws DataQualityException when the frame does not fit the raw schema or the partition key
     */
    public static Partition toPartition(PartitionKey key, Frame frame) {
        requireShape(frame, RAW);
        return Partition.of(key.year(), key.instrument(), priceRows(frame));
    }

    public static EnrichedPartition toEnriched(PartitionKey key, Frame frame) {
        requireShape(frame, ENRICHED);
        List<PriceRow> prices = priceRows(frame);
        List<EnrichedRow> rows = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            PriceRow p = prices.get(i);
            if (!key.instrument().equals(p.instrument()) || p.date() == null || p.year() != key.year()) {
                throw new DataQualityException("Row " + i + " does not belong to partition " + key);
            }
            rows.add(new EnrichedRow(p, (Double) frame.get(i, DAILY_RETURN), (Double) frame.get(i, ROLLING_VOL)));
        }
        return new EnrichedPartition(key.year(), key.instrument(), rows);
    }

    private static List<Object> priceCells(PriceRow r) {
        List<Object> cells = new ArrayList<>(8);
        cells.add(r.instrument());
        cells.add(r.date());
        cells.add(nullIfNaN(r.open()));
        cells.add(nullIfNaN(r.high()));
        cells.add(nullIfNaN(r.low()));
        cells.add(nullIfNaN(r.close()));
        cells.add(r.volume());
        cells.add(r.ingestTs());
        return cells;
    }

    private static List<PriceRow> priceRows(Frame frame) {
        List<PriceRow> out = new ArrayList<>(frame.rowCount());
        for (int i = 0; i < frame.rowCount(); i++) {
            Long volume = (Long) frame.get(i, VOLUME);
            out.add(new PriceRow(
                    (String) frame.get(i, INSTRUMENT),
                    (LocalDate) frame.get(i, DATE),
                    nanIfNull(frame.get(i, OPEN)),
                    nanIfNull(frame.get(i, HIGH)),
                    nanIfNull(frame.get(i, LOW)),
                    nanIfNull(frame.get(i, CLOSE)),
                    volume == null ? 0L : volume,
                    (Instant) frame.get(i, INGEST_TS)));
        }
        return out;
    }

    private static void requireShape(Frame frame, Schema schema) {
        List<String> problems = new ArrayList<>();
        for (Column c : schema.columns()) {
            if (!frame.hasColumn(c.name())) {
                problems.add("missing column '" + c.name() + "'");
                continue;
            }
            for (Object v : frame.column(c.name())) {
                if (!c.type().accepts(v)) {
                    problems.add("column '" + c.name() + "' holds non-" + c.type() + " value '" + v + "'");
                    break;
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new DataQualityException("Frame does not match " + schema.name() + " schema: " + problems, problems);
        }
    }

    private static Double nullIfNaN(double v) { return Double.isNaN(v) ? null : v; }

    private static double nanIfNull(Object v) { return v == null ? Double.NaN : (Double) v; }
}
