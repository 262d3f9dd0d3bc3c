package io.pricelake.financial.load;

import io.pricelake.core.KeyResult;
import io.pricelake.core.StageReport;
import io.pricelake.error.FailureKind;
import io.pricelake.financial.model.Domain;
import io.pricelake.financial.model.EnrichedPartition;
import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.metrics.Metrics;
import io.pricelake.runtime.KeyedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Appends enriched rows the relational table does not have yet.
 * <p>
 * A row is loaded when its instrument has no high-water mark, when its date is past the mark, or when it is dated
 * on the run date (the provisional day, which may have been revised). Each partition is one batch: the run-date
 * row is deleted and the new rows inserted in a single transaction. Re-running without new upstream data loads
 * nothing.
 */
public class IncrementalLoader {
    private static final Logger log = LoggerFactory.getLogger(IncrementalLoader.class);
    public static final String STAGE = "load";

    private final PartitionStore store;
    private final MetricsTable table;
    private final KeyedExecutor executor;
    private final Metrics metrics;

    public IncrementalLoader(PartitionStore store, MetricsTable table, KeyedExecutor executor) {
        this.store = store;
        this.table = table;
        this.executor = executor;
        this.metrics = executor.metrics();
    }

    /** Loads every enriched partition that can hold new rows. */
    public StageReport<PartitionKey, LoadResult> load(LocalDate runDate) {
        return load(runDate, store.listKeys(Domain.ENRICHED));
    }

    public StageReport<PartitionKey, LoadResult> load(LocalDate runDate, Collection<PartitionKey> enrichedKeys) {
        Map<String, LocalDate> marks;
        try {
            table.ensureSchema();
            marks = table.maxDatePerInstrument();
        } catch (SQLException e) {
            log.error("Cannot read high-water marks: {}", e.getMessage());
            Map<PartitionKey, KeyResult<LoadResult>> failed = new LinkedHashMap<>();
            for (PartitionKey k : enrichedKeys) {
                failed.put(k, KeyResult.failed(FailureKind.TRANSIENT, "high-water mark query failed: " + e.getMessage()));
            }
            return new StageReport<>(STAGE, failed);
        }
        List<PartitionKey> keys = new ArrayList<>();
        for (PartitionKey k : enrichedKeys) {
            if (mayHoldNewRows(k, marks.get(k.instrument()), runDate)) keys.add(k);
        }
        log.info("Loading {} of {} enriched partitions ({} instruments with a high-water mark), run date {}",
                keys.size(), enrichedKeys.size(), marks.size(), runDate);
        return executor.runAll(STAGE, keys, key -> loadPartition(key, marks.get(key.instrument()), runDate));
    }

    private KeyResult<LoadResult> loadPartition(PartitionKey key, LocalDate mark, LocalDate runDate) throws SQLException {
        Optional<EnrichedPartition> partition = store.readEnriched(key);
        if (partition.isEmpty()) return KeyResult.skipped("no enriched partition");
        List<EnrichedRow> fresh = newRows(partition.get().rows(), mark, runDate);
        if (fresh.isEmpty()) return KeyResult.skipped("up to date");

        List<LocalDate> reload = fresh.stream().map(EnrichedRow::date).filter(d -> d.equals(runDate)).toList();
        LoadResult result = table.replace(key.instrument(), reload, fresh);
        metrics.counter("load.rows.appended").inc(result.appended());
        metrics.counter("load.rows.deleted").inc(result.deleted());
        log.info("Loaded {}: appended={} deleted={} (mark {})", key, result.appended(), result.deleted(), mark);
        return KeyResult.succeeded(result);
    }

    /**
     * Rows beyond {@code mark}, plus the row dated {@code runDate}. A null mark keeps everything.
     */
    static List<EnrichedRow> newRows(List<EnrichedRow> rows, LocalDate mark, LocalDate runDate) {
        if (mark == null) return rows;
        return rows.stream().filter(r -> r.date().isAfter(mark) || r.date().equals(runDate)).toList();
    }

    private static boolean mayHoldNewRows(PartitionKey key, LocalDate mark, LocalDate runDate) {
        return mark == null || key.year() >= mark.getYear() || key.year() == runDate.getYear();
    }
}
