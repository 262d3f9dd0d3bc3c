package io.pricelake.financial.ingest;

import io.pricelake.core.KeyResult;
import io.pricelake.core.StageReport;
import io.pricelake.financial.model.Partition;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.PriceRow;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.runtime.KeyedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges fetched rows into the raw partitions they belong to.
 * <p>
 * Runs in two phases over the touched {@code (year, instrument)} keys. The first reads each existing partition
 * (absent means empty) and merges the key's fetched rows into it, fetched rows replacing stored rows of the same
 * date. The second writes the merged partitions. Every read and merge finishes before the first write starts, and
 * a key whose merge failed is not written. Keys fail independently.
 */
public class IngestionMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(IngestionMergeEngine.class);
    public static final String STAGE = "ingest";

    private final PartitionStore store;
    private final KeyedExecutor executor;

    public IngestionMergeEngine(PartitionStore store, KeyedExecutor executor) {
        this.store = store;
        this.executor = executor;
    }

    /**
     * @return per raw partition key, the merged partition's row count
     */
    public StageReport<PartitionKey, Integer> merge(Collection<PriceRow> fetched) {
        if (fetched.isEmpty()) {
            log.info("No rows fetched, nothing to merge");
            return StageReport.empty(STAGE);
        }
        Map<PartitionKey, List<PriceRow>> byKey = partition(fetched);
        log.info("Merging {} fetched rows into {} partitions", fetched.size(), byKey.size());

        StageReport<PartitionKey, Partition> merged = executor.runAll(STAGE + ".merge", byKey.keySet(),
                key -> KeyResult.succeeded(store.readRaw(key)
                        .orElseGet(() -> Partition.empty(key.year(), key.instrument()))
                        .merge(byKey.get(key))));

        Map<PartitionKey, Partition> toWrite = new LinkedHashMap<>();
        for (PartitionKey k : merged.succeededKeys()) toWrite.put(k, merged.result(k).value());
        StageReport<PartitionKey, Integer> written = executor.runAll(STAGE + ".write", toWrite.keySet(), key -> {
            Partition p = toWrite.get(key);
            store.writeRaw(p);
            return KeyResult.succeeded(p.size());
        });

        Map<PartitionKey, KeyResult<Integer>> results = new LinkedHashMap<>();
        for (Map.Entry<PartitionKey, KeyResult<Partition>> e : merged.results().entrySet()) {
            KeyResult<Partition> r = e.getValue();
            results.put(e.getKey(), r.isSucceeded() ? written.result(e.getKey()) : new KeyResult<>(r.status(), null, r.kind(), r.message()));
        }
        StageReport<PartitionKey, Integer> report = new StageReport<>(STAGE, results);
        log.info(report.summary());
        return report;
    }

    /**
     * Groups rows by raw partition key. Rows without an instrument or date cannot be placed and are dropped.
     */
    static Map<PartitionKey, List<PriceRow>> partition(Collection<PriceRow> rows) {
        Map<PartitionKey, List<PriceRow>> out = new TreeMap<>();
        int dropped = 0;
        for (PriceRow r : rows) {
            if (r.instrument() == null || r.date() == null || r.instrument().isBlank() || r.instrument().contains("/")) {
                dropped++;
                continue;
            }
            out.computeIfAbsent(PartitionKey.raw(r.year(), r.instrument()), k -> new ArrayList<>()).add(r);
        }
        if (dropped > 0) log.warn("Dropped {} fetched rows without instrument or date", dropped);
        return out;
    }
}
