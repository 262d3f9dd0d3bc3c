package io.pricelake.financial;

import io.pricelake.core.KeyResult;
import io.pricelake.core.StageReport;
import io.pricelake.financial.enrich.MetricsTransformer;
import io.pricelake.financial.fetch.PriceFetcher;
import io.pricelake.financial.ingest.FetchWindow;
import io.pricelake.financial.ingest.IngestionMergeEngine;
import io.pricelake.financial.ingest.IngestionPlanner;
import io.pricelake.financial.load.IncrementalLoader;
import io.pricelake.financial.load.LoadResult;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.PriceRow;
import io.pricelake.financial.registry.InstrumentRegistry;
import io.pricelake.runtime.KeyedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sequences the stages: plan and fetch, merge into raw partitions, enrich, load. A stage starts only after the
 * previous one has finished every key.
 */
public class MarketDataPipeline {
    private static final Logger log = LoggerFactory.getLogger(MarketDataPipeline.class);
    public static final String FETCH_STAGE = "fetch";

    private final InstrumentRegistry registry;
    private final IngestionPlanner planner;
    private final PriceFetcher fetcher;
    private final IngestionMergeEngine mergeEngine;
    private final MetricsTransformer transformer;
    private final IncrementalLoader loader;
    private final KeyedExecutor executor;

    public MarketDataPipeline(InstrumentRegistry registry, IngestionPlanner planner, PriceFetcher fetcher,
                              IngestionMergeEngine mergeEngine, MetricsTransformer transformer,
                              IncrementalLoader loader, KeyedExecutor executor) {
        this.registry = registry;
        this.planner = planner;
        this.fetcher = fetcher;
        this.mergeEngine = mergeEngine;
        this.transformer = transformer;
        this.loader = loader;
        this.executor = executor;
    }

    /** Incremental ingest, then transform of the touched partitions and the years seeded from them, then load. */
    public PipelineRunReport run(LocalDate today) {
        PipelineRunReport report = new PipelineRunReport();
        List<PartitionKey> touched = ingest(today, report);
        report.add(transformer.transformTouched(touched));
        report.add(loader.load(today));
        log.info("Run for {} finished:\n{}", today, report);
        return report;
    }

    /** @return raw keys written by the merge */
    public List<PartitionKey> ingest(LocalDate today, PipelineRunReport report) {
        StageReport<String, FetchWindow> plan = planner.plan(registry.ids(), today);
        report.add(plan);
        return fetchAndMerge(IngestionPlanner.group(plan), report);
    }

    /** Fetches and merges the full history one year at a time. */
    public List<PartitionKey> backfill(LocalDate today, PipelineRunReport report) {
        Map<Integer, List<FetchWindow>> byYear = new TreeMap<>();
        for (FetchWindow w : planner.backfill(registry.ids(), today)) {
            byYear.computeIfAbsent(w.start().getYear(), y -> new ArrayList<>()).add(w);
        }
        StageReport<FetchWindow, List<PriceRow>> fetched = StageReport.empty(FETCH_STAGE);
        StageReport<PartitionKey, Integer> merged = StageReport.empty(IngestionMergeEngine.STAGE);
        for (Map.Entry<Integer, List<FetchWindow>> e : byYear.entrySet()) {
            log.info("Backfilling {}", e.getKey());
            StageReport<FetchWindow, List<PriceRow>> f = fetch(e.getValue());
            fetched = fetched.then(f);
            merged = merged.then(mergeEngine.merge(rowsOf(f)));
        }
        report.add(fetched).add(merged);
        return merged.succeededKeys();
    }

    public StageReport<PartitionKey, Integer> transformAll() {
        return transformer.transformAll();
    }

    public StageReport<PartitionKey, LoadResult> load(LocalDate runDate) {
        return loader.load(runDate);
    }

    private List<PartitionKey> fetchAndMerge(List<FetchWindow> windows, PipelineRunReport report) {
        StageReport<FetchWindow, List<PriceRow>> fetched = fetch(windows);
        StageReport<PartitionKey, Integer> merged = mergeEngine.merge(rowsOf(fetched));
        report.add(fetched).add(merged);
        return merged.succeededKeys();
    }

    private StageReport<FetchWindow, List<PriceRow>> fetch(List<FetchWindow> windows) {
        return executor.runAll(FETCH_STAGE, windows, w -> {
            List<PriceRow> rows = fetcher.fetch(w.instruments(), w.start(), w.end());
            if (rows.isEmpty()) return KeyResult.skipped("no rows returned");
            return KeyResult.succeeded(rows);
        });
    }

    private static List<PriceRow> rowsOf(StageReport<FetchWindow, List<PriceRow>> fetched) {
        List<PriceRow> rows = new ArrayList<>();
        for (FetchWindow w : fetched.succeededKeys()) rows.addAll(fetched.result(w).value());
        return rows;
    }
}
