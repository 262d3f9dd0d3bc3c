package io.pricelake.financial.enrich;

import io.pricelake.core.KeyResult;
import io.pricelake.core.StageReport;
import io.pricelake.financial.frame.Frame;
import io.pricelake.financial.model.Domain;
import io.pricelake.financial.model.EnrichedPartition;
import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.Partition;
import io.pricelake.financial.model.PartitionFrames;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.PriceRow;
import io.pricelake.financial.quality.QualityGate;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.runtime.KeyedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns raw partitions into enriched partitions. Each key is read, checked against the raw schema, enriched
 * (seeded with the tail of the previous year's partition), checked against the enriched schema and only then
 * written. A rejected partition is reported as a data failure and its enriched file is left as it was.
 */
public class MetricsTransformer {
    private static final Logger log = LoggerFactory.getLogger(MetricsTransformer.class);
    public static final String STAGE = "transform";

    private final PartitionStore store;
    private final QualityGate gate;
    private final MetricsCalculator calculator;
    private final KeyedExecutor executor;

    public MetricsTransformer(PartitionStore store, QualityGate gate, MetricsCalculator calculator, KeyedExecutor executor) {
        this.store = store;
        this.gate = gate;
        this.calculator = calculator;
        this.executor = executor;
    }

    public StageReport<PartitionKey, Integer> transformAll() {
        return transform(store.listKeys(Domain.RAW));
    }

    /** @param rawKeys raw partition keys; the report is keyed by the same keys */
    public StageReport<PartitionKey, Integer> transform(Collection<PartitionKey> rawKeys) {
        return executor.runAll(STAGE, rawKeys, this::transformOne);
    }

    /**
     * Transforms {@code touched} together with the raw partitions seeded from them: the first returns of year
     * {@code Y + 1} depend on the tail of year {@code Y}, so a changed {@code Y} re-enriches an existing
     * {@code Y + 1} of the same instrument.
     */
    public StageReport<PartitionKey, Integer> transformTouched(Collection<PartitionKey> touched) {
        return transform(withSeededYears(touched));
    }

    List<PartitionKey> withSeededYears(Collection<PartitionKey> touched) {
        Set<PartitionKey> keys = new TreeSet<>(touched);
        for (PartitionKey k : touched) {
            PartitionKey next = PartitionKey.raw(k.year() + 1, k.instrument());
            if (!keys.contains(next) && store.exists(next)) {
                log.debug("{} changed, re-enriching {}", k, next);
                keys.add(next);
            }
        }
        return new ArrayList<>(keys);
    }

    KeyResult<Integer> transformOne(PartitionKey rawKey) {
        Optional<Frame> rawFrame = store.readFrame(rawKey);
        if (rawFrame.isEmpty()) return KeyResult.skipped("no raw partition");
        gate.check(rawKey, rawFrame.get()).throwIfFailed();
        Partition raw = PartitionFrames.toPartition(rawKey, rawFrame.get());

        List<PriceRow> seed = store.readRaw(rawKey.previousYear())
                .map(p -> p.tail(calculator.window()))
                .orElse(List.of());
        List<EnrichedRow> rows = calculator.compute(seed, raw.rows());

        PartitionKey target = rawKey.in(Domain.ENRICHED);
        Frame enriched = PartitionFrames.toFrame(new EnrichedPartition(rawKey.year(), rawKey.instrument(), rows));
        gate.check(target, enriched).throwIfFailed();
        store.writeFrame(target, enriched);
        log.debug("Enriched {} -> {} ({} rows, {} seed rows)", rawKey, target, rows.size(), seed.size());
        return KeyResult.succeeded(rows.size());
    }
}
