package io.pricelake.financial.ingest;

import io.pricelake.core.KeyResult;
import io.pricelake.core.StageReport;
import io.pricelake.financial.model.Domain;
import io.pricelake.financial.model.Partition;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.runtime.KeyedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Works out, per instrument, which date range is missing from the raw partitions.
 * <p>
 * An instrument without raw data starts at the backfill start. Otherwise the window starts the day after its latest
 * stored date, but no later than the first of the trailing {@code provisionalDays} days, so a day fetched before
 * the close is fetched again. Windows without a trading day are dropped.
 */
public class IngestionPlanner {
    private static final Logger log = LoggerFactory.getLogger(IngestionPlanner.class);
    public static final String STAGE = "plan";
    /** Keeps one fetch call short enough for the per-key timeout under the shared request budget. */
    public static final int MAX_INSTRUMENTS_PER_CALL = 10;

    private final PartitionStore store;
    private final KeyedExecutor executor;
    private final LocalDate backfillStart;
    private final int provisionalDays;

    public IngestionPlanner(PartitionStore store, KeyedExecutor executor, LocalDate backfillStart, int provisionalDays) {
        this.store = store;
        this.executor = executor;
        this.backfillStart = backfillStart;
        this.provisionalDays = Math.max(1, provisionalDays);
    }

    /** Per-instrument windows; instruments that are up to date are reported as skipped. */
    public StageReport<String, FetchWindow> plan(Collection<String> instruments, LocalDate today) {
        return executor.runAll(STAGE, instruments, id -> {
            Optional<LocalDate> latest = latestDate(id);
            LocalDate start = startFor(latest, today);
            if (start.isAfter(today)) return KeyResult.skipped("up to date");
            if (!TradingCalendars.hasTradingDay(start, today, TradingCalendars.forInstrument(id))) {
                return KeyResult.skipped("no trading day in " + start + ".." + today);
            }
            log.debug("{}: latest={} window={}..{}", id, latest.orElse(null), start, today);
            return KeyResult.succeeded(new FetchWindow(start, today, List.of(id)));
        });
    }

    /** The full history for every instrument, regardless of what is stored, split like {@link #group}. */
    public List<FetchWindow> backfill(Collection<String> instruments, LocalDate today) {
        if (instruments.isEmpty() || backfillStart.isAfter(today)) return List.of();
        return split(new FetchWindow(backfillStart, today, List.copyOf(instruments)));
    }

    LocalDate startFor(Optional<LocalDate> latest, LocalDate today) {
        if (latest.isEmpty()) return backfillStart;
        LocalDate next = latest.get().plusDays(1);
        LocalDate provisional = today.minusDays(provisionalDays - 1L);
        return next.isBefore(provisional) ? next : provisional;
    }

    /** Max date of the newest non-empty raw partition. */
    Optional<LocalDate> latestDate(String instrument) {
        List<Integer> years = new ArrayList<>(store.listYears(Domain.RAW, instrument));
        for (int i = years.size() - 1; i >= 0; i--) {
            Optional<LocalDate> max = store.readRaw(PartitionKey.raw(years.get(i), instrument)).flatMap(Partition::maxDate);
            if (max.isPresent()) return max;
        }
        return Optional.empty();
    }

    /**
     * Merges per-instrument windows with the same range, split at year boundaries and into bounded batches.
     */
    public static List<FetchWindow> group(StageReport<String, FetchWindow> planned) {
        Map<List<LocalDate>, List<String>> byRange = new TreeMap<>((a, b) -> {
            int c = a.get(0).compareTo(b.get(0));
            return c != 0 ? c : a.get(1).compareTo(b.get(1));
        });
        for (KeyResult<FetchWindow> r : planned.results().values()) {
            if (!r.isSucceeded()) continue;
            FetchWindow w = r.value();
            byRange.computeIfAbsent(List.of(w.start(), w.end()), k -> new ArrayList<>()).addAll(w.instruments());
        }
        List<FetchWindow> out = new ArrayList<>();
        for (Map.Entry<List<LocalDate>, List<String>> e : byRange.entrySet()) {
            out.addAll(split(new FetchWindow(e.getKey().get(0), e.getKey().get(1), e.getValue())));
        }
        return out;
    }

    private static List<FetchWindow> split(FetchWindow window) {
        List<FetchWindow> out = new ArrayList<>();
        for (FetchWindow year : window.splitByYear()) out.addAll(year.batches(MAX_INSTRUMENTS_PER_CALL));
        return out;
    }
}
