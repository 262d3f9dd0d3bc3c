package io.pricelake.financial.ingest;

import io.pricelake.core.StageReport;
import io.pricelake.financial.model.Partition;
import io.pricelake.financial.store.InMemoryObjectStore;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.retry.RetryPolicy;
import io.pricelake.runtime.KeyedExecutor;
import io.pricelake.runtime.KeyedExecutorBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static io.pricelake.financial.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

class IngestionPlannerTest {
    private static final LocalDate BACKFILL = LocalDate.of(2020, 1, 1);
    // a Wednesday
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 13);

    private final PartitionStore store = new PartitionStore(new InMemoryObjectStore());
    private final KeyedExecutor executor = new KeyedExecutorBuilder().workers(2).retry(RetryPolicy.never()).build();
    private final IngestionPlanner planner = new IngestionPlanner(store, executor, BACKFILL, 1);

    @AfterEach
    void close() { executor.close(); }

    @Test
    void instrumentWithoutDataStartsAtBackfillStart() {
        StageReport<String, FetchWindow> plan = planner.plan(List.of("NEW"), TODAY);
        FetchWindow w = plan.result("NEW").value();
        assertEquals(BACKFILL, w.start());
        assertEquals(TODAY, w.end());
    }

    @Test
    void windowStartsAfterLatestStoredDateAcrossYears() {
        store.writeRaw(Partition.of(2023, "X", List.of(row("X", "2023-12-29", 1))));
        store.writeRaw(Partition.of(2024, "X", List.of(row("X", "2024-03-08", 1))));
        FetchWindow w = planner.plan(List.of("X"), TODAY).result("X").value();
        assertEquals(LocalDate.of(2024, 3, 9), w.start());
    }

    @Test
    void upToDateInstrumentStillRefetchesTheProvisionalDay() {
        store.writeRaw(Partition.of(2024, "X", List.of(row("X", TODAY, 1))));
        FetchWindow w = planner.plan(List.of("X"), TODAY).result("X").value();
        assertEquals(TODAY, w.start());
    }

    @Test
    void windowWithoutTradingDayIsSkipped() {
        LocalDate sunday = LocalDate.of(2024, 3, 10);
        store.writeRaw(Partition.of(2024, "X", List.of(row("X", "2024-03-08", 1))));
        StageReport<String, FetchWindow> plan = planner.plan(List.of("X"), sunday);
        assertTrue(plan.result("X").isSkipped());
        assertFalse(plan.isFailure());
    }

    @Test
    void fxPairsTradeOnUsHolidays() {
        LocalDate goodFriday = LocalDate.of(2024, 3, 29);
        store.writeRaw(Partition.of(2024, "SPY", List.of(row("SPY", "2024-03-28", 1))));
        store.writeRaw(Partition.of(2024, "EURUSD=X", List.of(row("EURUSD=X", "2024-03-28", 1))));
        StageReport<String, FetchWindow> plan = planner.plan(List.of("SPY", "EURUSD=X"), goodFriday);
        assertTrue(plan.result("SPY").isSkipped());
        assertTrue(plan.result("EURUSD=X").isSucceeded());
    }

    @Test
    void instrumentsSharingAWindowAreGroupedInBoundedBatches() {
        List<String> ids = new ArrayList<>();
        IntStream.range(0, 12).forEach(i -> ids.add("T" + i));
        for (String id : ids) store.writeRaw(Partition.of(2024, id, List.of(row(id, "2024-03-11", 1))));

        List<FetchWindow> windows = IngestionPlanner.group(planner.plan(ids, TODAY));
        assertEquals(2, windows.size());
        assertEquals(IngestionPlanner.MAX_INSTRUMENTS_PER_CALL, windows.get(0).instruments().size());
        assertEquals(2, windows.get(1).instruments().size());
        assertEquals(LocalDate.of(2024, 3, 12), windows.get(0).start());
    }

    @Test
    void backfillCoversWholeHistorySplitByYear() {
        List<FetchWindow> windows = planner.backfill(List.of("X"), TODAY);
        assertEquals(5, windows.size());
        assertEquals(BACKFILL, windows.get(0).start());
        assertEquals(LocalDate.of(2020, 12, 31), windows.get(0).end());
        assertEquals(TODAY, windows.get(4).end());
    }
}
