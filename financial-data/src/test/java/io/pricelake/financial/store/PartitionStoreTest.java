package io.pricelake.financial.store;

import io.pricelake.error.DataQualityException;
import io.pricelake.error.TransientIoException;
import io.pricelake.financial.model.Domain;
import io.pricelake.financial.model.EnrichedPartition;
import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.Partition;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.PriceRow;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.pricelake.financial.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

class PartitionStoreTest {
    private final InMemoryObjectStore objects = new InMemoryObjectStore();
    private final PartitionStore store = new PartitionStore(objects);

    @Test
    void rawPartitionSurvivesStorage() {
        PriceRow missingOpen = new PriceRow("X", java.time.LocalDate.parse("2024-01-04"), Double.NaN, 3, 1, 2, 0, null);
        Partition p = Partition.of(2024, "X", List.of(row("X", "2024-01-02", 100.25), missingOpen));
        store.writeRaw(p);

        assertEquals(p, store.readRaw(PartitionKey.raw(2024, "X")).orElseThrow());
        assertTrue(store.readRaw(PartitionKey.raw(2023, "X")).isEmpty());
    }

    @Test
    void enrichedPartitionKeepsNullReturn() {
        EnrichedPartition p = new EnrichedPartition(2024, "X", List.of(
                new EnrichedRow(row("X", "2024-01-02", 100), null, 0.0),
                new EnrichedRow(row("X", "2024-01-03", 110), 10.0, 0.0)));
        store.writeEnriched(p);

        EnrichedPartition back = store.readEnriched(PartitionKey.enriched(2024, "X")).orElseThrow();
        assertNull(back.rows().get(0).dailyReturn());
        assertEquals(10.0, back.rows().get(1).dailyReturn());
    }

    @Test
    void listsKeysAndYearsPerDomain() {
        store.writeRaw(Partition.of(2023, "X", List.of(row("X", "2023-05-01", 1))));
        store.writeRaw(Partition.of(2024, "X", List.of(row("X", "2024-05-01", 1))));
        store.writeRaw(Partition.of(2024, "Y", List.of(row("Y", "2024-05-01", 1))));

        assertEquals(List.of(PartitionKey.raw(2023, "X"), PartitionKey.raw(2024, "X"), PartitionKey.raw(2024, "Y")),
                store.listKeys(Domain.RAW));
        assertEquals(List.of(2023, 2024), List.copyOf(store.listYears(Domain.RAW, "X")));
        assertTrue(store.listKeys(Domain.ENRICHED).isEmpty());
    }

    @Test
    void ioFailureIsTransientAndBadContentIsData() {
        PartitionKey key = PartitionKey.raw(2024, "X");
        objects.failReadsOf(key.objectKey());
        assertThrows(TransientIoException.class, () -> store.readRaw(key));

        objects.heal();
        assertDoesNotThrow(() -> objects.write(key.objectKey(), "instrument,close\nX,1\n".getBytes(StandardCharsets.UTF_8)));
        DataQualityException e = assertThrows(DataQualityException.class, () -> store.readRaw(key));
        assertTrue(e.violations().stream().anyMatch(v -> v.contains("'date'")));
    }
}
