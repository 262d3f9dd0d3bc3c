package io.pricelake.financial.model;

import io.pricelake.error.DataQualityException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static io.pricelake.financial.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

class PartitionTest {

    @Test
    void mergeAddsNewDatesAndPrefersFetchedRowOnCollision() {
        Partition existing = Partition.of(2024, "X", List.of(row("X", "2024-01-02", 100), row("X", "2024-01-03", 101)));
        Partition merged = existing.merge(List.of(row("X", "2024-01-03", 105), row("X", "2024-01-04", 102)));

        assertEquals(3, merged.size());
        assertEquals(105.0, merged.row(LocalDate.parse("2024-01-03")).orElseThrow().close());
        assertEquals(LocalDate.parse("2024-01-04"), merged.maxDate().orElseThrow());
        assertEquals(2, existing.size(), "merge must not mutate the original");
    }

    @Test
    void mergeIsIdempotent() {
        List<PriceRow> fetched = List.of(row("X", "2024-01-03", 105), row("X", "2024-01-04", 102));
        Partition base = Partition.of(2024, "X", List.of(row("X", "2024-01-02", 100)));
        Partition once = base.merge(fetched);
        assertEquals(once, once.merge(fetched));
    }

    @Test
    void lastFetchedRowWinsWithinOneBatch() {
        Partition merged = Partition.empty(2024, "X").merge(List.of(row("X", "2024-01-03", 1), row("X", "2024-01-03", 2)));
        assertEquals(1, merged.size());
        assertEquals(2.0, merged.rows().get(0).close());
    }

    @Test
    void rejectsRowsOfAnotherInstrumentOrYear() {
        Partition p = Partition.empty(2024, "X");
        assertThrows(DataQualityException.class, () -> p.merge(List.of(row("Y", "2024-01-03", 1))));
        assertThrows(DataQualityException.class, () -> p.merge(List.of(row("X", "2023-12-29", 1))));
    }

    @Test
    void storedDuplicatesAreADataError() {
        DataQualityException e = assertThrows(DataQualityException.class,
                () -> Partition.of(2024, "X", List.of(row("X", "2024-01-03", 1), row("X", "2024-01-03", 2))));
        assertTrue(e.getMessage().contains("Duplicate"));
    }

    @Test
    void tailReturnsLastRowsInDateOrder() {
        Partition p = Partition.empty(2023, "X").merge(List.of(
                row("X", "2023-12-29", 3), row("X", "2023-12-27", 1), row("X", "2023-12-28", 2)));
        List<PriceRow> tail = p.tail(2);
        assertEquals(List.of(2.0, 3.0), tail.stream().map(PriceRow::close).toList());
        assertEquals(3, p.tail(10).size());
    }

    @Test
    void partitionKeyRoundTripsThroughObjectKey() {
        PartitionKey key = PartitionKey.raw(2024, "BRK-B");
        assertEquals("raw/2024/BRK-B_metrics.csv", key.objectKey());
        assertEquals(key, PartitionKey.parse(key.objectKey()).orElseThrow());
        assertEquals("enriched/2024/BRK-B_metrics.csv", key.in(Domain.ENRICHED).objectKey());
        assertTrue(PartitionKey.parse("raw/2024/notes.txt").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> PartitionKey.raw(2024, "a/b"));
    }
}
