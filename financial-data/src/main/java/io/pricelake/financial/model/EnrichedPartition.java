package io.pricelake.financial.model;

import java.util.List;

/**
 * Enriched rows of one {@code (year, instrument)}, ordered by date.
 */
public record EnrichedPartition(int year, String instrument, List<EnrichedRow> rows) {
    public EnrichedPartition {
        rows = List.copyOf(rows);
    }

    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
}
