package io.pricelake.financial.load;

import io.pricelake.financial.model.EnrichedRow;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Relational table of enriched rows, unique on {@code (instrument, date)}.
 */
public interface MetricsTable {
    void ensureSchema() throws SQLException;

    /** High-water mark per instrument; instruments without rows are absent. */
    Map<String, LocalDate> maxDatePerInstrument() throws SQLException;

    /**
     * In one transaction, deletes the instrument's rows on {@code reloadDates} and appends {@code rows}.
     * Either both happen or neither does.
     */
    LoadResult replace(String instrument, Collection<LocalDate> reloadDates, List<EnrichedRow> rows) throws SQLException;

    long countRows() throws SQLException;
}
