package io.pricelake.financial.fetch;

import io.pricelake.financial.model.PriceRow;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of daily price rows.
 */
public interface PriceFetcher {
    /**
     * Rows for the given instruments with {@code start <= date <= end}. May be empty.
     */
    List<PriceRow> fetch(List<String> instrumentIds, LocalDate start, LocalDate end) throws Exception;
}
