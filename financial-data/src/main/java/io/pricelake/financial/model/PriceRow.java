package io.pricelake.financial.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One daily bar for one instrument. {@code (instrument, date)} is the unique key.
 */
public record PriceRow(String instrument, LocalDate date, double open, double high, double low, double close,
                       long volume, Instant ingestTs) {

    public RowKey key() { return new RowKey(instrument, date); }

    public int year() { return date.getYear(); }

    public PriceRow withClose(double newClose) {
        return new PriceRow(instrument, date, open, high, low, newClose, volume, ingestTs);
    }
}
