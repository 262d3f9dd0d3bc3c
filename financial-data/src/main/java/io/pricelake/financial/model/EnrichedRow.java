package io.pricelake.financial.model;

import java.time.LocalDate;

/**
 * A price row plus derived metrics. {@code dailyReturn} is in percent and null when there is no prior close;
 * {@code rollingVol} is never null for computed rows.
 */
public record EnrichedRow(PriceRow price, Double dailyReturn, Double rollingVol) {
    public String instrument() { return price.instrument(); }
    public LocalDate date() { return price.date(); }
    public RowKey key() { return price.key(); }
}
