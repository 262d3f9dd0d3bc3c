package io.pricelake.financial.model;

import io.pricelake.error.DataQualityException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * All raw rows of one {@code (year, instrument)}, keyed by date so that {@code (instrument, date)} is unique by
 * construction. Instances are immutable; {@link #merge} returns a new partition.
 */
public final class Partition {
    private final int year;
    private final String instrument;
    private final TreeMap<LocalDate, PriceRow> rows;

    private Partition(int year, String instrument, TreeMap<LocalDate, PriceRow> rows) {
        this.year = year;
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        this.rows = rows;
    }

    public static Partition empty(int year, String instrument) {
        return new Partition(year, instrument, new TreeMap<>());
    }

    /**
     * Builds a partition from stored rows. A duplicate date or a row of another instrument/year is a data error.
     */
    public static Partition of(int year, String instrument, Collection<PriceRow> stored) {
        TreeMap<LocalDate, PriceRow> map = new TreeMap<>();
        for (PriceRow r : stored) {
            requireMember(year, instrument, r);
            if (map.put(r.date(), r) != null) {
                throw new DataQualityException("Duplicate key (" + instrument + ", " + r.date() + ") in partition " + year + "/" + instrument);
            }
        }
        return new Partition(year, instrument, map);
    }

    /**
     * Union of this partition and {@code fetched}: existing rows whose date appears in {@code fetched} are
     * replaced, everything else is kept. Among fetched rows with the same date, the last one wins.
     */
    public Partition merge(Collection<PriceRow> fetched) {
        TreeMap<LocalDate, PriceRow> merged = new TreeMap<>(rows);
        for (PriceRow r : fetched) {
            requireMember(year, instrument, r);
            merged.put(r.date(), r);
        }
        return new Partition(year, instrument, merged);
    }

    private static void requireMember(int year, String instrument, PriceRow r) {
        if (r.instrument() == null || r.date() == null) {
            throw new DataQualityException("Row without instrument or date in partition " + year + "/" + instrument);
        }
        if (!r.instrument().equals(instrument) || r.date().getYear() != year) {
            throw new DataQualityException("Row (" + r.instrument() + ", " + r.date() + ") does not belong to partition " + year + "/" + instrument);
        }
    }

    public int year() { return year; }
    public String instrument() { return instrument; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    /** Rows in ascending date order. */
    public List<PriceRow> rows() { return new ArrayList<>(rows.values()); }

    public Optional<PriceRow> row(LocalDate date) { return Optional.ofNullable(rows.get(date)); }

    public Optional<LocalDate> maxDate() { return rows.isEmpty() ? Optional.empty() : Optional.of(rows.lastKey()); }

    /** The last {@code n} rows in ascending date order. */
    public List<PriceRow> tail(int n) {
        List<PriceRow> all = rows();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Partition that)) return false;
        return year == that.year && instrument.equals(that.instrument) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() { return Objects.hash(year, instrument, rows); }

    @Override
    public String toString() { return "Partition{" + year + "/" + instrument + ", rows=" + rows.size() + '}'; }
}
