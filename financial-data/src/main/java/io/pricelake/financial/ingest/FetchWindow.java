package io.pricelake.financial.ingest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One fetch call: the instruments that share the inclusive date range {@code [start, end]}.
 */
public record FetchWindow(LocalDate start, LocalDate end, List<String> instruments) {
    public FetchWindow {
        if (end.isBefore(start)) throw new IllegalArgumentException("end " + end + " before start " + start);
        instruments = List.copyOf(instruments);
    }

    /** Splits at calendar-year boundaries so each call touches at most one year partition per instrument. */
    public List<FetchWindow> splitByYear() {
        List<FetchWindow> out = new ArrayList<>();
        LocalDate s = start;
        while (!s.isAfter(end)) {
            LocalDate yearEnd = LocalDate.of(s.getYear(), 12, 31);
            LocalDate e = yearEnd.isBefore(end) ? yearEnd : end;
            out.add(new FetchWindow(s, e, instruments));
            s = e.plusDays(1);
        }
        return out;
    }

    /** Splits the instrument list into calls of at most {@code size} instruments. */
    public List<FetchWindow> batches(int size) {
        List<FetchWindow> out = new ArrayList<>();
        for (int i = 0; i < instruments.size(); i += size) {
            out.add(new FetchWindow(start, end, instruments.subList(i, Math.min(instruments.size(), i + size))));
        }
        return out;
    }

    @Override
    public String toString() {
        return start + ".." + end + " " + (instruments.size() <= 5 ? instruments.toString() : instruments.size() + " instruments");
    }
}
