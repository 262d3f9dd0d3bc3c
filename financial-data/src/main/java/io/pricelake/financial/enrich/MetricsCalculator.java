package io.pricelake.financial.enrich;

import io.pricelake.error.DataQualityException;
import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.PriceRow;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily return and rolling volatility, computed per instrument in date order.
 * <p>
 * {@code daily_return[i] = 100 * (close[i] - close[i-1]) / close[i-1]}; null on the first observation or when
 * either close is missing. {@code rolling_vol[i]} is the sample standard deviation of the non-null returns among
 * the last {@code window} observations, and 0.0 while fewer than two returns are available.
 */
public class MetricsCalculator {
    public static final int DEFAULT_WINDOW = 30;

    private final int window;

    public MetricsCalculator() { this(DEFAULT_WINDOW); }

    public MetricsCalculator(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1");
        this.window = window;
    }

    public int window() { return window; }

    public List<EnrichedRow> compute(List<PriceRow> rows) {
        return compute(List.of(), rows);
    }

    /**
     * Enriches {@code rows}. {@code history} holds earlier rows (e.g. the previous year's tail) that feed the first
     * returns and the rolling window but are not emitted. Rows of different instruments never mix.
     *
     * @throws DataQualityException on a zero prior close or a repeated (instrument, date)
     */
    public List<EnrichedRow> compute(List<PriceRow> history, List<PriceRow> rows) {
        Map<String, List<PriceRow>> byInstrument = group(rows);
        Map<String, List<PriceRow>> historyByInstrument = group(history);
        List<EnrichedRow> out = new ArrayList<>(rows.size());
        for (Map.Entry<String, List<PriceRow>> e : byInstrument.entrySet()) {
            List<PriceRow> current = e.getValue();
            LocalDate first = current.get(0).date();
            List<PriceRow> sequence = new ArrayList<>();
            for (PriceRow h : historyByInstrument.getOrDefault(e.getKey(), List.of())) {
                if (h.date().isBefore(first)) sequence.add(h);
            }
            int emitFrom = sequence.size();
            sequence.addAll(current);
            out.addAll(enrich(sequence, emitFrom));
        }
        return out;
    }

    private List<EnrichedRow> enrich(List<PriceRow> sequence, int emitFrom) {
        List<EnrichedRow> out = new ArrayList<>(sequence.size() - emitFrom);
        Deque<Double> trailing = new ArrayDeque<>(window);
        for (int i = 0; i < sequence.size(); i++) {
            PriceRow row = sequence.get(i);
            if (i > 0 && row.date().equals(sequence.get(i - 1).date())) {
                throw new DataQualityException("Duplicate key (" + row.instrument() + ", " + row.date() + ")");
            }
            Double ret = i == 0 ? null : dailyReturn(sequence.get(i - 1), row);
            if (trailing.size() == window) trailing.removeFirst();
            trailing.addLast(ret == null ? Double.NaN : ret);
            if (i >= emitFrom) out.add(new EnrichedRow(row, ret, sampleStdDev(trailing)));
        }
        return out;
    }

    private static Double dailyReturn(PriceRow prev, PriceRow cur) {
        double p = prev.close();
        double c = cur.close();
        if (Double.isNaN(p) || Double.isNaN(c)) return null;
        if (p == 0.0) {
            throw new DataQualityException("Zero prior close for " + cur.instrument() + " on " + prev.date()
                    + ", cannot compute return for " + cur.date());
        }
        return 100.0 * (c - p) / p;
    }

    static double sampleStdDev(Iterable<Double> values) {
        int n = 0;
        double sum = 0;
        for (Double v : values) {
            if (v.isNaN()) continue;
            n++;
            sum += v;
        }
        if (n < 2) return 0.0;
        double mean = sum / n;
        double sq = 0;
        for (Double v : values) {
            if (v.isNaN()) continue;
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / (n - 1));
    }

    private static Map<String, List<PriceRow>> group(List<PriceRow> rows) {
        Map<String, List<PriceRow>> out = new LinkedHashMap<>();
        for (PriceRow r : rows) {
            if (r.instrument() == null || r.date() == null) {
                throw new DataQualityException("Row without instrument or date: " + r);
            }
            out.computeIfAbsent(r.instrument(), k -> new ArrayList<>()).add(r);
        }
        for (List<PriceRow> list : out.values()) list.sort(Comparator.comparing(PriceRow::date));
        return out;
    }
}
