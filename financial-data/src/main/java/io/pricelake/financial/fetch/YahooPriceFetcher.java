package io.pricelake.financial.fetch;

import io.pricelake.budget.RequestBudget;
import io.pricelake.error.TransientIoException;
import io.pricelake.financial.model.PriceRow;
import io.pricelake.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link PriceFetcher} over the Yahoo Finance chart API, one request per instrument within the request budget.
 * <p>
 * Bars without a close are dropped. An instrument whose request fails is logged and counted, and the other
 * instruments' rows are still returned; the call fails only when every instrument failed.
 */
public class YahooPriceFetcher implements PriceFetcher {
    private static final Logger log = LoggerFactory.getLogger(YahooPriceFetcher.class);

    private final YahooClient client;
    private final RequestBudget budget;
    private final Metrics metrics;
    private final Clock clock;
    private final String interval;

    public YahooPriceFetcher(YahooClient client, RequestBudget budget, Metrics metrics) {
        this(client, budget, metrics, Clock.systemUTC());
    }

    public YahooPriceFetcher(YahooClient client, RequestBudget budget, Metrics metrics, Clock clock) {
        this.client = client;
        this.budget = budget;
        this.metrics = metrics;
        this.clock = clock;
        this.interval = "1d";
    }

    @Override
    public List<PriceRow> fetch(List<String> instrumentIds, LocalDate start, LocalDate end) throws InterruptedException {
        long p1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = end.plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC) - 1; // inclusive end
        Instant ingestTs = clock.instant();
        List<PriceRow> rows = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String id : instrumentIds) {
            metrics.counter("fetch.windows").inc();
            budget.acquire();
            String body;
            try {
                body = client.fetch(id, p1, p2, interval);
            } catch (IOException | RuntimeException e) {
                metrics.counter("fetch.failures").inc();
                failures.put(id, e.toString());
                log.warn("Fetch failed for {} window {}..{}: {}", id, start, end, e.toString());
                continue;
            }
            List<PriceRow> parsed = parse(id, body, start, end, ingestTs);
            metrics.counter("fetch.rows").inc(parsed.size());
            log.debug("Fetched {} rows for {} window {}..{}", parsed.size(), id, start, end);
            rows.addAll(parsed);
        }
        if (!instrumentIds.isEmpty() && failures.size() == instrumentIds.size()) {
            throw new TransientIoException("Fetch failed for every instrument in window " + start + ".." + end + ": " + failures);
        }
        return rows;
    }

    static List<PriceRow> parse(String instrument, String body, LocalDate start, LocalDate end, Instant ingestTs) {
        long[] timestamps = extractLongArray(body, "\"timestamp\"\\s*:");
        double[] open = extractDoubleArray(body, "\"open\"\\s*:");
        double[] high = extractDoubleArray(body, "\"high\"\\s*:");
        double[] low = extractDoubleArray(body, "\"low\"\\s*:");
        double[] close = extractDoubleArray(body, "\"close\"\\s*:");
        long[] volume = extractLongArray(body, "\"volume\"\\s*:");

        int n = Math.min(timestamps.length,
                Math.min(open.length, Math.min(high.length, Math.min(low.length, Math.min(close.length, volume.length)))));
        List<PriceRow> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(close[i])) continue;
            LocalDate d = Instant.ofEpochSecond(timestamps[i]).atZone(ZoneOffset.UTC).toLocalDate();
            if (d.isBefore(start) || d.isAfter(end)) continue;
            out.add(new PriceRow(instrument, d, open[i], high[i], low[i], close[i], volume[i], ingestTs));
        }
        return out;
    }

    // Narrow extraction of numeric arrays like "timestamp":[1696118400, ...]
    private static long[] extractLongArray(String json, String keyRegex) {
        Optional<String> arr = extractArray(json, keyRegex);
        if (arr.isEmpty() || arr.get().isBlank()) return new long[0];
        String[] parts = arr.get().split(",");
        long[] out = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i].trim();
            out[i] = p.equals("null") || p.isEmpty() ? 0L : (long) Double.parseDouble(p);
        }
        return out;
    }

    private static double[] extractDoubleArray(String json, String keyRegex) {
        Optional<String> arr = extractArray(json, keyRegex);
        if (arr.isEmpty() || arr.get().isBlank()) return new double[0];
        String[] parts = arr.get().split(",");
        double[] out = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String p = parts[i].trim();
            out[i] = p.equals("null") || p.isEmpty() ? Double.NaN : Double.parseDouble(p);
        }
        return out;
    }

    private static Optional<String> extractArray(String json, String keyRegex) {
        Matcher m = Pattern.compile(keyRegex + "\\s*\\[(.*?)\\]", Pattern.DOTALL).matcher(json);
        return m.find() ? Optional.ofNullable(m.group(1)) : Optional.empty();
    }
}
