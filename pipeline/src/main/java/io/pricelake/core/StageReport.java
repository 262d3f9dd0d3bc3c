package io.pricelake.core;

import io.pricelake.error.FailureKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-key outcomes of one stage plus the derived stage status.
 * <p>
 * A key counts as attempted when it succeeded or failed; skipped keys had nothing to do. A stage that attempted
 * at least one key and succeeded on none is a stage failure.
 */
public final class StageReport<K, R> {
    private final String stage;
    private final Map<K, KeyResult<R>> results;

    public StageReport(String stage, Map<K, KeyResult<R>> results) {
        this.stage = stage;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static <K, R> StageReport<K, R> empty(String stage) {
        return new StageReport<>(stage, Map.of());
    }

    public String stage() { return stage; }
    public Map<K, KeyResult<R>> results() { return results; }
    public KeyResult<R> result(K key) { return results.get(key); }

    public int succeeded() { return count(KeyResult.Status.SUCCEEDED); }
    public int failed() { return count(KeyResult.Status.FAILED); }
    public int skipped() { return count(KeyResult.Status.SKIPPED); }
    public int attempted() { return succeeded() + failed(); }

    public boolean isFailure() { return attempted() > 0 && succeeded() == 0; }
    public boolean hasFailures() { return failed() > 0; }

    public List<K> succeededKeys() { return keys(KeyResult.Status.SUCCEEDED); }
    public List<K> failedKeys() { return keys(KeyResult.Status.FAILED); }

    public long failedOf(FailureKind kind) {
        return results.values().stream().filter(r -> r.isFailed() && r.kind() == kind).count();
    }

    /**
     * Results of a follow-up phase replace this report's results for the same keys.
     */
    public StageReport<K, R> then(StageReport<K, R> next) {
        Map<K, KeyResult<R>> merged = new LinkedHashMap<>(results);
        merged.putAll(next.results);
        return new StageReport<>(stage, merged);
    }

    public String summary() {
        return String.format("%s: keys=%d succeeded=%d failed=%d (transient=%d data=%d internal=%d) skipped=%d status=%s",
                stage, results.size(), succeeded(), failed(),
                failedOf(FailureKind.TRANSIENT), failedOf(FailureKind.DATA), failedOf(FailureKind.INTERNAL),
                skipped(), isFailure() ? "FAILED" : "OK");
    }

    private int count(KeyResult.Status status) {
        int n = 0;
        for (KeyResult<R> r : results.values()) if (r.status() == status) n++;
        return n;
    }

    private List<K> keys(KeyResult.Status status) {
        return results.entrySet().stream().filter(e -> e.getValue().status() == status).map(Map.Entry::getKey).toList();
    }

    @Override
    public String toString() { return summary(); }
}
