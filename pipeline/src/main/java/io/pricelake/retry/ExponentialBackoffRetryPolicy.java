package io.pricelake.retry;

import io.pricelake.error.FailureKind;

/**
 * Retries transient failures only, doubling the delay on every attempt up to a cap.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable e) {
        return attempt < maxAttempts && FailureKind.classify(e) == FailureKind.TRANSIENT;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
