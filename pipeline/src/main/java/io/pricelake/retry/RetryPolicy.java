package io.pricelake.retry;

public interface RetryPolicy {
    boolean shouldRetry(int attempt, Throwable e);
    long backoffMillis(int attempt);

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Throwable e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0; }
        };
    }
}
