package io.pricelake.error;

/**
 * Receives keys whose stage operation failed for good (after retries).
 */
public interface DeadLetterSink extends AutoCloseable {
    void acceptFailure(String stage, String key, FailureKind kind, String error);

    @Override default void close() {}

    static DeadLetterSink none() {
        return (stage, key, kind, error) -> { };
    }
}
