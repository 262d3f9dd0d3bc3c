package io.pricelake.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.SQLException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Failure taxonomy for per-key work. Absence (missing partition, no high-water mark) is not a failure
 * and has no kind.
 */
public enum FailureKind {
    /** Network, object-store or database trouble; retrying the key may succeed. */
    TRANSIENT,
    /** Bad input (schema mismatch, unexpected nulls, zero prior close); never retried. */
    DATA,
    /** Anything else, typically a bug. */
    INTERNAL;

    public static FailureKind classify(Throwable t) {
        Throwable e = unwrap(t);
        if (e instanceof DataQualityException) return DATA;
        if (e instanceof TransientIoException
                || e instanceof IOException
                || e instanceof UncheckedIOException
                || e instanceof SQLException
                || e instanceof TimeoutException) return TRANSIENT;
        return INTERNAL;
    }

    public static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
