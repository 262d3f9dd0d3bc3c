package io.pricelake.core;

import io.pricelake.error.FailureKind;

import java.util.Objects;

/**
 * Outcome of one key in one stage.
 *
 * @param status  what happened
 * @param value   operation output, only for {@link Status#SUCCEEDED}
 * @param kind    failure classification, only for {@link Status#FAILED}
 * @param message skip reason or failure description
 */
public record KeyResult<R>(Status status, R value, FailureKind kind, String message) {

    public enum Status { SUCCEEDED, FAILED, SKIPPED }

    public KeyResult {
        Objects.requireNonNull(status, "status");
        if (status == Status.FAILED) Objects.requireNonNull(kind, "kind");
    }

    public static <R> KeyResult<R> succeeded(R value) {
        return new KeyResult<>(Status.SUCCEEDED, value, null, null);
    }

    public static <R> KeyResult<R> skipped(String reason) {
        return new KeyResult<>(Status.SKIPPED, null, null, reason);
    }

    public static <R> KeyResult<R> failed(FailureKind kind, String message) {
        return new KeyResult<>(Status.FAILED, null, kind, message);
    }

    public boolean isSucceeded() { return status == Status.SUCCEEDED; }
    public boolean isFailed() { return status == Status.FAILED; }
    public boolean isSkipped() { return status == Status.SKIPPED; }
}
