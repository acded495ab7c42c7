package com.healthauth.core.domain;

import java.util.Objects;

/**
 * Outcome of an authority operation: either a value or a typed rejection.
 *
 * @param <T> value type of a successful outcome
 */
public record LedgerResult<T>(
        boolean success,
        T value,
        LedgerErrorKind error,
        String message
) {
    public LedgerResult {
        if (success && error != null) {
            throw new IllegalArgumentException("Successful result cannot carry an error");
        }
        if (!success) {
            Objects.requireNonNull(error, "Failed result must carry an error kind");
        }
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(true, value, null, null);
    }

    public static LedgerResult<Void> ok() {
        return new LedgerResult<>(true, null, null, null);
    }

    public static <T> LedgerResult<T> failure(LedgerErrorKind error, String message) {
        return new LedgerResult<>(false, null, error, message);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Returns the value of a successful result.
     *
     * @throws IllegalStateException if the operation was rejected
     */
    public T getOrThrow() {
        if (!success) {
            throw new IllegalStateException("Operation rejected with " + error + ": " + message);
        }
        return value;
    }
}
