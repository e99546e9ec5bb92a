package com.example.musiccollection.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single best-effort catalog request: either a value or the {@link FetchError}
 * that prevented it.
 */
public final class FetchResult<T> {

    private final T value;
    private final FetchError error;

    private FetchResult(T value, FetchError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FetchResult<T> failure(FetchError error) {
        return new FetchResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public FetchError getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchResult[success]" : "FetchResult[" + error.getReason() + "]";
    }
}
