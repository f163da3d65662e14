package com.atrium.state.store;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a store operation: a value, or a {@link StoreError}.
 *
 * <p>Store operations hand these back inside futures that always complete normally; repository
 * exceptions never escape a store.
 *
 * @param value the result (may be null for operations without a value, e.g. delete)
 * @param error the failure, or null on success
 */
public record StoreResult<T>(T value, StoreError error) {

    public static <T> StoreResult<T> success(T value) {
        return new StoreResult<>(value, null);
    }

    public static <T> StoreResult<T> failure(StoreError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new StoreResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /** True when this is a failure of the given kind. */
    public boolean failedWith(ErrorKind kind) {
        return error != null && error.kind() == kind;
    }

    public Optional<StoreError> errorOptional() {
        return Optional.ofNullable(error);
    }

    /**
     * The success value.
     *
     * @throws NoSuchElementException if this is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw new NoSuchElementException(error.kind() + ": " + error.message());
        }
        return value;
    }

    public <R> StoreResult<R> map(Function<? super T, ? extends R> mapper) {
        return error == null ? success(mapper.apply(value)) : failure(error);
    }
}
