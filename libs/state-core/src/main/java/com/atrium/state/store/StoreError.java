package com.atrium.state.store;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * A failed store operation.
 *
 * @param kind    failure category
 * @param message human-readable reason
 * @param cause   underlying repository failure (only for {@link ErrorKind#TRANSPORT}, else null)
 */
public record StoreError(ErrorKind kind, String message, Throwable cause) {

    public StoreError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
    }

    public static StoreError validation(String message) {
        return new StoreError(ErrorKind.VALIDATION, message, null);
    }

    public static StoreError permissionDenied(String message) {
        return new StoreError(ErrorKind.PERMISSION_DENIED, message, null);
    }

    public static StoreError notFound(String id) {
        return new StoreError(ErrorKind.NOT_FOUND, "No entity with id " + id, null);
    }

    public static StoreError conflict(String id) {
        return new StoreError(ErrorKind.CONFLICT, "Mutation in progress for " + id, null);
    }

    public static StoreError cancelled(String message) {
        return new StoreError(ErrorKind.CANCELLED, message, null);
    }

    /** Wraps a repository failure, unwrapping the future's completion wrappers. */
    public static StoreError transport(Throwable failure) {
        Throwable cause = unwrap(failure);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StoreError(ErrorKind.TRANSPORT, message, cause);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static boolean isCancellation(Throwable failure) {
        return unwrap(failure) instanceof CancellationException;
    }
}
