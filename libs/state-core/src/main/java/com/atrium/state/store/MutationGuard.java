package com.atrium.state.store;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Pre-dispatch check run before a mutation touches the cache.
 *
 * <p>Guards chain with {@link #then(MutationGuard)}; the first failure wins, so validation guards
 * go before permission guards.
 */
@FunctionalInterface
public interface MutationGuard {

    /** Empty when the mutation may proceed. */
    Optional<StoreError> check();

    default MutationGuard then(MutationGuard next) {
        return () -> {
            Optional<StoreError> failure = check();
            return failure.isPresent() ? failure : next.check();
        };
    }

    static MutationGuard allowAll() {
        return Optional::empty;
    }

    /** A validation guard failing with the message when the condition is false. */
    static MutationGuard require(BooleanSupplier condition, String message) {
        return () -> condition.getAsBoolean()
                ? Optional.empty()
                : Optional.of(StoreError.validation(message));
    }
}
