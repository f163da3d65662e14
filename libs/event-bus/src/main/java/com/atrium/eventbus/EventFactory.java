package com.atrium.eventbus;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for {@link AppEvent} envelopes.
 *
 * <p>Centralizes id generation and timestamps so publishers only supply the channel, source and
 * payload.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /** Creates an event with a fresh event id and a fresh correlation id. */
    public static <T> AppEvent<T> create(EventKey<T> key, String source, T payload) {
        return new AppEvent<>(
                UUID.randomUUID().toString(),
                key.name(),
                Instant.now(),
                source,
                UUID.randomUUID().toString(),
                payload);
    }

    /** Creates an event that joins an existing correlation. */
    public static <T> AppEvent<T> create(
            EventKey<T> key, String source, String correlationId, T payload) {
        return new AppEvent<>(
                UUID.randomUUID().toString(),
                key.name(),
                Instant.now(),
                source,
                correlationId,
                payload);
    }

    /**
     * Creates an event caused by {@code parent}. The child inherits the parent's correlation id so
     * that a whole cascade (sign-in, context switch, reloads) can be followed in the logs.
     */
    public static <T> AppEvent<T> createChild(
            AppEvent<?> parent, EventKey<T> key, String source, T payload) {
        return create(key, source, parent.correlationId(), payload);
    }
}
