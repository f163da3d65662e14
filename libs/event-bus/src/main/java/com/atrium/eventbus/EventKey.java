package com.atrium.eventbus;

import java.util.Objects;

/**
 * Typed name of an event channel.
 *
 * <p>The payload type travels with the name so that publishers and subscribers of the same channel
 * agree on the payload at compile time. Two keys are the same channel when their names are equal.
 *
 * @param name canonical channel name (e.g. "context.changed")
 * @param payloadType class of the payload carried on this channel
 * @param <T> payload type
 */
public record EventKey<T>(String name, Class<T> payloadType) {

    public EventKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        Objects.requireNonNull(payloadType, "payloadType must not be null");
    }

    /** Shorthand for {@code new EventKey<>(name, payloadType)}. */
    public static <T> EventKey<T> of(String name, Class<T> payloadType) {
        return new EventKey<>(name, payloadType);
    }
}
