package com.atrium.eventbus;

import java.time.Instant;

/**
 * Envelope for every event delivered by the {@link EventBus}.
 *
 * <p>Immutable. The envelope carries identification and correlation metadata next to the
 * channel-specific payload.
 *
 * @param eventId unique identifier of this event instance (UUID)
 * @param name channel name, equal to {@link EventKey#name()}
 * @param occurredAt when the event was created
 * @param source component that published the event (e.g. "context-store")
 * @param correlationId identifier linking events caused by the same user intent
 * @param payload channel-specific data
 * @param <T> payload type
 */
public record AppEvent<T>(
        String eventId,
        String name,
        Instant occurredAt,
        String source,
        String correlationId,
        T payload) {}
