package com.atrium.eventbus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process publish/subscribe channel keyed by event name.
 *
 * <p>Stores use the bus only where a direct reference would create a dependency cycle (the account
 * store selecting a context, the workspace store announcing a removal). Delivery rules:
 *
 * <ul>
 *   <li>synchronous fan-out to the subscribers registered when the event is dispatched
 *   <li>at-most-once, no persistence, no replay for late subscribers
 *   <li>events of one name are delivered in publish order; a publish issued from inside a handler
 *       is queued and delivered once the current event has reached every subscriber
 *   <li>a failing handler is logged and skipped; the remaining handlers still receive the event
 * </ul>
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Registration<?>>> handlers = new ConcurrentHashMap<>();
    private final ThreadLocal<Deque<Runnable>> pending = new ThreadLocal<>();

    /**
     * Registers a handler on a channel.
     *
     * @return a subscription that unregisters the handler when closed
     */
    public <T> Subscription subscribe(EventKey<T> key, EventHandler<T> handler) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        Registration<T> registration = new Registration<>(key, handler);
        handlers.computeIfAbsent(key.name(), name -> new CopyOnWriteArrayList<>()).add(registration);
        return registration;
    }

    /**
     * Wraps the payload in a new envelope and delivers it.
     *
     * @return the envelope that was delivered
     */
    public <T> AppEvent<T> publish(EventKey<T> key, String source, T payload) {
        AppEvent<T> event = EventFactory.create(key, source, payload);
        publish(key, event);
        return event;
    }

    /**
     * Delivers a prepared envelope.
     *
     * @throws IllegalArgumentException if the envelope does not pass {@link EventValidator}
     */
    public <T> void publish(EventKey<T> key, AppEvent<T> event) {
        ValidationResult validation = EventValidator.validate(key, event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid event: " + validation.errors());
        }

        Deque<Runnable> queue = pending.get();
        if (queue != null) {
            // already dispatching on this thread
            queue.add(() -> dispatch(key, event));
            return;
        }

        queue = new ArrayDeque<>();
        pending.set(queue);
        try {
            dispatch(key, event);
            Runnable next;
            while ((next = queue.poll()) != null) {
                next.run();
            }
        } finally {
            pending.remove();
        }
    }

    /** Number of handlers currently registered on the channel. */
    public int subscriberCount(EventKey<?> key) {
        List<Registration<?>> registered = handlers.get(key.name());
        return registered == null ? 0 : registered.size();
    }

    /** Unregisters every handler on every channel. */
    public void clear() {
        handlers.values().forEach(list -> list.forEach(Registration::deactivate));
        handlers.clear();
    }

    private <T> void dispatch(EventKey<T> key, AppEvent<T> event) {
        List<Registration<?>> registered = handlers.get(key.name());
        if (registered == null || registered.isEmpty()) {
            log.trace("No subscribers for {}", key.name());
            return;
        }
        for (Registration<?> registration : registered) {
            deliver(registration, event);
        }
    }

    private <T> void deliver(Registration<T> registration, AppEvent<?> event) {
        if (!registration.isActive()) {
            return;
        }
        Object payload = event.payload();
        if (!registration.key.payloadType().isInstance(payload)) {
            log.warn("Skipping subscriber on {}: expects {}, got {}",
                    event.name(), registration.key.payloadType().getSimpleName(),
                    payload.getClass().getSimpleName());
            return;
        }
        AppEvent<T> typed = new AppEvent<>(event.eventId(), event.name(), event.occurredAt(), event.source(),
                event.correlationId(), registration.key.payloadType().cast(payload));
        try {
            registration.handler.onEvent(typed);
        } catch (RuntimeException e) {
            log.error("Subscriber on {} failed for event {}", event.name(), event.eventId(), e);
        }
    }

    private final class Registration<T> implements Subscription {

        private final EventKey<T> key;
        private final EventHandler<T> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(EventKey<T> key, EventHandler<T> handler) {
            this.key = key;
            this.handler = handler;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                List<Registration<?>> registered = handlers.get(key.name());
                if (registered != null) {
                    registered.remove(this);
                }
            }
        }

        private void deactivate() {
            active.set(false);
        }
    }
}
