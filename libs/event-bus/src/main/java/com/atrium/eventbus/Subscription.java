package com.atrium.eventbus;

/**
 * Handle returned by a subscribe call. Closing it unregisters the handler; closing twice is a
 * no-op.
 */
public interface Subscription extends AutoCloseable {

    /** Whether the handler is still registered. */
    boolean isActive();

    @Override
    void close();
}
