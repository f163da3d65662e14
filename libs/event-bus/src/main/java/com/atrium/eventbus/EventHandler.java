package com.atrium.eventbus;

/** Callback invoked for every event delivered on a subscribed channel. */
@FunctionalInterface
public interface EventHandler<T> {

    void onEvent(AppEvent<T> event);
}
