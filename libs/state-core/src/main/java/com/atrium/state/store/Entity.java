package com.atrium.state.store;

/** Anything an {@link EntityStore} can cache: a value with a stable string id. */
public interface Entity {

    String id();
}
