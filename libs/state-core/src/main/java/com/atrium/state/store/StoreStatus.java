package com.atrium.state.store;

/** What a store is doing right now. ERROR sticks until {@link EntityStore#clearError()}. */
public enum StoreStatus {
    IDLE,
    LOADING,
    PERSISTING,
    ERROR
}
