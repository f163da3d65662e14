package com.atrium.state.context;

/**
 * One transition of the context store.
 *
 * @param previous context before the change (null when coming from UNINITIALIZED)
 * @param current  context after the change (null after TEARDOWN)
 * @param sequence strictly increasing per store
 */
public record ContextChange(ActiveContext previous, ActiveContext current, ChangeKind kind, long sequence) {

    public ContextChange {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }
}
