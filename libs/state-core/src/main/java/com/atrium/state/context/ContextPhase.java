package com.atrium.state.context;

/** States of the context store's lifecycle. */
public enum ContextPhase {
    UNINITIALIZED,
    IDENTITY_ACTIVE,
    WORKSPACE_ACTIVE
}
