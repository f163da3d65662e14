package com.atrium.state.context;

public enum ChangeKind {

    /** The acting identity (or principal) changed; the workspace selection was reset or replaced. */
    IDENTITY,

    /** Only the workspace selection changed. */
    WORKSPACE,

    /** Sign-out; the context is uninitialized again. */
    TEARDOWN
}
