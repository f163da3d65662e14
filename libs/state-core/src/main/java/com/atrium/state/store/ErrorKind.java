package com.atrium.state.store;

/** Why a store operation did not succeed. */
public enum ErrorKind {

    /** Malformed request; never sent to a repository. */
    VALIDATION,

    /** Capability check failed before dispatch. */
    PERMISSION_DENIED,

    NOT_FOUND,

    /** Another mutation on the same id is still in flight. */
    CONFLICT,

    /** The repository call failed. */
    TRANSPORT,

    /** A load was superseded by a newer scope, or the store was cleared. */
    CANCELLED
}
