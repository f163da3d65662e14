package com.atrium.state.context;

public enum SwitchOutcome {

    SWITCHED,

    /** Target equals the current context; nothing emitted. */
    ALREADY_ACTIVE,

    /** No authenticated principal to act for. */
    NO_PRINCIPAL,

    /** A workspace switch was requested with no identity scope active. */
    NO_IDENTITY
}
