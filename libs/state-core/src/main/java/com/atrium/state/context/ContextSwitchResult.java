package com.atrium.state.context;

/**
 * Result of a switch request.
 *
 * @param context the context after the request (unchanged unless SWITCHED; null when uninitialized)
 */
public record ContextSwitchResult(SwitchOutcome outcome, ActiveContext context) {

    public boolean switched() {
        return outcome == SwitchOutcome.SWITCHED;
    }
}
