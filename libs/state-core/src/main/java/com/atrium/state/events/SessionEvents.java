package com.atrium.state.events;

import com.atrium.eventbus.EventKey;
import com.atrium.state.context.ContextChange;
import com.atrium.state.context.Scope;
import com.atrium.state.identity.User;

/** Channels the session stores talk over. */
public final class SessionEvents {

    /** The authentication provider reports a signed-in user. */
    public static final EventKey<User> SESSION_SIGNED_IN = EventKey.of("session.signed-in", User.class);

    /** Payload is the id of the user who signed out. */
    public static final EventKey<String> SESSION_SIGNED_OUT = EventKey.of("session.signed-out", String.class);

    /** The account store picked an identity to act as. */
    public static final EventKey<Scope> ACCOUNT_SELECTED = EventKey.of("account.selected", Scope.class);

    /** Payload is the id of the deleted workspace. */
    public static final EventKey<String> WORKSPACE_REMOVED = EventKey.of("workspace.removed", String.class);

    public static final EventKey<ContextChange> CONTEXT_CHANGED =
            EventKey.of("context.changed", ContextChange.class);

    private SessionEvents() {
        // constants
    }
}
