package com.atrium.state.port;

import com.atrium.eventbus.Subscription;
import com.atrium.state.identity.User;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The authentication system, seen only through the two things the stores need.
 */
public interface AuthProvider {

    /** The signed-in user, or empty when signed out. */
    Optional<User> currentIdentity();

    /**
     * Registers a listener called with the new identity (empty on sign-out) whenever it changes.
     */
    Subscription onIdentityChanged(Consumer<Optional<User>> listener);
}
