package com.atrium.state.session;

import com.atrium.eventbus.EventBus;
import com.atrium.eventbus.Subscription;
import com.atrium.state.events.SessionEvents;
import com.atrium.state.identity.User;
import com.atrium.state.port.AuthProvider;
import com.atrium.state.scheduler.StoreScheduler;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards authentication changes onto the event bus as sign-in and sign-out events.
 *
 * <p>The auth provider may call back on any thread; events are published from the
 * {@link StoreScheduler} so the stores reacting to them stay on their own thread.
 */
public final class SessionBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionBridge.class);
    private static final String SOURCE = "session-bridge";

    private final EventBus bus;
    private final StoreScheduler scheduler;
    private final Subscription subscription;
    private String signedInUserId;

    public SessionBridge(AuthProvider authProvider, EventBus bus, StoreScheduler scheduler) {
        if (authProvider == null) {
            throw new IllegalArgumentException("authProvider must not be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus must not be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler must not be null");
        }
        this.bus = bus;
        this.scheduler = scheduler;
        this.subscription = authProvider.onIdentityChanged(
                identity -> scheduler.execute(() -> onIdentityChanged(identity)));
    }

    /** Announces the identity already signed in when the bridge was created. */
    public void announceCurrent(AuthProvider authProvider) {
        Optional<User> identity = authProvider.currentIdentity();
        scheduler.execute(() -> onIdentityChanged(identity));
    }

    private void onIdentityChanged(Optional<User> identity) {
        if (identity.isPresent()) {
            User user = identity.get();
            if (user.id().equals(signedInUserId)) {
                return;
            }
            if (signedInUserId != null) {
                signOut();
            }
            signedInUserId = user.id();
            log.info("Principal {} signed in", user.id());
            bus.publish(SessionEvents.SESSION_SIGNED_IN, SOURCE, user);
        } else if (signedInUserId != null) {
            signOut();
        }
    }

    private void signOut() {
        String userId = signedInUserId;
        signedInUserId = null;
        log.info("Principal {} signed out", userId);
        bus.publish(SessionEvents.SESSION_SIGNED_OUT, SOURCE, userId);
    }

    @Override
    public void close() {
        subscription.close();
    }
}
