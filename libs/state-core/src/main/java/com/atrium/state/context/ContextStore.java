package com.atrium.state.context;

import com.atrium.eventbus.EventBus;
import com.atrium.eventbus.Subscription;
import com.atrium.observability.ScopeLogContext;
import com.atrium.observability.ScopeLogContextHolder;
import com.atrium.state.app.AppContext;
import com.atrium.state.events.SessionEvents;
import com.atrium.state.identity.User;
import com.atrium.state.port.AuthProvider;
import com.atrium.state.scheduler.StoreScheduler;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single owner of the active context: who is signed in, which identity they act as, and which
 * workspace is open.
 *
 * <p>State machine: UNINITIALIZED, then IDENTITY_ACTIVE(scope), optionally with a workspace. The
 * context changes only through the switch operations here, each of which replaces it in one step
 * and then notifies listeners synchronously, in registration order. Scope stores react by clearing
 * or reloading their caches.
 *
 * <p>Also listens on the event bus: sign-in opens the user's personal scope, sign-out tears the
 * context down, {@code account.selected} switches identity, and {@code workspace.removed}
 * deselects a workspace that no longer exists. Those handlers run on the {@link StoreScheduler}.
 */
public final class ContextStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);
    private static final String SOURCE = "context-store";

    private final EventBus bus;
    private final AuthProvider authProvider;
    private final Clock clock;
    private final int historyLimit;
    private final List<ListenerRegistration> listeners = new CopyOnWriteArrayList<>();
    private final Deque<ActiveContext> history = new ArrayDeque<>();
    private final List<Subscription> busSubscriptions = new ArrayList<>();

    private ActiveContext current;
    private long sequence;

    public ContextStore(AppContext app) {
        this.bus = app.bus();
        this.authProvider = app.authProvider();
        this.clock = app.clock();
        this.historyLimit = app.historyLimit();

        // bus events may be published off the store thread
        StoreScheduler scheduler = app.scheduler();
        busSubscriptions.add(bus.subscribe(SessionEvents.SESSION_SIGNED_IN,
                event -> scheduler.execute(() -> onSignedIn(event.payload()))));
        busSubscriptions.add(bus.subscribe(SessionEvents.SESSION_SIGNED_OUT,
                event -> scheduler.execute(this::teardown)));
        busSubscriptions.add(bus.subscribe(SessionEvents.ACCOUNT_SELECTED,
                event -> scheduler.execute(() -> switchContext(event.payload()))));
        busSubscriptions.add(bus.subscribe(SessionEvents.WORKSPACE_REMOVED,
                event -> scheduler.execute(() -> onWorkspaceRemoved(event.payload()))));
    }

    // ---------------------------------------------------------------- reads

    public Optional<ActiveContext> current() {
        return Optional.ofNullable(current);
    }

    public ContextPhase phase() {
        return current == null ? ContextPhase.UNINITIALIZED : current.phase();
    }

    public Optional<ScopeType> currentScopeType() {
        return current().map(context -> context.scope().type());
    }

    public Optional<String> currentScopeId() {
        return current().map(context -> context.scope().id());
    }

    public Optional<String> currentWorkspaceId() {
        return current().map(ActiveContext::workspaceId);
    }

    public boolean hasWorkspace() {
        return current != null && current.hasWorkspace();
    }

    /** Previous contexts of this session, most recent first. */
    public List<ActiveContext> history() {
        return List.copyOf(history);
    }

    // ---------------------------------------------------------------- switching

    /**
     * Acts as the given identity. Switching to the scope already active is a no-op even when a
     * workspace is open; a new scope starts without a workspace.
     */
    public ContextSwitchResult switchContext(Scope target) {
        return switchTo(null, target, null, false);
    }

    /**
     * Acts as the given identity with the given workspace open. When the scope is already active
     * this only changes the workspace; a null workspace deselects it.
     */
    public ContextSwitchResult switchContext(Scope target, String workspaceId) {
        return switchTo(null, target, workspaceId, true);
    }

    /**
     * Opens a workspace within the active identity; null closes the open one.
     */
    public ContextSwitchResult switchWorkspace(String workspaceId) {
        if (current == null) {
            return new ContextSwitchResult(SwitchOutcome.NO_IDENTITY, null);
        }
        if (Objects.equals(current.workspaceId(), workspaceId)) {
            return new ContextSwitchResult(SwitchOutcome.ALREADY_ACTIVE, current);
        }
        return apply(current.withWorkspace(workspaceId), ChangeKind.WORKSPACE);
    }

    /** Sign-out: back to UNINITIALIZED, history forgotten. */
    public void teardown() {
        if (current == null) {
            return;
        }
        ActiveContext previous = current;
        current = null;
        history.clear();
        ScopeLogContextHolder.clear();
        log.info("Context torn down for principal {}", previous.principalId());
        emit(new ContextChange(previous, null, ChangeKind.TEARDOWN, ++sequence));
    }

    // ---------------------------------------------------------------- snapshots

    /** The active context in persistable form. */
    public Optional<ContextSnapshot> snapshot() {
        return current().map(context -> ContextSnapshot.of(context, clock.instant()));
    }

    /**
     * Reopens a saved context. Only the principal who saved it can restore it.
     */
    public ContextSwitchResult restore(ContextSnapshot snapshot) {
        Optional<String> principal = resolvePrincipal(null);
        if (principal.isEmpty() || !principal.get().equals(snapshot.principalId())) {
            log.warn("Not restoring context saved for another principal");
            return new ContextSwitchResult(SwitchOutcome.NO_PRINCIPAL, current);
        }
        return switchTo(null, snapshot.scope(), snapshot.workspaceId(), true);
    }

    // ---------------------------------------------------------------- listeners

    /**
     * Registers a listener for every future change. Listeners run synchronously on the store
     * thread; one that throws is logged and the others still run.
     */
    public Subscription subscribe(ContextListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        ListenerRegistration registration = new ListenerRegistration(listener);
        listeners.add(registration);
        return registration;
    }

    @Override
    public void close() {
        busSubscriptions.forEach(Subscription::close);
        busSubscriptions.clear();
        listeners.forEach(ListenerRegistration::close);
    }

    // ---------------------------------------------------------------- internals

    private ContextSwitchResult switchTo(String principalHint, Scope target, String workspaceId,
                                         boolean workspaceGiven) {
        if (target == null) {
            throw new IllegalArgumentException("target scope must not be null");
        }
        Optional<String> principal = resolvePrincipal(principalHint);
        if (principal.isEmpty()) {
            log.warn("Ignoring switch to {} {}: nobody is signed in", target.type().value(), target.id());
            return new ContextSwitchResult(SwitchOutcome.NO_PRINCIPAL, current);
        }

        boolean sameIdentity = current != null
                && current.principalId().equals(principal.get())
                && current.scope().sameAs(target);
        if (sameIdentity) {
            if (!workspaceGiven || Objects.equals(current.workspaceId(), workspaceId)) {
                return new ContextSwitchResult(SwitchOutcome.ALREADY_ACTIVE, current);
            }
            return apply(current.withWorkspace(workspaceId), ChangeKind.WORKSPACE);
        }
        return apply(new ActiveContext(principal.get(), target, workspaceGiven ? workspaceId : null),
                ChangeKind.IDENTITY);
    }

    private ContextSwitchResult apply(ActiveContext next, ChangeKind kind) {
        ActiveContext previous = current;
        current = next;
        if (previous != null && kind == ChangeKind.IDENTITY) {
            history.addFirst(previous);
            while (history.size() > historyLimit) {
                history.removeLast();
            }
        }

        ScopeLogContextHolder.set(new ScopeLogContext(UUID.randomUUID().toString(), next.principalId(),
                next.scope().type().value(), next.scope().id(), next.workspaceId()));
        if (kind == ChangeKind.IDENTITY) {
            log.info("Switched to {} {}{}", next.scope().type().value(), next.scope().id(),
                    next.hasWorkspace() ? " in workspace " + next.workspaceId() : "");
        } else {
            log.info("Workspace {} selected", next.workspaceId() == null ? "none" : next.workspaceId());
        }

        emit(new ContextChange(previous, next, kind, ++sequence));
        return new ContextSwitchResult(SwitchOutcome.SWITCHED, next);
    }

    private void emit(ContextChange change) {
        for (ListenerRegistration registration : listeners) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                registration.listener.onContextChanged(change);
            } catch (RuntimeException e) {
                log.error("Context listener failed on change #{}", change.sequence(), e);
            }
        }
        bus.publish(SessionEvents.CONTEXT_CHANGED, SOURCE, change);
    }

    private Optional<String> resolvePrincipal(String principalHint) {
        if (principalHint != null) {
            return Optional.of(principalHint);
        }
        if (current != null) {
            return Optional.of(current.principalId());
        }
        return authProvider.currentIdentity().map(User::id);
    }

    private void onSignedIn(User user) {
        if (current != null && !current.principalId().equals(user.id())) {
            teardown();
        }
        switchTo(user.id(), new UserScope(user.id()), null, false);
    }

    private void onWorkspaceRemoved(String workspaceId) {
        if (current != null && workspaceId.equals(current.workspaceId())) {
            log.info("Open workspace {} was removed, deselecting it", workspaceId);
            switchWorkspace(null);
        }
    }

    private final class ListenerRegistration implements Subscription {

        private final ContextListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private ListenerRegistration(ContextListener listener) {
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                listeners.remove(this);
            }
        }
    }
}
