package com.atrium.state.store;

import com.atrium.eventbus.Subscription;
import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextChange;
import com.atrium.state.context.ContextStore;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EntityStore} bound to the active context.
 *
 * <p>On construction the store subscribes to the {@link ContextStore} and maps every context to a
 * {@link ScopeKey}. When the key changes it issues exactly one load for the new key, superseding
 * any load still in flight. When the context leaves the store without a scope (no workspace open,
 * signed out) the cache is cleared synchronously. A change that leaves the key as it was does not
 * reload.
 */
public abstract class ScopedStore<E extends Entity> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScopedStore.class);

    protected final AppContext app;
    protected final ContextStore context;
    protected final EntityStore<E> entities;
    private final Subscription subscription;

    protected ScopedStore(AppContext app, ContextStore context, String name) {
        if (app == null) {
            throw new IllegalArgumentException("app must not be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        this.app = app;
        this.context = context;
        this.entities = app.newEntityStore(name);
        this.subscription = context.subscribe(this::onContextChanged);
    }

    /**
     * The slice this store holds for the given context, or null when the context leaves it
     * without one.
     */
    protected abstract ScopeKey scopeFor(ActiveContext active);

    /** Lists the entities of a scope from the repository. */
    protected abstract CompletableFuture<List<E>> fetch(ScopeKey key);

    public Optional<ScopeKey> scope() {
        return entities.scope();
    }

    public StoreStatus status() {
        return entities.status();
    }

    public Optional<StoreError> lastError() {
        return entities.lastError();
    }

    public void clearError() {
        entities.clearError();
    }

    public Optional<E> get(String id) {
        return entities.get(id);
    }

    public List<E> all() {
        return entities.all();
    }

    public int size() {
        return entities.size();
    }

    /** Loads the current scope again, keeping the cached entities until the result arrives. */
    public CompletableFuture<StoreResult<List<E>>> reload() {
        Optional<ScopeKey> key = entities.scope();
        if (key.isEmpty()) {
            return CompletableFuture.completedFuture(
                    StoreResult.failure(StoreError.validation(entities.name() + " has no active scope")));
        }
        return load(key.get());
    }

    /** Unsubscribes from the context store. The cache is left as it is. */
    @Override
    public void close() {
        subscription.close();
    }

    /**
     * Applies the context that was already active when the store was built. Subclasses call this
     * last in their constructor.
     */
    protected final void followCurrentContext() {
        context.current().ifPresent(this::follow);
    }

    protected CompletableFuture<StoreResult<List<E>>> load(ScopeKey key) {
        return entities.load(key, () -> fetch(key));
    }

    private void onContextChanged(ContextChange change) {
        if (change.current() == null) {
            clearIfScoped();
            return;
        }
        follow(change.current());
    }

    private void follow(ActiveContext active) {
        ScopeKey key = scopeFor(active);
        if (key == null) {
            clearIfScoped();
            return;
        }
        if (key.equals(entities.scope().orElse(null))) {
            return;
        }
        log.debug("{}: scope changed to {}", entities.name(), key);
        load(key);
    }

    private void clearIfScoped() {
        if (entities.scope().isPresent() || !entities.isEmpty()) {
            log.debug("{}: no scope, clearing", entities.name());
            entities.clear();
        }
    }
}
