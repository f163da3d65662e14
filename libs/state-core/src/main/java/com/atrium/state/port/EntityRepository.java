package com.atrium.state.port;

import com.atrium.state.store.Entity;
import com.atrium.state.store.ScopeKey;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Remote persistence for one aggregate.
 *
 * <p>Every call is asynchronous and may fail with a transient or permanent error; stores treat
 * both the same way. Retrying is the implementation's business.
 *
 * @param <E> entity type
 * @param <D> creation data; the server assigns id and timestamps
 * @param <P> partial update
 */
public interface EntityRepository<E extends Entity, D, P> {

    /** Completes with empty when no entity has the id. */
    CompletableFuture<Optional<E>> getById(String id);

    CompletableFuture<List<E>> listByScope(ScopeKey scope);

    CompletableFuture<E> create(D data);

    CompletableFuture<Void> update(String id, P patch);

    CompletableFuture<Void> delete(String id);
}
