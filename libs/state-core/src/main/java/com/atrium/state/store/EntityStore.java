package com.atrium.state.store;

import com.atrium.state.scheduler.StoreScheduler;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalized cache of one entity type with optimistic mutations.
 *
 * <p>The cache maps id to entity; filtered and sorted views are computed on read. Every mutation
 * runs the same pipeline:
 *
 * <ol>
 *   <li>the {@link MutationGuard} (validation, then permission) runs; a failure returns without
 *       touching the cache or the repository
 *   <li>the per-id in-flight check applies the {@link MutationConcurrency} policy
 *   <li>the change is applied to the cache and the repository call is issued
 *   <li>on success the optimistic value stays (a created entity replaces its provisional copy);
 *       on failure the pre-mutation snapshot, index memberships included, is restored and the
 *       {@link ErrorKind#TRANSPORT} error is kept until {@link #clearError()}
 * </ol>
 *
 * <p>Only one load is active at a time. A newer {@link #load} or {@link #clear()} supersedes the
 * previous one; its completion is discarded and its result reports {@link ErrorKind#CANCELLED}.
 *
 * <p>Not thread-safe: every method must run on the {@link StoreScheduler} thread. Repository
 * continuations are resumed there.
 */
public final class EntityStore<E extends Entity> {

    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    static final String PROVISIONAL_PREFIX = "tmp-";

    private final String name;
    private final StoreScheduler scheduler;
    private final MutationConcurrency concurrency;
    private final StoreMetrics metrics;

    private final Map<String, E> entities = new LinkedHashMap<>();
    private final Map<String, StoreIndex> indexes = new LinkedHashMap<>();
    private final Map<String, Deque<QueuedMutation>> inFlight = new HashMap<>();

    private ScopeKey scope;
    private PendingLoad<E> pendingLoad;
    private long loadGeneration;
    private long epoch;
    private StoreError lastError;
    private boolean errorFromLoad;

    public EntityStore(
            String name, StoreScheduler scheduler, MutationConcurrency concurrency, StoreMetrics metrics) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler must not be null");
        }
        if (concurrency == null) {
            throw new IllegalArgumentException("concurrency must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.name = name;
        this.scheduler = scheduler;
        this.concurrency = concurrency;
        this.metrics = metrics;
    }

    // ---------------------------------------------------------------- reads

    public String name() {
        return name;
    }

    public Optional<E> get(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public boolean contains(String id) {
        return entities.containsKey(id);
    }

    /** Snapshot of every cached entity. */
    public List<E> all() {
        return List.copyOf(entities.values());
    }

    public List<E> filter(Predicate<? super E> predicate) {
        List<E> matches = new ArrayList<>();
        for (E entity : entities.values()) {
            if (predicate.test(entity)) {
                matches.add(entity);
            }
        }
        return matches;
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /** The scope of the last load, or empty after {@link #clear()}. */
    public Optional<ScopeKey> scope() {
        return Optional.ofNullable(scope);
    }

    public StoreStatus status() {
        if (lastError != null) {
            return StoreStatus.ERROR;
        }
        if (pendingLoad != null) {
            return StoreStatus.LOADING;
        }
        if (!inFlight.isEmpty()) {
            return StoreStatus.PERSISTING;
        }
        return StoreStatus.IDLE;
    }

    public boolean isLoading() {
        return pendingLoad != null;
    }

    public boolean isPersisting() {
        return !inFlight.isEmpty();
    }

    /** True while a mutation on this id has not resolved. */
    public boolean isPersisting(String id) {
        return inFlight.containsKey(id);
    }

    public Optional<StoreError> lastError() {
        return Optional.ofNullable(lastError);
    }

    public void clearError() {
        lastError = null;
        errorFromLoad = false;
    }

    public static boolean isProvisional(String id) {
        return id != null && id.startsWith(PROVISIONAL_PREFIX);
    }

    // ---------------------------------------------------------------- indexes

    /** Returns the named index, creating it on first use. */
    public StoreIndex index(String indexName) {
        return indexes.computeIfAbsent(indexName, StoreIndex::new);
    }

    /**
     * Adds a cached entity's id to an index.
     *
     * @return false when the entity is not cached or already indexed
     */
    public boolean addToIndex(String indexName, String id) {
        return entities.containsKey(id) && index(indexName).add(id);
    }

    public boolean removeFromIndex(String indexName, String id) {
        return index(indexName).remove(id);
    }

    /** The cached entities whose ids are in the index, in index order. */
    public List<E> indexed(String indexName) {
        List<E> result = new ArrayList<>();
        for (String id : index(indexName).ids()) {
            E entity = entities.get(id);
            if (entity != null) {
                result.add(entity);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- loading

    /**
     * Loads the scope's entities, superseding any load still in flight.
     *
     * <p>A key different from the current scope empties the cache first, so entities of the old
     * scope are never visible under the new one. On success the cache is replaced, except for
     * entities with an unresolved mutation, which keep their local value. On failure the cache is
     * left as it was.
     */
    public CompletableFuture<StoreResult<List<E>>> load(
            ScopeKey key, Supplier<CompletableFuture<List<E>>> call) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        cancelPendingLoad("superseded by load of " + key);
        if (!key.equals(scope)) {
            resetCache();
        }
        scope = key;
        long generation = ++loadGeneration;
        long startNanos = System.nanoTime();

        CompletableFuture<StoreResult<List<E>>> result = new CompletableFuture<>();
        CompletableFuture<List<E>> request = invoke(call);
        pendingLoad = new PendingLoad<>(generation, request, result);
        metrics.loadIssued();
        log.debug("{}: loading {}", name, key);

        request.whenCompleteAsync(
                (loaded, failure) -> onLoaded(generation, key, startNanos, loaded, failure), scheduler);
        return result;
    }

    /**
     * Fetches one entity and reconciles it into the cache.
     *
     * <p>An absent entity is dropped from the cache and reported as {@link ErrorKind#NOT_FOUND}. An
     * entity with an unresolved mutation keeps its local value.
     */
    public CompletableFuture<StoreResult<E>> refresh(
            String id, Supplier<CompletableFuture<Optional<E>>> call) {
        long issuedEpoch = epoch;
        return invoke(call).handleAsync((found, failure) -> {
            if (issuedEpoch != epoch) {
                return StoreResult.<E>failure(StoreError.cancelled("store cleared during refresh of " + id));
            }
            if (failure != null) {
                StoreError error = StoreError.transport(failure);
                log.warn("{}: refresh of {} failed: {}", name, id, error.message());
                return StoreResult.<E>failure(error);
            }
            if (found == null || found.isEmpty()) {
                if (!inFlight.containsKey(id)) {
                    removeEverywhere(id);
                }
                return StoreResult.<E>failure(StoreError.notFound(id));
            }
            if (!inFlight.containsKey(id)) {
                entities.put(id, found.get());
            }
            return StoreResult.success(entities.getOrDefault(id, found.get()));
        }, scheduler);
    }

    /**
     * Empties the cache synchronously and forgets the scope.
     *
     * <p>The in-flight load is cancelled and mutations still in flight will resolve without touching
     * the cache; queued mutations are cancelled.
     */
    public void clear() {
        cancelPendingLoad("store cleared");
        loadGeneration++;
        resetCache();
        scope = null;
        clearError();
    }

    // ---------------------------------------------------------------- mutations

    /**
     * Optimistically adds an entity under a provisional id, then replaces it with the repository's
     * entity (carrying the server id and timestamps).
     *
     * @param provisional builds the local entity from the provisional id
     */
    public CompletableFuture<StoreResult<E>> create(
            MutationGuard guard, Function<String, E> provisional, Supplier<CompletableFuture<E>> call) {
        Optional<StoreError> rejected = runGuard(guard, "create");
        if (rejected.isPresent()) {
            return completed(StoreResult.failure(rejected.get()));
        }
        String tempId = PROVISIONAL_PREFIX + UUID.randomUUID();
        E local = provisional.apply(tempId);
        if (local == null || !tempId.equals(local.id())) {
            throw new IllegalArgumentException("provisional entity must carry the provisional id " + tempId);
        }
        entities.put(tempId, local);
        inFlight.put(tempId, new ArrayDeque<>());
        metrics.mutationDispatched();
        long issuedEpoch = epoch;

        return invoke(call).handleAsync((created, failure) -> {
            if (issuedEpoch != epoch) {
                return outcomeOutsideScope(created, failure);
            }
            entities.remove(tempId);
            List<StoreIndex> memberOf = removeFromIndexes(tempId);
            StoreResult<E> outcome;
            if (failure == null && created != null) {
                entities.put(created.id(), created);
                memberOf.forEach(index -> index.add(created.id()));
                log.debug("{}: created {} (provisional {})", name, created.id(), tempId);
                outcome = StoreResult.success(created);
            } else {
                Throwable cause = failure != null
                        ? failure
                        : new IllegalStateException("repository returned no entity");
                outcome = StoreResult.failure(rollback("create", tempId, cause));
            }
            finish(tempId);
            return outcome;
        }, scheduler);
    }

    /**
     * Optimistically replaces a cached entity with {@code change.apply(current)}.
     */
    public CompletableFuture<StoreResult<E>> update(
            MutationGuard guard, String id, UnaryOperator<E> change, Supplier<CompletableFuture<Void>> call) {
        return updateWithValue(guard, id, change, updated -> call.get());
    }

    /**
     * Like {@link #update}, but the repository call is built from the value the change produced.
     * A queued mutation sees the entity as it is when it starts, after any earlier rollback.
     */
    public CompletableFuture<StoreResult<E>> updateWithValue(
            MutationGuard guard, String id, UnaryOperator<E> change, Function<E, CompletableFuture<Void>> call) {
        return submit(guard, "update", id, () -> startUpdate(id, change, call));
    }

    /** Optimistically removes an entity and its index memberships. */
    public CompletableFuture<StoreResult<Void>> delete(
            MutationGuard guard, String id, Supplier<CompletableFuture<Void>> call) {
        return submit(guard, "delete", id, () -> startDelete(id, call));
    }

    /**
     * Replaces a cached entity without a repository round trip.
     *
     * @return false when the id is not cached
     */
    public boolean replaceLocal(String id, UnaryOperator<E> change) {
        E current = entities.get(id);
        if (current == null) {
            return false;
        }
        E changed = change.apply(current);
        if (changed == null || !id.equals(changed.id())) {
            throw new IllegalArgumentException("local change must keep the entity id " + id);
        }
        entities.put(id, changed);
        return true;
    }

    private <R> CompletableFuture<StoreResult<R>> submit(
            MutationGuard guard, String operation, String id,
            Supplier<CompletableFuture<StoreResult<R>>> start) {
        if (id == null || id.isBlank()) {
            return completed(StoreResult.failure(StoreError.validation("id must not be blank")));
        }
        Optional<StoreError> rejected = runGuard(guard, operation + " " + id);
        if (rejected.isPresent()) {
            return completed(StoreResult.failure(rejected.get()));
        }

        Deque<QueuedMutation> queue = inFlight.get(id);
        if (queue != null) {
            if (concurrency == MutationConcurrency.REJECT) {
                metrics.conflict();
                log.debug("{}: rejecting {} of {}, previous mutation still in flight", name, operation, id);
                return completed(StoreResult.failure(StoreError.conflict(id)));
            }
            CompletableFuture<StoreResult<R>> result = new CompletableFuture<>();
            queue.add(new QueuedMutation(
                    () -> start.get().whenComplete((outcome, failure) -> result.complete(
                            failure == null ? outcome : StoreResult.failure(StoreError.transport(failure)))),
                    () -> result.complete(StoreResult.failure(
                            StoreError.cancelled("store cleared before queued " + operation + " of " + id)))));
            log.debug("{}: queued {} of {} behind in-flight mutation", name, operation, id);
            return result;
        }

        if (!entities.containsKey(id)) {
            return completed(StoreResult.failure(StoreError.notFound(id)));
        }
        inFlight.put(id, new ArrayDeque<>());
        return start.get();
    }

    private CompletableFuture<StoreResult<E>> startUpdate(
            String id, UnaryOperator<E> change, Function<E, CompletableFuture<Void>> call) {
        E snapshot = entities.get(id);
        if (snapshot == null) {
            finish(id);
            return completed(StoreResult.failure(StoreError.notFound(id)));
        }
        E updated = change.apply(snapshot);
        if (updated == null || !id.equals(updated.id())) {
            finish(id);
            return completed(StoreResult.failure(StoreError.validation("update must keep the entity id " + id)));
        }
        entities.put(id, updated);
        metrics.mutationDispatched();
        long issuedEpoch = epoch;

        return invoke(() -> call.apply(updated)).handleAsync((ignored, failure) -> {
            if (issuedEpoch != epoch) {
                return outcomeOutsideScope(updated, failure);
            }
            StoreResult<E> outcome;
            if (failure == null) {
                outcome = StoreResult.success(entities.getOrDefault(id, updated));
            } else {
                entities.put(id, snapshot);
                outcome = StoreResult.failure(rollback("update", id, failure));
            }
            finish(id);
            return outcome;
        }, scheduler);
    }

    private CompletableFuture<StoreResult<Void>> startDelete(String id, Supplier<CompletableFuture<Void>> call) {
        E snapshot = entities.remove(id);
        if (snapshot == null) {
            finish(id);
            return completed(StoreResult.failure(StoreError.notFound(id)));
        }
        List<StoreIndex> memberOf = removeFromIndexes(id);
        metrics.mutationDispatched();
        long issuedEpoch = epoch;

        return invoke(call).handleAsync((ignored, failure) -> {
            if (issuedEpoch != epoch) {
                return outcomeOutsideScope(null, failure);
            }
            StoreResult<Void> outcome;
            if (failure == null) {
                outcome = StoreResult.success(null);
            } else {
                entities.put(id, snapshot);
                memberOf.forEach(index -> index.add(id));
                outcome = StoreResult.failure(rollback("delete", id, failure));
            }
            finish(id);
            return outcome;
        }, scheduler);
    }

    // ---------------------------------------------------------------- internals

    private void onLoaded(long generation, ScopeKey key, long startNanos, List<E> loaded, Throwable failure) {
        PendingLoad<E> pending = pendingLoad;
        if (pending == null || pending.generation != generation) {
            log.debug("{}: discarding superseded load of {}", name, key);
            return;
        }
        pendingLoad = null;
        metrics.loadCompleted(startNanos);

        if (failure != null) {
            StoreError error = StoreError.transport(failure);
            metrics.loadFailed();
            lastError = error;
            errorFromLoad = true;
            log.warn("{}: load of {} failed, keeping {} cached entities: {}",
                    name, key, entities.size(), error.message());
            pending.result.complete(StoreResult.failure(error));
            return;
        }

        replaceCache(loaded == null ? List.of() : loaded);
        if (errorFromLoad) {
            clearError();
        }
        log.debug("{}: loaded {} entities for {}", name, entities.size(), key);
        pending.result.complete(StoreResult.success(all()));
    }

    private void replaceCache(List<E> loaded) {
        Map<String, E> fresh = new LinkedHashMap<>();
        for (E entity : loaded) {
            if (entity != null && !inFlight.containsKey(entity.id())) {
                fresh.put(entity.id(), entity);
            }
        }
        for (String id : inFlight.keySet()) {
            E local = entities.get(id);
            if (local != null) {
                fresh.put(id, local);
            }
        }
        entities.clear();
        entities.putAll(fresh);
        indexes.values().forEach(index -> index.retainAll(entities.keySet()));
    }

    private void cancelPendingLoad(String reason) {
        PendingLoad<E> pending = pendingLoad;
        if (pending == null) {
            return;
        }
        pendingLoad = null;
        pending.request.cancel(false);
        pending.result.complete(StoreResult.failure(StoreError.cancelled(reason)));
        log.debug("{}: cancelled in-flight load ({})", name, reason);
    }

    private void resetCache() {
        epoch++;
        List<Deque<QueuedMutation>> queues = new ArrayList<>(inFlight.values());
        inFlight.clear();
        queues.forEach(queue -> queue.forEach(QueuedMutation::cancel));
        entities.clear();
        indexes.values().forEach(StoreIndex::clear);
    }

    private void finish(String id) {
        Deque<QueuedMutation> queue = inFlight.get(id);
        if (queue == null) {
            return;
        }
        QueuedMutation next = queue.poll();
        if (next == null) {
            inFlight.remove(id);
        } else {
            next.start();
        }
    }

    private StoreError rollback(String operation, String id, Throwable failure) {
        StoreError error = StoreError.transport(failure);
        metrics.rolledBack();
        lastError = error;
        errorFromLoad = false;
        log.warn("{}: {} of {} failed, rolled back: {}", name, operation, id, error.message());
        return error;
    }

    private <R> StoreResult<R> outcomeOutsideScope(R value, Throwable failure) {
        // the cache belongs to another scope now; report the repository outcome only
        return failure == null
                ? StoreResult.success(value)
                : StoreResult.failure(StoreError.transport(failure));
    }

    private Optional<StoreError> runGuard(MutationGuard guard, String what) {
        Optional<StoreError> rejected = (guard == null ? MutationGuard.allowAll() : guard).check();
        rejected.ifPresent(error -> {
            if (error.kind() == ErrorKind.PERMISSION_DENIED) {
                metrics.denied();
            }
            log.debug("{}: {} rejected: {} {}", name, what, error.kind(), error.message());
        });
        return rejected;
    }

    private void removeEverywhere(String id) {
        entities.remove(id);
        removeFromIndexes(id);
    }

    private List<StoreIndex> removeFromIndexes(String id) {
        List<StoreIndex> memberOf = new ArrayList<>();
        for (StoreIndex index : indexes.values()) {
            if (index.remove(id)) {
                memberOf.add(index);
            }
        }
        return memberOf;
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("repository returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> CompletableFuture<T> completed(T value) {
        return CompletableFuture.completedFuture(value);
    }

    private static final class PendingLoad<E> {

        private final long generation;
        private final CompletableFuture<List<E>> request;
        private final CompletableFuture<StoreResult<List<E>>> result;

        private PendingLoad(
                long generation, CompletableFuture<List<E>> request, CompletableFuture<StoreResult<List<E>>> result) {
            this.generation = generation;
            this.request = request;
            this.result = result;
        }
    }

    private static final class QueuedMutation {

        private final Runnable start;
        private final Runnable cancel;

        private QueuedMutation(Runnable start, Runnable cancel) {
            this.start = start;
            this.cancel = cancel;
        }

        void start() {
            start.run();
        }

        void cancel() {
            cancel.run();
        }
    }
}
