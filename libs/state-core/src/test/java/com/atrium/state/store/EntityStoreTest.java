package com.atrium.state.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.atrium.observability.MetricFactory;
import com.atrium.state.scheduler.DirectStoreScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EntityStore")
class EntityStoreTest {

    record Note(String id, String text) implements Entity {
        Note withText(String newText) {
            return new Note(id, newText);
        }
    }

    private static final ScopeKey W1 = ScopeKey.workspace("w1");
    private static final ScopeKey W2 = ScopeKey.workspace("w2");

    private SimpleMeterRegistry registry;
    private EntityStore<Note> store;

    @BeforeEach
    void setUp() {
        store = newStore(MutationConcurrency.REJECT);
    }

    private EntityStore<Note> newStore(MutationConcurrency concurrency) {
        registry = new SimpleMeterRegistry();
        MetricFactory factory = new MetricFactory(registry, "test");
        return new EntityStore<>("notes", new DirectStoreScheduler(), concurrency, new StoreMetrics(factory, "notes"));
    }

    private void loadNow(ScopeKey key, Note... notes) {
        store.load(key, () -> CompletableFuture.completedFuture(List.of(notes)));
    }

    private double counter(String name) {
        return registry.get(name).tag("store", "notes").counter().count();
    }

    @Nested
    @DisplayName("load()")
    class Load {

        @Test
        @DisplayName("replaces the cache and reports the loaded entities")
        void loadsEntities() {
            var result = store.load(W1, () -> CompletableFuture.completedFuture(
                    List.of(new Note("n1", "a"), new Note("n2", "b"))));

            assertThat(result.join().isSuccess()).isTrue();
            assertThat(result.join().value()).extracting(Note::id).containsExactly("n1", "n2");
            assertThat(store.scope()).contains(W1);
            assertThat(store.status()).isEqualTo(StoreStatus.IDLE);
        }

        @Test
        @DisplayName("is LOADING until the repository answers")
        void loadingStatus() {
            var pending = new CompletableFuture<List<Note>>();
            store.load(W1, () -> pending);

            assertThat(store.status()).isEqualTo(StoreStatus.LOADING);
            assertThat(store.isLoading()).isTrue();

            pending.complete(List.of());
            assertThat(store.status()).isEqualTo(StoreStatus.IDLE);
        }

        @Test
        @DisplayName("a newer load supersedes the pending one, whose late answer is discarded")
        void lastLoadWins() {
            var first = new CompletableFuture<List<Note>>();
            var second = new CompletableFuture<List<Note>>();
            var firstResult = store.load(W1, () -> first);
            var secondResult = store.load(W2, () -> second);

            assertThat(firstResult.join().failedWith(ErrorKind.CANCELLED)).isTrue();
            assertThat(first.isCancelled()).isTrue();

            second.complete(List.of(new Note("n2", "w2 note")));

            assertThat(secondResult.join().isSuccess()).isTrue();
            assertThat(store.all()).extracting(Note::id).containsExactly("n2");
            assertThat(store.scope()).contains(W2);
        }

        @Test
        @DisplayName("a new scope key empties the cache before the answer arrives")
        void newScopeClearsFirst() {
            loadNow(W1, new Note("n1", "a"));

            store.load(W2, CompletableFuture::new);

            assertThat(store.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("reloading the same scope keeps cached entities until the answer arrives")
        void sameScopeKeepsCache() {
            loadNow(W1, new Note("n1", "a"));

            store.load(W1, CompletableFuture::new);

            assertThat(store.get("n1")).isPresent();
        }

        @Test
        @DisplayName("a failed load keeps stale data and records a TRANSPORT error")
        void failedLoadKeepsStaleData() {
            loadNow(W1, new Note("n1", "a"));

            var result = store.load(W1, () -> CompletableFuture.failedFuture(new IllegalStateException("offline")));

            assertThat(result.join().failedWith(ErrorKind.TRANSPORT)).isTrue();
            assertThat(store.get("n1")).isPresent();
            assertThat(store.status()).isEqualTo(StoreStatus.ERROR);
            assertThat(store.lastError()).map(StoreError::message).contains("offline");
            assertThat(counter("atrium.store.load.failures")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a successful load clears an error left by a failed load")
        void successClearsLoadError() {
            store.load(W1, () -> CompletableFuture.failedFuture(new IllegalStateException("offline")));

            loadNow(W1, new Note("n1", "a"));

            assertThat(store.lastError()).isEmpty();
        }

        @Test
        @DisplayName("entities with a mutation in flight keep their local value")
        void preservesInFlightEntries() {
            loadNow(W1, new Note("n1", "a"));
            var pendingUpdate = new CompletableFuture<Void>();
            store.update(MutationGuard.allowAll(), "n1", note -> note.withText("local"), () -> pendingUpdate);

            loadNow(W1, new Note("n1", "server"), new Note("n2", "b"));

            assertThat(store.get("n1")).map(Note::text).contains("local");
            assertThat(store.get("n2")).isPresent();
        }
    }

    @Nested
    @DisplayName("update()")
    class Update {

        @Test
        @DisplayName("applies the change before the repository answers")
        void optimistic() {
            loadNow(W1, new Note("d1", "A"));
            var pending = new CompletableFuture<Void>();

            var result = store.update(MutationGuard.allowAll(), "d1", note -> note.withText("B"), () -> pending);

            assertThat(store.get("d1")).map(Note::text).contains("B");
            assertThat(store.isPersisting("d1")).isTrue();
            assertThat(store.status()).isEqualTo(StoreStatus.PERSISTING);

            pending.complete(null);
            assertThat(result.join().isSuccess()).isTrue();
            assertThat(store.isPersisting()).isFalse();
        }

        @Test
        @DisplayName("rolls back to the snapshot on failure and keeps the error until cleared")
        void rollback() {
            loadNow(W1, new Note("d1", "A"));
            var pending = new CompletableFuture<Void>();

            var result = store.update(MutationGuard.allowAll(), "d1", note -> note.withText("B"), () -> pending);
            assertThat(store.get("d1")).map(Note::text).contains("B");

            pending.completeExceptionally(new IllegalStateException("timeout"));

            assertThat(store.get("d1")).map(Note::text).contains("A");
            assertThat(result.join().failedWith(ErrorKind.TRANSPORT)).isTrue();
            assertThat(store.lastError()).map(StoreError::kind).contains(ErrorKind.TRANSPORT);
            assertThat(counter("atrium.store.rollbacks")).isEqualTo(1.0);

            store.clearError();
            assertThat(store.lastError()).isEmpty();
        }

        @Test
        @DisplayName("a failed guard touches neither the cache nor the repository")
        void guardRejects() {
            loadNow(W1, new Note("d1", "A"));
            var calls = new AtomicInteger();

            var result = store.update(
                    () -> Optional.of(StoreError.permissionDenied("no")), "d1", note -> note.withText("B"),
                    () -> {
                        calls.incrementAndGet();
                        return CompletableFuture.completedFuture(null);
                    });

            assertThat(result.join().failedWith(ErrorKind.PERMISSION_DENIED)).isTrue();
            assertThat(calls).hasValue(0);
            assertThat(store.get("d1")).map(Note::text).contains("A");
            assertThat(counter("atrium.store.denials")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an unknown id is NOT_FOUND")
        void unknownId() {
            var result = store.update(MutationGuard.allowAll(), "nope", note -> note,
                    () -> CompletableFuture.completedFuture(null));

            assertThat(result.join().failedWith(ErrorKind.NOT_FOUND)).isTrue();
        }

        @Test
        @DisplayName("REJECT: a second mutation on an in-flight id fails with CONFLICT")
        void rejectConflict() {
            loadNow(W1, new Note("d1", "A"));
            store.update(MutationGuard.allowAll(), "d1", note -> note.withText("B"), CompletableFuture::new);

            var second = store.update(MutationGuard.allowAll(), "d1", note -> note.withText("C"),
                    () -> CompletableFuture.completedFuture(null));

            assertThat(second.join().failedWith(ErrorKind.CONFLICT)).isTrue();
            assertThat(store.get("d1")).map(Note::text).contains("B");
            assertThat(counter("atrium.store.conflicts")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("QUEUE: a second mutation runs after the first resolves")
        void queueSerializes() {
            store = newStore(MutationConcurrency.QUEUE);
            loadNow(W1, new Note("d1", "A"));
            var first = new CompletableFuture<Void>();
            var secondCall = new CompletableFuture<Void>();
            var secondCalls = new AtomicInteger();

            store.update(MutationGuard.allowAll(), "d1", note -> note.withText("B"), () -> first);
            var second = store.update(MutationGuard.allowAll(), "d1", note -> note.withText(note.text() + "C"),
                    () -> {
                        secondCalls.incrementAndGet();
                        return secondCall;
                    });

            assertThat(secondCalls).hasValue(0);
            assertThat(store.get("d1")).map(Note::text).contains("B");

            first.complete(null);
            assertThat(secondCalls).hasValue(1);
            assertThat(store.get("d1")).map(Note::text).contains("BC");

            secondCall.complete(null);
            assertThat(second.join().isSuccess()).isTrue();
            assertThat(store.isPersisting("d1")).isFalse();
        }
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("shows a provisional entity, then swaps in the server's")
        void replacesProvisional() {
            loadNow(W1);
            var pending = new CompletableFuture<Note>();

            var result = store.create(MutationGuard.allowAll(), tempId -> new Note(tempId, "draft"), () -> pending);

            assertThat(store.all()).singleElement()
                    .satisfies(note -> assertThat(EntityStore.isProvisional(note.id())).isTrue());

            pending.complete(new Note("srv-1", "draft"));

            assertThat(result.join().value().id()).isEqualTo("srv-1");
            assertThat(store.all()).extracting(Note::id).containsExactly("srv-1");
            assertThat(store.isPersisting()).isFalse();
        }

        @Test
        @DisplayName("removes the provisional entity on failure")
        void failureRemovesProvisional() {
            loadNow(W1);

            var result = store.create(MutationGuard.allowAll(), tempId -> new Note(tempId, "draft"),
                    () -> CompletableFuture.failedFuture(new IllegalStateException("quota")));

            assertThat(result.join().failedWith(ErrorKind.TRANSPORT)).isTrue();
            assertThat(store.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("delete()")
    class Delete {

        @Test
        @DisplayName("removes the entity and its index entries at once")
        void removesFromIndexes() {
            loadNow(W1, new Note("d1", "A"));
            store.addToIndex("starred", "d1");

            store.delete(MutationGuard.allowAll(), "d1", CompletableFuture::new);

            assertThat(store.get("d1")).isEmpty();
            assertThat(store.index("starred").contains("d1")).isFalse();
        }

        @Test
        @DisplayName("restores the entity and its index entries on failure")
        void rollbackRestoresIndexes() {
            loadNow(W1, new Note("d1", "A"));
            store.addToIndex("starred", "d1");
            var pending = new CompletableFuture<Void>();

            var result = store.delete(MutationGuard.allowAll(), "d1", () -> pending);
            pending.completeExceptionally(new IllegalStateException("offline"));

            assertThat(result.join().failedWith(ErrorKind.TRANSPORT)).isTrue();
            assertThat(store.get("d1")).isPresent();
            assertThat(store.indexed("starred")).extracting(Note::id).containsExactly("d1");
        }
    }

    @Nested
    @DisplayName("clear()")
    class Clear {

        @Test
        @DisplayName("empties the cache and forgets the scope synchronously")
        void clearsSynchronously() {
            loadNow(W1, new Note("n1", "a"));

            store.clear();

            assertThat(store.isEmpty()).isTrue();
            assertThat(store.scope()).isEmpty();
            assertThat(store.status()).isEqualTo(StoreStatus.IDLE);
        }

        @Test
        @DisplayName("cancels the pending load")
        void cancelsLoad() {
            var pending = new CompletableFuture<List<Note>>();
            var result = store.load(W1, () -> pending);

            store.clear();

            assertThat(result.join().failedWith(ErrorKind.CANCELLED)).isTrue();
            assertThat(store.isLoading()).isFalse();
        }

        @Test
        @DisplayName("a mutation resolving after the clear does not touch the new cache")
        void lateMutationIgnored() {
            loadNow(W1, new Note("d1", "A"));
            var pending = new CompletableFuture<Void>();
            var result = store.update(MutationGuard.allowAll(), "d1", note -> note.withText("B"), () -> pending);

            store.clear();
            loadNow(W2, new Note("d1", "other scope"));
            pending.completeExceptionally(new IllegalStateException("late"));

            assertThat(result.join().failedWith(ErrorKind.TRANSPORT)).isTrue();
            assertThat(store.get("d1")).map(Note::text).contains("other scope");
            assertThat(store.lastError()).isEmpty();
        }

        @Test
        @DisplayName("cancels queued mutations")
        void cancelsQueued() {
            store = newStore(MutationConcurrency.QUEUE);
            loadNow(W1, new Note("d1", "A"));
            store.update(MutationGuard.allowAll(), "d1", note -> note.withText("B"), CompletableFuture::new);
            var queued = store.update(MutationGuard.allowAll(), "d1", note -> note.withText("C"),
                    () -> CompletableFuture.completedFuture(null));

            store.clear();

            assertThat(queued.join().failedWith(ErrorKind.CANCELLED)).isTrue();
        }
    }

    @Nested
    @DisplayName("refresh()")
    class Refresh {

        @Test
        @DisplayName("replaces the cached entity with the repository's")
        void replaces() {
            loadNow(W1, new Note("n1", "old"));

            var result = store.refresh("n1", () -> CompletableFuture.completedFuture(Optional.of(new Note("n1", "new"))));

            assertThat(result.join().value().text()).isEqualTo("new");
            assertThat(store.get("n1")).map(Note::text).contains("new");
        }

        @Test
        @DisplayName("drops an entity the repository no longer has")
        void dropsMissing() {
            loadNow(W1, new Note("n1", "old"));
            store.addToIndex("starred", "n1");

            var result = store.refresh("n1", () -> CompletableFuture.completedFuture(Optional.empty()));

            assertThat(result.join().failedWith(ErrorKind.NOT_FOUND)).isTrue();
            assertThat(store.get("n1")).isEmpty();
            assertThat(store.index("starred").size()).isZero();
        }
    }
}
