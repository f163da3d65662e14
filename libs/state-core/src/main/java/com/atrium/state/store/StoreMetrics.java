package com.atrium.state.store;

import com.atrium.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

/** Micrometer meters for one store, all tagged {@code store=<name>}. */
public final class StoreMetrics {

    static final String TAG_STORE = "store";

    private final Counter loads;
    private final Counter loadFailures;
    private final Counter mutations;
    private final Counter rollbacks;
    private final Counter conflicts;
    private final Counter denials;
    private final Timer loadDuration;

    public StoreMetrics(MetricFactory factory, String storeName) {
        this.loads = factory.counter("atrium.store.loads", "Scoped loads issued", TAG_STORE, storeName);
        this.loadFailures = factory.counter(
                "atrium.store.load.failures", "Scoped loads that failed", TAG_STORE, storeName);
        this.mutations = factory.counter(
                "atrium.store.mutations", "Optimistic mutations dispatched", TAG_STORE, storeName);
        this.rollbacks = factory.counter(
                "atrium.store.rollbacks", "Optimistic mutations rolled back", TAG_STORE, storeName);
        this.conflicts = factory.counter(
                "atrium.store.conflicts", "Mutations rejected while another was in flight", TAG_STORE, storeName);
        this.denials = factory.counter(
                "atrium.store.denials", "Mutations rejected by a guard", TAG_STORE, storeName);
        this.loadDuration = factory.timer("atrium.store.load.duration", "Scoped load latency", TAG_STORE, storeName);
    }

    void loadIssued() {
        loads.increment();
    }

    void loadFailed() {
        loadFailures.increment();
    }

    void loadCompleted(long startNanos) {
        loadDuration.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    void mutationDispatched() {
        mutations.increment();
    }

    void rolledBack() {
        rollbacks.increment();
    }

    void conflict() {
        conflicts.increment();
    }

    void denied() {
        denials.increment();
    }
}
