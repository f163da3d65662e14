package com.atrium.state.testing;

import com.atrium.eventbus.EventBus;
import com.atrium.observability.MetricFactory;
import com.atrium.state.app.AppContext;
import com.atrium.state.scheduler.DirectStoreScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.ZoneOffset;

/**
 * App contexts for tests: inline scheduler, fresh bus and meter registry, clock fixed at
 * {@link TestIdentities#NOW}.
 */
public final class TestAppContexts {

    private TestAppContexts() {
        // utility class
    }

    public static AppContext create(TestRepositories repositories, TestAuthProvider authProvider) {
        return builder(repositories, authProvider).build();
    }

    /** A pre-filled builder, for tests that change one setting. */
    public static AppContext.Builder builder(TestRepositories repositories, TestAuthProvider authProvider) {
        return repositories.applyTo(AppContext.builder()
                .bus(new EventBus())
                .scheduler(new DirectStoreScheduler())
                .metrics(new MetricFactory(new SimpleMeterRegistry(), "atrium-test"))
                .clock(Clock.fixed(TestIdentities.NOW, ZoneOffset.UTC))
                .authProvider(authProvider));
    }
}
