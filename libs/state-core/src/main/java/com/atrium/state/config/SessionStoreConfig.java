package com.atrium.state.config;

import com.atrium.eventbus.EventBus;
import com.atrium.observability.MetricFactory;
import com.atrium.state.app.AppContext;
import com.atrium.state.app.SessionStores;
import com.atrium.state.context.ContextStore;
import com.atrium.state.port.AccountRepository;
import com.atrium.state.port.AuthProvider;
import com.atrium.state.port.BotRepository;
import com.atrium.state.port.DocumentRepository;
import com.atrium.state.port.MembershipRepository;
import com.atrium.state.port.ModuleRepository;
import com.atrium.state.port.NotificationRepository;
import com.atrium.state.port.PartnerRepository;
import com.atrium.state.port.TeamRepository;
import com.atrium.state.port.WorkspaceRepository;
import com.atrium.state.scheduler.SingleThreadStoreScheduler;
import com.atrium.state.scheduler.StoreScheduler;
import com.atrium.state.session.SessionBridge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds one session's store graph from the host's repository and authentication beans.
 *
 * <p>The host supplies the nine repository ports and an {@link AuthProvider}; everything else has a
 * default that a bean of the same type replaces.
 */
@Configuration
@EnableConfigurationProperties(SessionStoreProperties.class)
public class SessionStoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public StoreScheduler storeScheduler(SessionStoreProperties properties) {
        return new SingleThreadStoreScheduler(properties.schedulerThreadName());
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory storeMetricFactory(MeterRegistry registry, SessionStoreProperties properties) {
        return new MetricFactory(registry, properties.serviceName());
    }

    @Bean
    public AppContext appContext(
            SessionStoreProperties properties,
            EventBus bus,
            StoreScheduler scheduler,
            MetricFactory storeMetricFactory,
            Clock clock,
            AuthProvider authProvider,
            AccountRepository accounts,
            TeamRepository teams,
            PartnerRepository partners,
            WorkspaceRepository workspaces,
            MembershipRepository memberships,
            DocumentRepository documents,
            NotificationRepository notifications,
            BotRepository bots,
            ModuleRepository modules) {
        return AppContext.builder()
                .bus(bus)
                .scheduler(scheduler)
                .concurrency(properties.mutationConcurrency())
                .metrics(storeMetricFactory)
                .clock(clock)
                .authProvider(authProvider)
                .recentDocumentLimit(properties.recentDocumentLimit())
                .recentWorkspaceLimit(properties.recentWorkspaceLimit())
                .historyLimit(properties.historyLimit())
                .accounts(accounts)
                .teams(teams)
                .partners(partners)
                .workspaces(workspaces)
                .memberships(memberships)
                .documents(documents)
                .notifications(notifications)
                .bots(bots)
                .modules(modules)
                .build();
    }

    @Bean(destroyMethod = "close")
    public ContextStore contextStore(AppContext appContext) {
        return new ContextStore(appContext);
    }

    @Bean(destroyMethod = "close")
    public SessionStores sessionStores(AppContext appContext, ContextStore contextStore) {
        return new SessionStores(appContext, contextStore);
    }

    /** Created last so the stores are listening when the current identity is announced. */
    @Bean(destroyMethod = "close")
    public SessionBridge sessionBridge(
            AuthProvider authProvider, EventBus bus, StoreScheduler scheduler, SessionStores sessionStores) {
        SessionBridge bridge = new SessionBridge(authProvider, bus, scheduler);
        bridge.announceCurrent(authProvider);
        return bridge;
    }
}
