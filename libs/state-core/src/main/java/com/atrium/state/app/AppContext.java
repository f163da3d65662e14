package com.atrium.state.app;

import com.atrium.eventbus.EventBus;
import com.atrium.observability.MetricFactory;
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
import com.atrium.state.scheduler.StoreScheduler;
import com.atrium.state.store.Entity;
import com.atrium.state.store.EntityStore;
import com.atrium.state.store.MutationConcurrency;
import com.atrium.state.store.StoreMetrics;
import java.time.Clock;

/**
 * Everything a store needs from its surroundings, built once per session and handed to every store
 * constructor. Stores never look collaborators up anywhere else.
 */
public final class AppContext {

    private final EventBus bus;
    private final StoreScheduler scheduler;
    private final MutationConcurrency concurrency;
    private final MetricFactory metrics;
    private final Clock clock;
    private final AuthProvider authProvider;
    private final int recentDocumentLimit;
    private final int recentWorkspaceLimit;
    private final int historyLimit;

    private final AccountRepository accounts;
    private final TeamRepository teams;
    private final PartnerRepository partners;
    private final WorkspaceRepository workspaces;
    private final MembershipRepository memberships;
    private final DocumentRepository documents;
    private final NotificationRepository notifications;
    private final BotRepository bots;
    private final ModuleRepository modules;

    private AppContext(Builder builder) {
        this.bus = require(builder.bus, "bus");
        this.scheduler = require(builder.scheduler, "scheduler");
        this.concurrency = require(builder.concurrency, "concurrency");
        this.metrics = require(builder.metrics, "metrics");
        this.clock = require(builder.clock, "clock");
        this.authProvider = require(builder.authProvider, "authProvider");
        this.recentDocumentLimit = positive(builder.recentDocumentLimit, "recentDocumentLimit");
        this.recentWorkspaceLimit = positive(builder.recentWorkspaceLimit, "recentWorkspaceLimit");
        this.historyLimit = positive(builder.historyLimit, "historyLimit");
        this.accounts = require(builder.accounts, "accounts");
        this.teams = require(builder.teams, "teams");
        this.partners = require(builder.partners, "partners");
        this.workspaces = require(builder.workspaces, "workspaces");
        this.memberships = require(builder.memberships, "memberships");
        this.documents = require(builder.documents, "documents");
        this.notifications = require(builder.notifications, "notifications");
        this.bots = require(builder.bots, "bots");
        this.modules = require(builder.modules, "modules");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A new entity store wired to this context's scheduler, policy and metrics. */
    public <E extends Entity> EntityStore<E> newEntityStore(String name) {
        return new EntityStore<>(name, scheduler, concurrency, new StoreMetrics(metrics, name));
    }

    public EventBus bus() {
        return bus;
    }

    public StoreScheduler scheduler() {
        return scheduler;
    }

    public MutationConcurrency concurrency() {
        return concurrency;
    }

    public MetricFactory metrics() {
        return metrics;
    }

    public Clock clock() {
        return clock;
    }

    public AuthProvider authProvider() {
        return authProvider;
    }

    public int recentDocumentLimit() {
        return recentDocumentLimit;
    }

    public int recentWorkspaceLimit() {
        return recentWorkspaceLimit;
    }

    public int historyLimit() {
        return historyLimit;
    }

    public AccountRepository accounts() {
        return accounts;
    }

    public TeamRepository teams() {
        return teams;
    }

    public PartnerRepository partners() {
        return partners;
    }

    public WorkspaceRepository workspaces() {
        return workspaces;
    }

    public MembershipRepository memberships() {
        return memberships;
    }

    public DocumentRepository documents() {
        return documents;
    }

    public NotificationRepository notifications() {
        return notifications;
    }

    public BotRepository bots() {
        return bots;
    }

    public ModuleRepository modules() {
        return modules;
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    private static int positive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        return value;
    }

    public static final class Builder {

        private EventBus bus;
        private StoreScheduler scheduler;
        private MutationConcurrency concurrency = MutationConcurrency.REJECT;
        private MetricFactory metrics;
        private Clock clock = Clock.systemUTC();
        private AuthProvider authProvider;
        private int recentDocumentLimit = 10;
        private int recentWorkspaceLimit = 3;
        private int historyLimit = 50;

        private AccountRepository accounts;
        private TeamRepository teams;
        private PartnerRepository partners;
        private WorkspaceRepository workspaces;
        private MembershipRepository memberships;
        private DocumentRepository documents;
        private NotificationRepository notifications;
        private BotRepository bots;
        private ModuleRepository modules;

        private Builder() {
        }

        public Builder bus(EventBus bus) {
            this.bus = bus;
            return this;
        }

        public Builder scheduler(StoreScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder concurrency(MutationConcurrency concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder metrics(MetricFactory metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder authProvider(AuthProvider authProvider) {
            this.authProvider = authProvider;
            return this;
        }

        public Builder recentDocumentLimit(int recentDocumentLimit) {
            this.recentDocumentLimit = recentDocumentLimit;
            return this;
        }

        public Builder recentWorkspaceLimit(int recentWorkspaceLimit) {
            this.recentWorkspaceLimit = recentWorkspaceLimit;
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public Builder accounts(AccountRepository accounts) {
            this.accounts = accounts;
            return this;
        }

        public Builder teams(TeamRepository teams) {
            this.teams = teams;
            return this;
        }

        public Builder partners(PartnerRepository partners) {
            this.partners = partners;
            return this;
        }

        public Builder workspaces(WorkspaceRepository workspaces) {
            this.workspaces = workspaces;
            return this;
        }

        public Builder memberships(MembershipRepository memberships) {
            this.memberships = memberships;
            return this;
        }

        public Builder documents(DocumentRepository documents) {
            this.documents = documents;
            return this;
        }

        public Builder notifications(NotificationRepository notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder bots(BotRepository bots) {
            this.bots = bots;
            return this;
        }

        public Builder modules(ModuleRepository modules) {
            this.modules = modules;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a collaborator is missing or a limit is not positive
         */
        public AppContext build() {
            return new AppContext(this);
        }
    }
}
