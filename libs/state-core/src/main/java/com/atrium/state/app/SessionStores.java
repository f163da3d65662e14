package com.atrium.state.app;

import com.atrium.state.account.AccountStore;
import com.atrium.state.bot.BotStore;
import com.atrium.state.context.ContextStore;
import com.atrium.state.document.DocumentStore;
import com.atrium.state.membership.MembershipStore;
import com.atrium.state.module.ModuleStore;
import com.atrium.state.notification.NotificationStore;
import com.atrium.state.permission.PermissionGate;
import com.atrium.state.workspace.WorkspaceStore;

/**
 * The store graph of one session, built from a single {@link AppContext}.
 *
 * <p>The membership store is created before the stores it gates, so it sees each context change
 * first.
 */
public final class SessionStores implements AutoCloseable {

    private final ContextStore context;
    private final AccountStore accounts;
    private final MembershipStore memberships;
    private final WorkspaceStore workspaces;
    private final DocumentStore documents;
    private final ModuleStore modules;
    private final NotificationStore notifications;
    private final BotStore bots;

    public SessionStores(AppContext app, ContextStore context) {
        if (app == null) {
            throw new IllegalArgumentException("app must not be null");
        }
        this.context = context;
        this.accounts = new AccountStore(app, context);
        this.memberships = new MembershipStore(app, context);
        PermissionGate gate = memberships.gate();
        this.workspaces = new WorkspaceStore(app, context, gate);
        this.documents = new DocumentStore(app, context, gate);
        this.modules = new ModuleStore(app, context, gate);
        this.notifications = new NotificationStore(app, context);
        this.bots = new BotStore(app, context);
    }

    public ContextStore context() {
        return context;
    }

    public AccountStore accounts() {
        return accounts;
    }

    public MembershipStore memberships() {
        return memberships;
    }

    public WorkspaceStore workspaces() {
        return workspaces;
    }

    public DocumentStore documents() {
        return documents;
    }

    public ModuleStore modules() {
        return modules;
    }

    public NotificationStore notifications() {
        return notifications;
    }

    public BotStore bots() {
        return bots;
    }

    /** Unsubscribes every store; the context store itself stays open. */
    @Override
    public void close() {
        bots.close();
        notifications.close();
        modules.close();
        documents.close();
        workspaces.close();
        memberships.close();
        accounts.close();
    }
}
