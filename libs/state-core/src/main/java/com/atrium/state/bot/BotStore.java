package com.atrium.state.bot;

import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.context.Scope;
import com.atrium.state.context.ScopeType;
import com.atrium.state.identity.Bot;
import com.atrium.state.identity.BotStatus;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreError;
import com.atrium.state.store.StoreResult;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Bots created by the principal (personal scope) or belonging to the organization behind the
 * acting scope. Only identities that can own workspaces manage bots.
 */
public final class BotStore extends ScopedStore<Bot> {

    public BotStore(AppContext app, ContextStore context) {
        super(app, context, "bots");
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        Scope scope = active.scope();
        return switch (scope.type()) {
            case USER -> ScopeKey.creator(scope.id());
            case ORGANIZATION -> ScopeKey.organization(scope.id());
            case TEAM, PARTNER -> ScopeKey.organization(scope.organizationId());
        };
    }

    @Override
    protected CompletableFuture<List<Bot>> fetch(ScopeKey key) {
        return app.bots().listByScope(key);
    }

    // ---------------------------------------------------------------- explicit loads

    /** Bots granted access to a workspace. Replaces the context-derived slice until the next switch. */
    public CompletableFuture<StoreResult<List<Bot>>> loadByWorkspace(String workspaceId) {
        return load(ScopeKey.workspace(workspaceId));
    }

    public CompletableFuture<StoreResult<List<Bot>>> loadByOrganization(String organizationId) {
        return load(ScopeKey.organization(organizationId));
    }

    public CompletableFuture<StoreResult<List<Bot>>> loadByCreator(String userId) {
        return load(ScopeKey.creator(userId));
    }

    // ---------------------------------------------------------------- views

    public List<Bot> byStatus(BotStatus status) {
        return entities.filter(bot -> bot.status() == status);
    }

    public List<Bot> active() {
        return byStatus(BotStatus.ACTIVE);
    }

    public List<Bot> suspended() {
        return byStatus(BotStatus.SUSPENDED);
    }

    public List<Bot> revoked() {
        return byStatus(BotStatus.REVOKED);
    }

    /** Active bots that may act in the workspace. */
    public List<Bot> withAccessTo(String workspaceId) {
        return entities.filter(bot -> bot.canAccess(workspaceId));
    }

    // ---------------------------------------------------------------- mutations

    public CompletableFuture<StoreResult<Bot>> create(BotDraft draft) {
        MutationGuard guard = MutationGuard.require(() -> draft != null, "bot must not be null")
                .then(MutationGuard.require(() -> draft.displayName() != null && !draft.displayName().isBlank(),
                        "displayName must not be blank"))
                .then(MutationGuard.require(() -> draft.createdBy() != null && !draft.createdBy().isBlank(),
                        "createdBy must not be blank"))
                .then(this::requireOwningScope);
        return entities.create(guard, tempId -> {
            Instant now = app.clock().instant();
            return new Bot(tempId, draft.displayName(), draft.description(), draft.createdBy(),
                    draft.organizationId(), draft.permissions(), draft.workspaceIds(), BotStatus.ACTIVE, now, now);
        }, () -> app.bots().create(draft));
    }

    public CompletableFuture<StoreResult<Bot>> suspend(String botId) {
        return changeStatus(botId, BotStatus.SUSPENDED, BotStatus.ACTIVE);
    }

    public CompletableFuture<StoreResult<Bot>> reactivate(String botId) {
        return changeStatus(botId, BotStatus.ACTIVE, BotStatus.SUSPENDED);
    }

    /** Revocation is final. */
    public CompletableFuture<StoreResult<Bot>> revoke(String botId) {
        return changeStatus(botId, BotStatus.REVOKED, BotStatus.ACTIVE, BotStatus.SUSPENDED);
    }

    public CompletableFuture<StoreResult<Void>> delete(String botId) {
        MutationGuard guard = this::requireOwningScope;
        return entities.delete(guard, botId, () -> app.bots().delete(botId));
    }

    private CompletableFuture<StoreResult<Bot>> changeStatus(String botId, BotStatus target, BotStatus... from) {
        MutationGuard guard = MutationGuard.require(
                        () -> entities.get(botId).map(bot -> isOneOf(bot.status(), from)).orElse(true),
                        "bot cannot move to " + target)
                .then(this::requireOwningScope);
        BotPatch patch = BotPatch.status(target, app.clock().instant());
        return entities.update(guard, botId, patch::applyTo, () -> app.bots().update(botId, patch));
    }

    private Optional<StoreError> requireOwningScope() {
        boolean owning = context.currentScopeType().map(ScopeType::canOwnWorkspace).orElse(false);
        return owning
                ? Optional.empty()
                : Optional.of(StoreError.permissionDenied("only a user or organization account can manage bots"));
    }

    private static boolean isOneOf(BotStatus status, BotStatus... candidates) {
        for (BotStatus candidate : candidates) {
            if (candidate == status) {
                return true;
            }
        }
        return false;
    }
}
