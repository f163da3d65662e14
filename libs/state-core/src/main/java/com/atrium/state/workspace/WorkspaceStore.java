package com.atrium.state.workspace;

import com.atrium.permissions.Capability;
import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.context.Scope;
import com.atrium.state.events.SessionEvents;
import com.atrium.state.permission.PermissionGate;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreError;
import com.atrium.state.store.StoreResult;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Workspaces visible to the identity the session acts as: owned ones for a user or organization,
 * granted ones for a team or partner.
 *
 * <p>Editing needs either ownership by the acting identity or the capability through the open
 * workspace's membership.
 */
public final class WorkspaceStore extends ScopedStore<Workspace> {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);
    private static final String SOURCE = "workspace-store";
    static final String FAVORITES = "favorites";

    private static final Comparator<Workspace> MOST_RECENT_FIRST = Comparator.comparing(
            Workspace::lastAccessedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final PermissionGate gate;

    public WorkspaceStore(AppContext app, ContextStore context, PermissionGate gate) {
        super(app, context, "workspaces");
        if (gate == null) {
            throw new IllegalArgumentException("gate must not be null");
        }
        this.gate = gate;
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        Scope scope = active.scope();
        return ScopeKey.of(scope.type().value(), scope.id());
    }

    @Override
    protected CompletableFuture<List<Workspace>> fetch(ScopeKey key) {
        return app.workspaces().listByScope(key);
    }

    // ---------------------------------------------------------------- views

    /**
     * The selected workspace if it is cached, otherwise the most recently accessed one, otherwise
     * empty.
     */
    public Optional<Workspace> currentWorkspace() {
        Optional<Workspace> selected = context.currentWorkspaceId().flatMap(entities::get);
        if (selected.isPresent()) {
            return selected;
        }
        return entities.all().stream().min(MOST_RECENT_FIRST);
    }

    /** Accessed workspaces, most recent first. */
    public List<Workspace> recentWorkspaces(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        return entities.filter(ws -> ws.lastAccessedAt() != null).stream()
                .sorted(MOST_RECENT_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<Workspace> recentWorkspaces() {
        return recentWorkspaces(app.recentWorkspaceLimit());
    }

    public List<Workspace> favoriteWorkspaces() {
        return entities.indexed(FAVORITES);
    }

    public boolean isFavorite(String workspaceId) {
        return entities.index(FAVORITES).contains(workspaceId);
    }

    public List<Workspace> activeWorkspaces() {
        return entities.filter(Workspace::isActive);
    }

    public List<Workspace> archivedWorkspaces() {
        return entities.filter(ws -> ws.status() == WorkspaceStatus.ARCHIVED);
    }

    /** Workspaces owned by the acting identity, as opposed to ones it was granted. */
    public List<Workspace> ownedWorkspaces() {
        Optional<String> actor = context.currentScopeId();
        return actor.map(id -> entities.filter(ws -> ws.isOwnedBy(id))).orElse(List.of());
    }

    public Optional<Workspace> findByName(String name) {
        return entities.filter(ws -> ws.name().equals(name)).stream().findFirst();
    }

    // ---------------------------------------------------------------- mutations

    /** Creates a workspace owned by the acting user or organization. */
    public CompletableFuture<StoreResult<Workspace>> create(WorkspaceDraft draft) {
        MutationGuard guard = MutationGuard.require(() -> draft != null, "workspace must not be null")
                .then(() -> WorkspaceRules.checkName(draft.name()).map(StoreError::validation))
                .then(() -> WorkspaceRules.checkDisplayName(draft.displayName()).map(StoreError::validation))
                .then(MutationGuard.require(() -> findByName(draft.name()).isEmpty(),
                        "a workspace named " + (draft == null ? null : draft.name()) + " already exists"))
                .then(() -> checkOwnerScope(draft));
        return entities.create(guard, tempId -> {
            Instant now = app.clock().instant();
            return new Workspace(tempId, draft.name(), draft.displayName(), draft.description(),
                    draft.ownerType(), draft.ownerId(), draft.visibility(), WorkspaceStatus.ACTIVE,
                    Set.of(), now, now, draft.createdBy(), null);
        }, () -> app.workspaces().create(draft));
    }

    public CompletableFuture<StoreResult<Workspace>> rename(String workspaceId, String displayName) {
        return update(workspaceId, WorkspacePatch.rename(displayName, app.clock().instant()));
    }

    public CompletableFuture<StoreResult<Workspace>> update(String workspaceId, WorkspacePatch patch) {
        MutationGuard guard = MutationGuard.require(() -> patch != null, "patch must not be null")
                .then(() -> patch.name() == null
                        ? Optional.empty()
                        : WorkspaceRules.checkName(patch.name()).map(StoreError::validation))
                .then(() -> patch.displayName() == null
                        ? Optional.empty()
                        : WorkspaceRules.checkDisplayName(patch.displayName()).map(StoreError::validation))
                .then(requireCapability(workspaceId, Capability.WORKSPACE_EDIT));
        return entities.update(guard, workspaceId, patch::applyTo,
                () -> app.workspaces().update(workspaceId, patch));
    }

    public CompletableFuture<StoreResult<Workspace>> archive(String workspaceId) {
        return update(workspaceId, WorkspacePatch.status(WorkspaceStatus.ARCHIVED, app.clock().instant()));
    }

    public CompletableFuture<StoreResult<Workspace>> restore(String workspaceId) {
        return update(workspaceId, WorkspacePatch.status(WorkspaceStatus.ACTIVE, app.clock().instant()));
    }

    /**
     * Deletes a workspace. Once the repository confirms, {@code workspace.removed} is published so
     * the context store can close it if it is open.
     */
    public CompletableFuture<StoreResult<Void>> delete(String workspaceId) {
        MutationGuard guard = requireCapability(workspaceId, Capability.WORKSPACE_DELETE);
        return entities.delete(guard, workspaceId, () -> app.workspaces().delete(workspaceId))
                .thenApply(result -> {
                    if (result.isSuccess()) {
                        log.info("Workspace {} deleted", workspaceId);
                        app.bus().publish(SessionEvents.WORKSPACE_REMOVED, SOURCE, workspaceId);
                    }
                    return result;
                });
    }

    /** Stamps the workspace as accessed now. Local only; the repository keeps its own access log. */
    public boolean trackAccess(String workspaceId) {
        Instant now = app.clock().instant();
        return entities.replaceLocal(workspaceId, ws -> ws.withLastAccessedAt(now));
    }

    /**
     * Flips the favourite flag of a cached workspace.
     *
     * @return the new flag; false as well when the workspace is not cached
     */
    public boolean toggleFavorite(String workspaceId) {
        if (entities.removeFromIndex(FAVORITES, workspaceId)) {
            return false;
        }
        return entities.addToIndex(FAVORITES, workspaceId);
    }

    /** Fetches one workspace again; a workspace gone on the server leaves the cache. */
    public CompletableFuture<StoreResult<Workspace>> refresh(String workspaceId) {
        return entities.refresh(workspaceId, () -> app.workspaces().getById(workspaceId));
    }

    private Optional<StoreError> checkOwnerScope(WorkspaceDraft draft) {
        Optional<ActiveContext> active = context.current();
        if (active.isEmpty()) {
            return Optional.of(StoreError.validation("no active identity"));
        }
        Scope scope = active.get().scope();
        if (!scope.type().canOwnWorkspace()) {
            return Optional.of(StoreError.permissionDenied(
                    "a " + scope.type().value() + " account cannot own workspaces"));
        }
        if (draft.ownerType() != scope.type().identityType() || !scope.id().equals(draft.ownerId())) {
            return Optional.of(StoreError.validation(
                    "workspace owner must be the acting " + scope.type().value() + " " + scope.id()));
        }
        return Optional.empty();
    }

    private MutationGuard requireCapability(String workspaceId, Capability capability) {
        MutationGuard viaMembership = gate.require(workspaceId, capability);
        return () -> isOwnedByActor(workspaceId) ? Optional.empty() : viaMembership.check();
    }

    private boolean isOwnedByActor(String workspaceId) {
        Optional<String> actor = context.currentScopeId();
        return actor.isPresent() && entities.get(workspaceId).map(ws -> ws.isOwnedBy(actor.get())).orElse(false);
    }
}
