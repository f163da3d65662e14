package com.atrium.state.membership;

import com.atrium.observability.LogRedactor;
import com.atrium.permissions.Capability;
import com.atrium.permissions.PermissionEngine;
import com.atrium.permissions.Role;
import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.context.ScopeType;
import com.atrium.state.permission.PermissionGate;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memberships of the open workspace.
 *
 * <p>Also the source of the acting identity's own membership, from which {@link #gate()} derives
 * every capability check in the workspace.
 */
public final class MembershipStore extends ScopedStore<Membership> {

    private static final Logger log = LoggerFactory.getLogger(MembershipStore.class);
    private static final LogRedactor REDACTOR = new LogRedactor();

    private final PermissionGate gate;

    public MembershipStore(AppContext app, ContextStore context) {
        super(app, context, "memberships");
        this.gate = new PermissionGate(this::currentMembership);
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        return active.hasWorkspace() ? ScopeKey.workspace(active.workspaceId()) : null;
    }

    @Override
    protected CompletableFuture<List<Membership>> fetch(ScopeKey key) {
        return app.memberships().listByScope(key);
    }

    /** Guards backed by {@link #currentMembership()}. */
    public PermissionGate gate() {
        return gate;
    }

    // ---------------------------------------------------------------- views

    public List<Membership> byStatus(MembershipStatus status) {
        return entities.filter(m -> m.status() == status);
    }

    public List<Membership> active() {
        return byStatus(MembershipStatus.ACTIVE);
    }

    public List<Membership> invited() {
        return byStatus(MembershipStatus.INVITED);
    }

    public List<Membership> suspended() {
        return byStatus(MembershipStatus.SUSPENDED);
    }

    public List<Membership> archived() {
        return byStatus(MembershipStatus.ARCHIVED);
    }

    public List<Membership> byRole(Role role) {
        return entities.filter(m -> m.role() == role);
    }

    public Optional<Membership> findByIdentity(String identityId) {
        return entities.filter(m -> m.identityId().equals(identityId)).stream().findFirst();
    }

    /**
     * The membership the session acts through: the acting organization, team or partner's
     * membership if it has one, else the principal's own.
     */
    public Optional<Membership> currentMembership() {
        Optional<ActiveContext> active = context.current();
        if (active.isEmpty() || !active.get().hasWorkspace()) {
            return Optional.empty();
        }
        ActiveContext ctx = active.get();
        if (ctx.scope().type() != ScopeType.USER) {
            Optional<Membership> scoped = findByIdentity(ctx.scope().id());
            if (scoped.isPresent()) {
                return scoped;
            }
        }
        return findByIdentity(ctx.principalId());
    }

    public Set<Capability> resolvedPermissions(String membershipId) {
        return entities.get(membershipId)
                .map(m -> PermissionEngine.resolve(m.role(), m.customPermissions()))
                .orElse(Set.of());
    }

    // ---------------------------------------------------------------- mutations

    /** Invites an identity into the open workspace. One membership per identity and workspace. */
    public CompletableFuture<StoreResult<Membership>> invite(MembershipDraft draft) {
        MutationGuard guard = MutationGuard.require(() -> draft != null, "invitation must not be null")
                .then(MutationGuard.require(() -> draft.identityId() != null && !draft.identityId().isBlank(),
                        "identityId must not be blank"))
                .then(MutationGuard.require(() -> draft.role() != null, "role must not be null"))
                .then(MutationGuard.require(() -> draft.role() != Role.OWNER, "cannot invite a second owner"))
                .then(MutationGuard.require(
                        () -> draft.workspaceId() != null
                                && draft.workspaceId().equals(context.currentWorkspaceId().orElse(null)),
                        "can only invite into the open workspace"))
                .then(MutationGuard.require(() -> findByIdentity(draft.identityId()).isEmpty(),
                        "identity is already a member of this workspace"))
                .then(gate.require(Capability.MEMBERS_INVITE));
        return entities.create(guard,
                tempId -> new Membership(tempId, draft.workspaceId(), draft.identityId(), draft.identityType(),
                        draft.email(), draft.displayName(), draft.role(), List.of(), MembershipStatus.INVITED,
                        null, null, draft.invitedBy()),
                () -> app.memberships().create(draft))
                .thenApply(result -> {
                    if (result.isSuccess()) {
                        log.info("Invitation created {}", REDACTOR.redact(invitationFields(result.value())));
                    }
                    return result;
                });
    }

    public CompletableFuture<StoreResult<Membership>> changeRole(String membershipId, Role role) {
        MutationGuard guard = MutationGuard.require(() -> role != null, "role must not be null")
                .then(MutationGuard.require(() -> role != Role.OWNER, "ownership cannot be assigned by role change"))
                .then(MutationGuard.require(() -> !isOwnerMembership(membershipId), "the owner's role cannot change"))
                .then(gate.require(Capability.MEMBERS_MANAGE_ROLES));
        MembershipPatch patch = MembershipPatch.role(role);
        return entities.update(guard, membershipId, patch::applyTo,
                () -> app.memberships().update(membershipId, patch));
    }

    /** Moves a membership along the status lifecycle; illegal transitions fail validation. */
    public CompletableFuture<StoreResult<Membership>> changeStatus(String membershipId, MembershipStatus target) {
        MutationGuard guard = MutationGuard.require(() -> target != null, "status must not be null")
                .then(MutationGuard.require(
                        () -> entities.get(membershipId).map(m -> m.status().canTransitionTo(target)).orElse(true),
                        "illegal membership status transition to " + target))
                .then(gate.require(Capability.MEMBERS_MANAGE_ROLES));
        MembershipPatch patch = MembershipPatch.status(target);
        return entities.update(guard, membershipId, patch::applyTo,
                () -> app.memberships().update(membershipId, patch));
    }

    public CompletableFuture<StoreResult<Membership>> grantCustomPermission(String membershipId, Capability capability) {
        return editCustomPermissions(membershipId, capability, true);
    }

    public CompletableFuture<StoreResult<Membership>> revokeCustomPermission(String membershipId, Capability capability) {
        return editCustomPermissions(membershipId, capability, false);
    }

    public CompletableFuture<StoreResult<Void>> remove(String membershipId) {
        MutationGuard guard = MutationGuard.require(() -> !isOwnerMembership(membershipId), "the owner cannot be removed")
                .then(gate.require(Capability.MEMBERS_REMOVE));
        return entities.delete(guard, membershipId, () -> app.memberships().delete(membershipId));
    }

    private CompletableFuture<StoreResult<Membership>> editCustomPermissions(
            String membershipId, Capability capability, boolean grant) {
        MutationGuard guard = MutationGuard.require(() -> capability != null, "capability must not be null")
                .then(gate.require(Capability.PERMISSIONS_EDIT));
        return entities.updateWithValue(guard, membershipId,
                m -> m.withCustomPermissions(edited(m.customPermissions(), capability, grant)),
                applied -> app.memberships().update(
                        membershipId, MembershipPatch.customPermissions(applied.customPermissions())));
    }

    private static List<String> edited(List<String> current, Capability capability, boolean grant) {
        Set<String> result = new LinkedHashSet<>(current);
        if (capability != null) {
            if (grant) {
                result.add(capability.value());
            } else {
                result.remove(capability.value());
            }
        }
        return new ArrayList<>(result);
    }

    private boolean isOwnerMembership(String membershipId) {
        return entities.get(membershipId).map(m -> m.role() == Role.OWNER).orElse(false);
    }

    private static Map<String, Object> invitationFields(Membership membership) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("membershipId", membership.id());
        fields.put("workspaceId", membership.workspaceId());
        fields.put("identityId", membership.identityId());
        fields.put("email", membership.email());
        fields.put("role", membership.role().value());
        return fields;
    }
}
