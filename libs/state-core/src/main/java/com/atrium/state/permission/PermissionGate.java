package com.atrium.state.permission;

import com.atrium.permissions.Capability;
import com.atrium.permissions.PermissionEngine;
import com.atrium.state.membership.Membership;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.StoreError;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns the acting identity's membership in the open workspace into mutation guards.
 *
 * <p>The membership is read at check time, so a guard built once stays correct across role
 * changes. A missing or non-active membership grants nothing.
 */
public final class PermissionGate {

    private final Supplier<Optional<Membership>> membership;

    public PermissionGate(Supplier<Optional<Membership>> membership) {
        if (membership == null) {
            throw new IllegalArgumentException("membership must not be null");
        }
        this.membership = membership;
    }

    /** A gate that denies everything; for stores used without a membership source. */
    public static PermissionGate denyAll() {
        return new PermissionGate(Optional::empty);
    }

    public boolean allows(Capability capability) {
        return activeMembership().map(m -> m.hasPermission(capability)).orElse(false);
    }

    /** Same check, restricted to a membership of the given workspace. */
    public boolean allows(String workspaceId, Capability capability) {
        return activeMembership()
                .filter(m -> m.workspaceId().equals(workspaceId))
                .map(m -> m.hasPermission(capability))
                .orElse(false);
    }

    /** Effective capabilities in the open workspace; empty without an active membership. */
    public Set<Capability> capabilities() {
        return activeMembership()
                .map(m -> PermissionEngine.resolve(m.role(), m.customPermissions()))
                .orElse(Set.of());
    }

    public MutationGuard require(Capability capability) {
        return () -> allows(capability) ? Optional.empty() : Optional.of(denied(capability));
    }

    public MutationGuard require(String workspaceId, Capability capability) {
        return () -> allows(workspaceId, capability) ? Optional.empty() : Optional.of(denied(capability));
    }

    private Optional<Membership> activeMembership() {
        return membership.get().filter(Membership::isActive);
    }

    private static StoreError denied(Capability capability) {
        return StoreError.permissionDenied("missing capability " + capability.value());
    }
}
