package com.atrium.state.membership;

import com.atrium.permissions.Capability;
import com.atrium.permissions.PermissionEngine;
import com.atrium.permissions.Role;
import com.atrium.state.identity.IdentityType;
import com.atrium.state.store.Entity;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Links one identity to one workspace with a role.
 *
 * @param customPermissions capability strings granted on top of the role defaults
 * @param invitedBy         user id of the inviter (null for the owner's own membership)
 */
public record Membership(
        String id,
        String workspaceId,
        String identityId,
        IdentityType identityType,
        String email,
        String displayName,
        Role role,
        List<String> customPermissions,
        MembershipStatus status,
        Instant joinedAt,
        Instant lastActiveAt,
        String invitedBy
) implements Entity {

    public Membership {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be null or blank");
        }
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("identityId must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        customPermissions = customPermissions == null ? List.of() : List.copyOf(customPermissions);
    }

    public boolean isActive() {
        return status == MembershipStatus.ACTIVE;
    }

    public Set<Capability> resolvedCapabilities() {
        return PermissionEngine.resolve(role, customPermissions);
    }

    public boolean hasPermission(Capability capability) {
        return PermissionEngine.hasPermission(role, capability, customPermissions);
    }

    public Membership withRole(Role role) {
        return new Membership(id, workspaceId, identityId, identityType, email, displayName, role,
                customPermissions, status, joinedAt, lastActiveAt, invitedBy);
    }

    public Membership withStatus(MembershipStatus status) {
        return new Membership(id, workspaceId, identityId, identityType, email, displayName, role,
                customPermissions, status, joinedAt, lastActiveAt, invitedBy);
    }

    public Membership withCustomPermissions(List<String> customPermissions) {
        return new Membership(id, workspaceId, identityId, identityType, email, displayName, role,
                customPermissions, status, joinedAt, lastActiveAt, invitedBy);
    }
}
