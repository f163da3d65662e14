package com.atrium.state.workspace;

import com.atrium.state.identity.IdentityType;
import com.atrium.state.module.ModuleType;
import com.atrium.state.store.Entity;
import java.time.Instant;
import java.util.Set;

/**
 * A container of modules owned by a user or an organization. Holds no member lists; access is
 * granted through memberships.
 *
 * @param name           url-safe unique name, e.g. "my-project"
 * @param enabledModules modules switched on for this workspace
 * @param lastAccessedAt last time the principal opened it (null if never)
 */
public record Workspace(
        String id,
        String name,
        String displayName,
        String description,
        IdentityType ownerType,
        String ownerId,
        WorkspaceVisibility visibility,
        WorkspaceStatus status,
        Set<ModuleType> enabledModules,
        Instant createdAt,
        Instant updatedAt,
        String createdBy,
        Instant lastAccessedAt
) implements Entity {

    public Workspace {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (ownerType == null || !ownerType.canOwnWorkspace()) {
            throw new IllegalArgumentException("a " + ownerType + " cannot own a workspace");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        visibility = visibility == null ? WorkspaceVisibility.PRIVATE : visibility;
        enabledModules = enabledModules == null ? Set.of() : Set.copyOf(enabledModules);
    }

    public boolean isActive() {
        return status == WorkspaceStatus.ACTIVE;
    }

    public boolean isOwnedBy(String identityId) {
        return ownerId.equals(identityId);
    }

    public Workspace withLastAccessedAt(Instant accessedAt) {
        return new Workspace(id, name, displayName, description, ownerType, ownerId, visibility, status,
                enabledModules, createdAt, updatedAt, createdBy, accessedAt);
    }

    Workspace with(String name, String displayName, String description, WorkspaceVisibility visibility,
                   WorkspaceStatus status, Instant updatedAt) {
        return new Workspace(id, name, displayName, description, ownerType, ownerId, visibility, status,
                enabledModules, createdAt, updatedAt, createdBy, lastAccessedAt);
    }
}
