package com.atrium.state.identity;

import java.time.Instant;
import java.util.Set;

/**
 * A service account. Can be granted access to workspaces; can never own one or act as a scope.
 *
 * @param createdBy      user id of the creator
 * @param organizationId owning organization (nullable for personal bots)
 * @param permissions    API scopes granted to the bot
 */
public record Bot(
        String id,
        String displayName,
        String description,
        String createdBy,
        String organizationId,
        Set<String> permissions,
        Set<String> workspaceIds,
        BotStatus status,
        Instant createdAt,
        Instant updatedAt
) implements Identity {

    public Bot {
        IdentityChecks.requireText(id, "id");
        IdentityChecks.requireText(displayName, "displayName");
        IdentityChecks.requireText(createdBy, "createdBy");
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        workspaceIds = workspaceIds == null ? Set.of() : Set.copyOf(workspaceIds);
    }

    @Override
    public IdentityType type() {
        return IdentityType.BOT;
    }

    @Override
    public Bot withDisplayName(String displayName) {
        return new Bot(id, displayName, description, createdBy, organizationId, permissions, workspaceIds,
                status, createdAt, updatedAt);
    }

    public Bot withStatus(BotStatus status, Instant updatedAt) {
        return new Bot(id, displayName, description, createdBy, organizationId, permissions, workspaceIds,
                status, createdAt, updatedAt);
    }

    public boolean canAccess(String workspaceId) {
        return status == BotStatus.ACTIVE && workspaceIds.contains(workspaceId);
    }
}
