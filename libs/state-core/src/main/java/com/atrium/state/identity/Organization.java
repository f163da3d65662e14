package com.atrium.state.identity;

import java.time.Instant;
import java.util.Set;

/**
 * An organizational account. Holds member and owner user ids only, never user objects.
 */
public record Organization(
        String id,
        String displayName,
        String description,
        Set<String> memberIds,
        Set<String> ownerIds,
        String createdBy,
        Instant createdAt,
        boolean active
) implements Identity {

    public Organization {
        IdentityChecks.requireText(id, "id");
        IdentityChecks.requireText(displayName, "displayName");
        memberIds = memberIds == null ? Set.of() : Set.copyOf(memberIds);
        ownerIds = ownerIds == null ? Set.of() : Set.copyOf(ownerIds);
    }

    @Override
    public IdentityType type() {
        return IdentityType.ORGANIZATION;
    }

    @Override
    public Organization withDisplayName(String displayName) {
        return new Organization(id, displayName, description, memberIds, ownerIds, createdBy, createdAt, active);
    }

    public boolean isOwner(String userId) {
        return ownerIds.contains(userId);
    }
}
