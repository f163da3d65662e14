package com.atrium.state.identity;

import java.time.Instant;
import java.util.Set;

/** External collaborator of an organization. Accesses workspaces but never owns one. */
public record Partner(
        String id,
        String organizationId,
        String displayName,
        String companyName,
        Set<String> memberIds,
        Set<String> workspaceIds,
        Instant createdAt,
        boolean active,
        boolean suspended
) implements Identity {

    public Partner {
        IdentityChecks.requireText(id, "id");
        IdentityChecks.requireText(organizationId, "organizationId");
        IdentityChecks.requireText(displayName, "displayName");
        memberIds = memberIds == null ? Set.of() : Set.copyOf(memberIds);
        workspaceIds = workspaceIds == null ? Set.of() : Set.copyOf(workspaceIds);
    }

    @Override
    public IdentityType type() {
        return IdentityType.PARTNER;
    }

    @Override
    public Partner withDisplayName(String displayName) {
        return new Partner(id, organizationId, displayName, companyName, memberIds, workspaceIds,
                createdAt, active, suspended);
    }
}
