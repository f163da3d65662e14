package com.atrium.state.identity;

import java.time.Instant;
import java.util.Set;

/** Internal unit of an organization. Accesses workspaces but never owns one. */
public record Team(
        String id,
        String organizationId,
        String displayName,
        Set<String> memberIds,
        Set<String> leadIds,
        Set<String> workspaceIds,
        Instant createdAt,
        boolean active
) implements Identity {

    public Team {
        IdentityChecks.requireText(id, "id");
        IdentityChecks.requireText(organizationId, "organizationId");
        IdentityChecks.requireText(displayName, "displayName");
        memberIds = memberIds == null ? Set.of() : Set.copyOf(memberIds);
        leadIds = leadIds == null ? Set.of() : Set.copyOf(leadIds);
        workspaceIds = workspaceIds == null ? Set.of() : Set.copyOf(workspaceIds);
    }

    @Override
    public IdentityType type() {
        return IdentityType.TEAM;
    }

    @Override
    public Team withDisplayName(String displayName) {
        return new Team(id, organizationId, displayName, memberIds, leadIds, workspaceIds, createdAt, active);
    }
}
