package com.atrium.state.context;

import java.time.Instant;

/**
 * Persistable form of an {@link ActiveContext}, so a host can reopen the last scope after restart.
 */
public record ContextSnapshot(
        String principalId,
        ScopeType scopeType,
        String scopeId,
        String organizationId,
        String workspaceId,
        Instant savedAt
) {

    public ContextSnapshot {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be null or blank");
        }
        if (scopeType == null) {
            throw new IllegalArgumentException("scopeType must not be null");
        }
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId must not be null or blank");
        }
    }

    public static ContextSnapshot of(ActiveContext context, Instant savedAt) {
        Scope scope = context.scope();
        return new ContextSnapshot(context.principalId(), scope.type(), scope.id(), scope.organizationId(),
                context.workspaceId(), savedAt);
    }

    public Scope scope() {
        return Scope.of(scopeType, scopeId, organizationId);
    }
}
