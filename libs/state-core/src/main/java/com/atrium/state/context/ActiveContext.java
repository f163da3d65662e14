package com.atrium.state.context;

import java.util.Objects;

/**
 * Who is signed in, which identity they act as, and which workspace (if any) is open.
 *
 * @param principalId signed-in user
 * @param scope       identity being acted as
 * @param workspaceId selected workspace, or null
 */
public record ActiveContext(String principalId, Scope scope, String workspaceId) {

    public ActiveContext {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be null or blank");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        if (workspaceId != null && workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be blank");
        }
    }

    public boolean hasWorkspace() {
        return workspaceId != null;
    }

    public ActiveContext withWorkspace(String workspaceId) {
        return new ActiveContext(principalId, scope, workspaceId);
    }

    /** Same principal, same scope (type and id) and same workspace. */
    public boolean sameAs(ActiveContext other) {
        return other != null
                && principalId.equals(other.principalId)
                && scope.sameAs(other.scope)
                && Objects.equals(workspaceId, other.workspaceId);
    }

    public ContextPhase phase() {
        return workspaceId == null ? ContextPhase.IDENTITY_ACTIVE : ContextPhase.WORKSPACE_ACTIVE;
    }
}
