package com.atrium.state.workspace;

import java.time.Instant;

/** Partial update of a workspace; null fields are left unchanged. */
public record WorkspacePatch(
        String name,
        String displayName,
        String description,
        WorkspaceVisibility visibility,
        WorkspaceStatus status,
        Instant updatedAt
) {

    public static WorkspacePatch rename(String displayName, Instant at) {
        return new WorkspacePatch(null, displayName, null, null, null, at);
    }

    public static WorkspacePatch status(WorkspaceStatus status, Instant at) {
        return new WorkspacePatch(null, null, null, null, status, at);
    }

    public Workspace applyTo(Workspace workspace) {
        return workspace.with(
                name != null ? name : workspace.name(),
                displayName != null ? displayName : workspace.displayName(),
                description != null ? description : workspace.description(),
                visibility != null ? visibility : workspace.visibility(),
                status != null ? status : workspace.status(),
                updatedAt != null ? updatedAt : workspace.updatedAt());
    }
}
