package com.atrium.state.workspace;

import com.atrium.state.identity.IdentityType;

public record WorkspaceDraft(
        String name,
        String displayName,
        String description,
        IdentityType ownerType,
        String ownerId,
        WorkspaceVisibility visibility,
        String createdBy
) {
}
