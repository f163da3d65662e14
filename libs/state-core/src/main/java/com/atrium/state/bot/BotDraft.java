package com.atrium.state.bot;

import java.util.Set;

public record BotDraft(
        String displayName,
        String description,
        String createdBy,
        String organizationId,
        Set<String> permissions,
        Set<String> workspaceIds
) {
}
