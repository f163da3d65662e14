package com.atrium.state.document;

import java.util.Set;

public record DocumentDraft(
        String workspaceId,
        String name,
        DocumentType type,
        String mimeType,
        long size,
        String parentId,
        Set<String> tags,
        String description,
        String createdBy
) {
}
