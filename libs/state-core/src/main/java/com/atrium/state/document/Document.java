package com.atrium.state.document;

import com.atrium.state.store.Entity;
import java.time.Instant;
import java.util.Set;

/**
 * A folder, file or link inside a workspace.
 *
 * @param parentId containing folder, or null at the workspace root
 * @param size     bytes; zero for folders and links
 */
public record Document(
        String id,
        String workspaceId,
        String name,
        DocumentType type,
        String mimeType,
        long size,
        String parentId,
        String ownerId,
        Set<String> tags,
        String description,
        Instant createdAt,
        String createdBy,
        Instant updatedAt,
        String updatedBy
) implements Entity {

    public Document {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public boolean isFolder() {
        return type == DocumentType.FOLDER;
    }

    /** Last modification, falling back to creation. */
    public Instant lastTouchedAt() {
        return updatedAt != null ? updatedAt : createdAt;
    }

    Document with(String name, String description, String parentId, Set<String> tags,
                  Instant updatedAt, String updatedBy) {
        return new Document(id, workspaceId, name, type, mimeType, size, parentId, ownerId, tags, description,
                createdAt, createdBy, updatedAt, updatedBy);
    }
}
