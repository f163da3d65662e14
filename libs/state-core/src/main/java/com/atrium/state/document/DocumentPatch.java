package com.atrium.state.document;

import java.time.Instant;
import java.util.Set;

/**
 * Partial update; null fields are left unchanged. A document cannot be moved back to the root
 * through a patch.
 */
public record DocumentPatch(
        String name,
        String description,
        String parentId,
        Set<String> tags,
        Instant updatedAt,
        String updatedBy
) {

    public static DocumentPatch rename(String name, Instant at, String by) {
        return new DocumentPatch(name, null, null, null, at, by);
    }

    public Document applyTo(Document document) {
        return document.with(
                name != null ? name : document.name(),
                description != null ? description : document.description(),
                parentId != null ? parentId : document.parentId(),
                tags != null ? tags : document.tags(),
                updatedAt != null ? updatedAt : document.updatedAt(),
                updatedBy != null ? updatedBy : document.updatedBy());
    }
}
