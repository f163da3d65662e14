package com.atrium.state.document;

import com.atrium.permissions.Capability;
import com.atrium.state.app.AppContext;
import com.atrium.state.context.ActiveContext;
import com.atrium.state.context.ContextStore;
import com.atrium.state.permission.PermissionGate;
import com.atrium.state.store.MutationGuard;
import com.atrium.state.store.ScopeKey;
import com.atrium.state.store.ScopedStore;
import com.atrium.state.store.StoreResult;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Documents of the open workspace. Every mutation is gated by the acting identity's membership.
 */
public final class DocumentStore extends ScopedStore<Document> {

    static final String STARRED = "starred";

    private final PermissionGate gate;

    public DocumentStore(AppContext app, ContextStore context, PermissionGate gate) {
        super(app, context, "documents");
        if (gate == null) {
            throw new IllegalArgumentException("gate must not be null");
        }
        this.gate = gate;
        followCurrentContext();
    }

    @Override
    protected ScopeKey scopeFor(ActiveContext active) {
        return active.hasWorkspace() ? ScopeKey.workspace(active.workspaceId()) : null;
    }

    @Override
    protected CompletableFuture<List<Document>> fetch(ScopeKey key) {
        return app.documents().listByScope(key);
    }

    public List<Document> folders() {
        return byType(DocumentType.FOLDER);
    }

    public List<Document> files() {
        return byType(DocumentType.FILE);
    }

    public List<Document> links() {
        return byType(DocumentType.LINK);
    }

    public List<Document> byType(DocumentType type) {
        return entities.filter(document -> document.type() == type);
    }

    /** Direct children of a folder; null lists the workspace root. */
    public List<Document> children(String parentId) {
        return entities.filter(document -> Objects.equals(document.parentId(), parentId));
    }

    public List<Document> tagged(String tag) {
        return entities.filter(document -> document.tags().contains(tag));
    }

    public List<Document> starred() {
        return entities.indexed(STARRED);
    }

    public boolean isStarred(String documentId) {
        return entities.index(STARRED).contains(documentId);
    }

    /** Most recently touched documents first, up to the configured limit. */
    public List<Document> recent() {
        return recent(app.recentDocumentLimit());
    }

    public List<Document> recent(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        return entities.all().stream()
                .sorted(Comparator.comparing(Document::lastTouchedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .collect(Collectors.toList());
    }

    public CompletableFuture<StoreResult<Document>> create(DocumentDraft draft) {
        MutationGuard guard = MutationGuard.require(() -> draft != null, "document must not be null")
                .then(MutationGuard.require(() -> draft.name() != null && !draft.name().isBlank(),
                        "name must not be blank"))
                .then(MutationGuard.require(() -> draft.type() != null, "type must not be null"))
                .then(MutationGuard.require(
                        () -> draft.workspaceId() != null
                                && draft.workspaceId().equals(context.currentWorkspaceId().orElse(null)),
                        "can only create documents in the open workspace"))
                .then(MutationGuard.require(
                        () -> draft.parentId() == null
                                || entities.get(draft.parentId()).map(Document::isFolder).orElse(false),
                        "parent must be a cached folder"))
                .then(gate.require(Capability.DOCUMENTS_CREATE));
        return entities.create(guard, tempId -> {
            Instant now = app.clock().instant();
            return new Document(tempId, draft.workspaceId(), draft.name(), draft.type(), draft.mimeType(),
                    draft.size(), draft.parentId(), draft.createdBy(), draft.tags(), draft.description(),
                    now, draft.createdBy(), now, draft.createdBy());
        }, () -> app.documents().create(draft));
    }

    public CompletableFuture<StoreResult<Document>> rename(String documentId, String name) {
        return update(documentId, DocumentPatch.rename(name, app.clock().instant(), actor()));
    }

    public CompletableFuture<StoreResult<Document>> update(String documentId, DocumentPatch patch) {
        MutationGuard guard = MutationGuard.require(() -> patch != null, "patch must not be null")
                .then(MutationGuard.require(() -> patch.name() == null || !patch.name().isBlank(),
                        "name must not be blank"))
                .then(MutationGuard.require(() -> !Objects.equals(documentId, patch.parentId()),
                        "a document cannot contain itself"))
                .then(gate.require(Capability.DOCUMENTS_EDIT));
        return entities.update(guard, documentId, patch::applyTo,
                () -> app.documents().update(documentId, patch));
    }

    public CompletableFuture<StoreResult<Void>> delete(String documentId) {
        return entities.delete(gate.require(Capability.DOCUMENTS_DELETE), documentId,
                () -> app.documents().delete(documentId));
    }

    /** Local only. */
    public boolean star(String documentId) {
        return entities.addToIndex(STARRED, documentId);
    }

    public boolean unstar(String documentId) {
        return entities.removeFromIndex(STARRED, documentId);
    }

    public CompletableFuture<StoreResult<Document>> refresh(String documentId) {
        return entities.refresh(documentId, () -> app.documents().getById(documentId));
    }

    private String actor() {
        return context.current().map(ActiveContext::principalId).orElse(null);
    }
}
