package com.atrium.state.port;

import com.atrium.state.document.Document;
import com.atrium.state.document.DocumentDraft;
import com.atrium.state.document.DocumentPatch;

/** Scope key {@code workspace:<id>}. */
public interface DocumentRepository extends EntityRepository<Document, DocumentDraft, DocumentPatch> {
}
