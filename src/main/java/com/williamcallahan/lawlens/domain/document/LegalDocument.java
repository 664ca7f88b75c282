package com.williamcallahan.lawlens.domain.document;

import jakarta.validation.constraints.NotNull;

/**
 * Hierarchical document payload consumed once per document view.
 *
 * @param documentId id of the document in the repository, may be null for previews
 * @param header header metadata, may be null
 * @param root root of the structure tree
 */
public record LegalDocument(String documentId, DocumentHeader header, @NotNull DocumentNode root) {}
