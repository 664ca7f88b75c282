package com.williamcallahan.lawlens.domain.citation;

/**
 * Number of cited sources of one document type.
 *
 * @param documentType type being counted
 * @param count occurrences, always positive
 */
public record DocumentTypeCount(DocumentType documentType, int count) {}
