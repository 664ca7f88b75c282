package com.williamcallahan.lawlens.domain.document;

/**
 * Inline pointer from a text fragment to a document footnote.
 *
 * @param marker display marker, e.g. "1" or "*"
 * @param footnoteId id of the referenced {@link FootnoteEntry}
 */
public record FootnoteRef(String marker, String footnoteId) {}
