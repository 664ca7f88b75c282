package com.williamcallahan.lawlens.domain.document;

/**
 * A footnote declared on the document root.
 *
 * @param footnoteId stable id referenced by {@link FootnoteRef#footnoteId()}
 * @param marker display marker
 * @param content footnote text
 * @param amendingActTitle title of the act that introduced the amendment, may be null
 */
public record FootnoteEntry(String footnoteId, String marker, String content, String amendingActTitle) {}
