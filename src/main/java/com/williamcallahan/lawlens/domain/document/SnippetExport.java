package com.williamcallahan.lawlens.domain.document;

/**
 * Payload handed to the "save snippet" feature for one rendered node.
 *
 * @param label human label, e.g. "Penal Code - Part II Section 3(2). Definitions"
 * @param documentId document the node belongs to
 * @param sectionId derived node id used for scroll linking
 * @param title node title, may be null
 * @param identifier node identifier, may be null
 * @param type raw structural type
 * @param hierarchicalPath path label without the title, e.g. "Part II Section 3(2)"
 */
public record SnippetExport(
        String label,
        String documentId,
        String sectionId,
        String title,
        String identifier,
        String type,
        String hierarchicalPath) {}
