package com.williamcallahan.lawlens.domain.document;

import java.util.List;

/**
 * Table-of-contents entry linking to a rendered node by its derived id.
 *
 * @param id anchor id of the target node
 * @param type lowercased structural type
 * @param identifier node identifier, may be null
 * @param title node title, may be null
 * @param label display label, e.g. "Part II – Offences"
 * @param depth nesting depth among ToC entries
 * @param children nested entries
 */
public record TocEntry(
        String id,
        String type,
        String identifier,
        String title,
        String label,
        int depth,
        List<TocEntry> children) {

    public TocEntry {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
