package com.williamcallahan.lawlens.domain.retrieval;

import java.util.List;

/**
 * Full section payload returned by the document back end.
 *
 * @param heading section heading
 * @param content plain-text content
 * @param htmlContent rendered content, may be null
 * @param sectionType structural type, e.g. "section" or "subsection"
 * @param number section number, possibly with a trailing dot
 * @param eid element id of the section
 * @param legalReference backend-resolved legal reference, may be null
 * @param childElementIds ids of nested elements
 */
public record SectionResponse(
        String heading,
        String content,
        String htmlContent,
        String sectionType,
        String number,
        String eid,
        String legalReference,
        List<String> childElementIds) {

    public SectionResponse {
        childElementIds = childElementIds == null ? List.of() : List.copyOf(childElementIds);
    }
}
