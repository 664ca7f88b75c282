package com.williamcallahan.lawlens.domain.citation;

/**
 * Legal citation found in prose, such as "Section 19(2)(a)", resolved to an element id.
 *
 * @param text matched text
 * @param eId element id, e.g. "sec_19__subsec_2__para_a"
 * @param kind structural unit
 * @param number main number in arabic digits
 * @param subsection subsection number, may be null
 * @param paragraph paragraph letter, may be null
 * @param subparagraph subparagraph number in arabic digits, may be null
 * @param start offset of the match in the input
 * @param end offset just past the match
 */
public record LegalCitation(
        String text,
        String eId,
        LegalCitationKind kind,
        String number,
        String subsection,
        String paragraph,
        String subparagraph,
        int start,
        int end) {}
