package com.williamcallahan.lawlens.domain.document;

import java.util.Locale;

/**
 * Closed set of structural kinds a hierarchical legal document node can take.
 *
 * <p>Raw payloads carry free-form type strings. Anything not recognized resolves to
 * {@link #GENERIC} so rendering never fails on an unexpected kind.</p>
 */
public enum NodeType {
    PART,
    CHAPTER,
    SECTION,
    SUBSECTION,
    PARAGRAPH,
    SUBPARAGRAPH,
    SCHEDULE,
    ARTICLE,
    /**
     * Whole act or document; renders its children without a heading of its own.
     */
    DOCUMENT_ROOT,
    GENERIC;

    /**
     * Resolves a raw payload type string.
     *
     * @param rawType type string from the document payload, may be null
     * @return matching node type, {@link #GENERIC} when unrecognized
     */
    public static NodeType fromValue(String rawType) {
        if (rawType == null || rawType.isBlank()) {
            return GENERIC;
        }
        return switch (rawType.trim().toLowerCase(Locale.ROOT)) {
            case "part" -> PART;
            case "chapter" -> CHAPTER;
            case "section" -> SECTION;
            case "subsection" -> SUBSECTION;
            case "paragraph" -> PARAGRAPH;
            case "subparagraph" -> SUBPARAGRAPH;
            case "schedule" -> SCHEDULE;
            case "article" -> ARTICLE;
            case "act", "document" -> DOCUMENT_ROOT;
            default -> GENERIC;
        };
    }

    /**
     * Sub-levels are rendered with a parenthesized gutter and concatenate onto their parent
     * when building hierarchical labels.
     *
     * @return true for subsection, paragraph and subparagraph
     */
    public boolean isSubLevel() {
        return this == SUBSECTION || this == PARAGRAPH || this == SUBPARAGRAPH;
    }
}
