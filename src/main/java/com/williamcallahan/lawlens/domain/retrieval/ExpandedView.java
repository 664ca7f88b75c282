package com.williamcallahan.lawlens.domain.retrieval;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.document.DocumentTable;
import java.util.List;

/**
 * Best available content for one cited source.
 *
 * @param displayExcerpt text to show
 * @param htmlContent rendered section, may be null
 * @param sectionData full section payload, may be null
 * @param tables server-provided structured tables
 * @param legalReference resolved reference for the heading, may be null
 * @param status whether the content was expanded
 */
public record ExpandedView(
        String displayExcerpt,
        String htmlContent,
        SectionResponse sectionData,
        List<DocumentTable> tables,
        String legalReference,
        ExpansionStatus status) {

    public ExpandedView {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    /**
     * View showing the original excerpt only.
     *
     * @param source cited source
     * @param legalReference reference resolved from the source alone, may be null
     * @return fallback view
     */
    public static ExpandedView fallback(ChatSource source, String legalReference) {
        return new ExpandedView(source.excerpt(), null, null, List.of(), legalReference, ExpansionStatus.FALLBACK);
    }

    public boolean isExpanded() {
        return status == ExpansionStatus.EXPANDED;
    }
}
