package com.williamcallahan.lawlens.domain.retrieval;

import com.williamcallahan.lawlens.domain.document.DocumentTable;
import java.util.List;

/**
 * Widened excerpt returned by the expand-source call.
 *
 * @param fullExcerpt surrounding text, may be null
 * @param tables structured tables near the excerpt
 */
public record ExpandedExcerpt(String fullExcerpt, List<DocumentTable> tables) {

    public ExpandedExcerpt {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
}
