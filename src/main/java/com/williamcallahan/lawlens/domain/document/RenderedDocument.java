package com.williamcallahan.lawlens.domain.document;

import java.util.List;

/**
 * Output of one render pass.
 *
 * @param html rendered document, anchors keyed by derived node ids
 * @param toc table of contents
 * @param snippets snippet export payloads, one per rendered node, in document order
 */
public record RenderedDocument(String html, List<TocEntry> toc, List<SnippetExport> snippets) {

    public RenderedDocument {
        toc = toc == null ? List.of() : List.copyOf(toc);
        snippets = snippets == null ? List.of() : List.copyOf(snippets);
    }
}
