package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.document.LegalDocument;
import com.williamcallahan.lawlens.domain.document.RenderedDocument;
import com.williamcallahan.lawlens.domain.document.TocEntry;
import com.williamcallahan.lawlens.service.document.HierarchyRenderer;
import com.williamcallahan.lawlens.service.document.TableOfContentsExtractor;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Renders hierarchical legal documents and their tables of contents.
 */
@RestController
@RequestMapping(value = "/api/documents", produces = MediaType.APPLICATION_JSON_VALUE)
public class DocumentRenderController extends BaseController {

    private final HierarchyRenderer hierarchyRenderer;
    private final TableOfContentsExtractor tocExtractor;

    public DocumentRenderController(
            HierarchyRenderer hierarchyRenderer,
            TableOfContentsExtractor tocExtractor,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.hierarchyRenderer = hierarchyRenderer;
        this.tocExtractor = tocExtractor;
    }

    /**
     * Renders a document to HTML keyed by derived node ids.
     *
     * @param document document payload
     * @param highlightedNodeId node to highlight, e.g. the section a citation points at
     * @return HTML, table of contents and snippet payloads
     */
    @PostMapping(value = "/render", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RenderedDocument render(
            @Valid @RequestBody LegalDocument document,
            @RequestParam(name = "highlighted_node_id", required = false) String highlightedNodeId) {
        return hierarchyRenderer.render(document, highlightedNodeId);
    }

    @PostMapping(value = "/toc", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<TocEntry> tableOfContents(@Valid @RequestBody LegalDocument document) {
        return tocExtractor.extract(document.root());
    }
}
