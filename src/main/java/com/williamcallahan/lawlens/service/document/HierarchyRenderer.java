package com.williamcallahan.lawlens.service.document;

import com.williamcallahan.lawlens.domain.document.AncestorEntry;
import com.williamcallahan.lawlens.domain.document.DocumentHeader;
import com.williamcallahan.lawlens.domain.document.DocumentNode;
import com.williamcallahan.lawlens.domain.document.FootnoteEntry;
import com.williamcallahan.lawlens.domain.document.FootnoteRef;
import com.williamcallahan.lawlens.domain.document.FragmentStyle;
import com.williamcallahan.lawlens.domain.document.LegalDocument;
import com.williamcallahan.lawlens.domain.document.NodeType;
import com.williamcallahan.lawlens.domain.document.RenderedDocument;
import com.williamcallahan.lawlens.domain.document.SnippetExport;
import com.williamcallahan.lawlens.domain.document.StyledTextBlock;
import com.williamcallahan.lawlens.domain.document.TextFragment;
import com.williamcallahan.lawlens.domain.document.TocEntry;
import com.williamcallahan.lawlens.service.table.TableHtmlRenderer;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renders a hierarchical legal document to HTML.
 *
 * <p>Every rendered node carries its derived id, so ToC entries, citation links and bookmarks
 * can scroll to it. The whole pass is a pure function of the document; no state is kept
 * between calls.</p>
 */
@Service
public class HierarchyRenderer {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyRenderer.class);

    static final String HIGHLIGHT_CLASS = "section-highlighted";
    private static final String EN_DASH_SEPARATOR = " – ";
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.UK);
    private static final int ISO_DATE_LENGTH = 10;

    private final TableHtmlRenderer tableRenderer;
    private final TableOfContentsExtractor tocExtractor;
    private final SnippetExportFactory snippetFactory;

    public HierarchyRenderer(
            TableHtmlRenderer tableRenderer,
            TableOfContentsExtractor tocExtractor,
            SnippetExportFactory snippetFactory) {
        this.tableRenderer = tableRenderer;
        this.tocExtractor = tocExtractor;
        this.snippetFactory = snippetFactory;
    }

    /**
     * Renders the document, its table of contents and snippet payloads.
     *
     * @param document document to render
     * @param highlightedNodeId derived id of the node to highlight, may be null
     * @return rendered output
     */
    public RenderedDocument render(LegalDocument document, String highlightedNodeId) {
        RenderPass pass = new RenderPass(document, highlightedNodeId);
        Element article = new Element("article").addClass("legal-document");
        if (document.header() != null) {
            article.appendChild(renderHeader(document.header()));
        }
        Element body = article.appendElement("div").addClass("hierarchy-body");
        pass.renderNode(document.root(), body, List.of(), 0);

        if (!document.root().footnotes().isEmpty()) {
            article.appendChild(renderFootnotes(document.root().footnotes()));
        }

        List<TocEntry> toc = tocExtractor.extract(document.root());
        logger.debug("Rendered document {} with {} snippets and {} top-level ToC entries",
                document.documentId(), pass.snippets.size(), toc.size());
        return new RenderedDocument(article.outerHtml(), toc, pass.snippets);
    }

    /**
     * Renders the document header block.
     *
     * @param header header metadata
     * @return header element
     */
    Element renderHeader(DocumentHeader header) {
        Element element = new Element("header").addClass("document-header");
        if (hasText(header.jurisdiction())) {
            String jurisdiction = "UG".equals(header.jurisdiction()) ? "Uganda" : header.jurisdiction();
            element.appendElement("div").addClass("jurisdiction").text(jurisdiction);
        }
        if (hasText(header.title())) {
            element.appendElement("h1").text(header.title());
        }
        if (hasText(header.shortTitle()) && !header.shortTitle().equals(header.title())) {
            element.appendElement("div").addClass("short-title").text(header.shortTitle());
        }
        if (hasText(header.chapter())) {
            element.appendElement("div").addClass("chapter").text("Chapter " + header.chapter());
        }
        if (hasText(header.publicationDate())) {
            element.appendElement("div").addClass("publication-date")
                    .text("Published on " + formatDate(header.publicationDate()));
        }
        if (hasText(header.commencementDate())) {
            element.appendElement("div").addClass("commencement-date")
                    .text("Commenced on " + formatDate(header.commencementDate()));
        }
        if (header.actYear() != null) {
            element.appendElement("div").addClass("act-year").text("[Act " + header.actYear() + "]");
        }
        return element;
    }

    static String formatDate(String isoDate) {
        String datePart = isoDate.length() > ISO_DATE_LENGTH ? isoDate.substring(0, ISO_DATE_LENGTH) : isoDate;
        try {
            return LocalDate.parse(datePart).format(DISPLAY_DATE);
        } catch (DateTimeParseException unparseable) {
            logger.debug("Showing unparseable date as-is: {}", isoDate);
            return isoDate;
        }
    }

    private Element renderFootnotes(List<FootnoteEntry> footnotes) {
        Element section = new Element("div").addClass("footnotes-section");
        section.appendElement("h3").text("Footnotes");
        Element list = section.appendElement("ol");
        for (FootnoteEntry footnote : footnotes) {
            Element item = list.appendElement("li").attr("id", "footnote-" + footnote.footnoteId());
            item.appendElement("sup").text(nullToEmpty(footnote.marker()));
            Element content = item.appendElement("div");
            content.appendElement("span").text(nullToEmpty(footnote.content()));
            if (hasText(footnote.amendingActTitle())) {
                content.appendElement("span").addClass("amending-act")
                        .text("[" + footnote.amendingActTitle() + "]");
            }
        }
        return section;
    }

    /**
     * State of a single render call.
     */
    private final class RenderPass {
        private final LegalDocument document;
        private final String highlightedNodeId;
        private final Map<String, FootnoteEntry> footnotesById = new LinkedHashMap<>();
        private final List<SnippetExport> snippets = new ArrayList<>();

        RenderPass(LegalDocument document, String highlightedNodeId) {
            this.document = document;
            this.highlightedNodeId = highlightedNodeId;
            for (FootnoteEntry footnote : document.root().footnotes()) {
                footnotesById.putIfAbsent(footnote.footnoteId(), footnote);
            }
        }

        void renderNode(DocumentNode node, Element parent, List<AncestorEntry> ancestors, int depth) {
            NodeType type = node.nodeType();
            if (type == NodeType.DOCUMENT_ROOT) {
                appendBody(node, parent, ancestors, depth);
                return;
            }
            snippets.add(snippetFactory.create(document.documentId(), document.header(), ancestors, node));

            Element element = switch (type) {
                case PART -> headedBlock(node, parent, "hierarchy-part", "h2",
                        dashedHeading("PART", node));
                case CHAPTER -> headedBlock(node, parent, "hierarchy-chapter", "h3",
                        dashedHeading("Chapter", node));
                case SECTION -> headedBlock(node, parent, "hierarchy-section", "div",
                        numberedHeading(node.identifier(), node.title()));
                case SUBSECTION, PARAGRAPH, SUBPARAGRAPH -> gutterBlock(node, parent, type);
                case SCHEDULE -> {
                    parent.appendElement("hr").addClass("schedule-separator");
                    yield headedBlock(node, parent, "hierarchy-schedule", "h2",
                            dashedHeading("Schedule", node));
                }
                case ARTICLE -> headedBlock(node, parent, "hierarchy-article", "div",
                        numberedHeading(hasText(node.identifier()) ? "Article " + node.identifier() : null,
                                node.title()));
                case GENERIC -> genericBlock(node, parent, depth);
                case DOCUMENT_ROOT -> throw new IllegalStateException("Document root is rendered without a wrapper");
            };
            appendBody(node, element, ancestors, depth);
        }

        private Element headedBlock(DocumentNode node, Element parent, String cssClass, String headingTag, String heading) {
            Element section = anchored(node, parent.appendElement("section").addClass(cssClass));
            Element headingElement = section.appendElement(headingTag).addClass("node-heading");
            if (!heading.isEmpty()) {
                headingElement.text(heading);
            }
            return section;
        }

        private Element gutterBlock(DocumentNode node, Element parent, NodeType type) {
            Element block = anchored(node, parent.appendElement("div")
                    .addClass("hierarchy-" + type.name().toLowerCase(Locale.ROOT)));
            block.appendElement("div").addClass("gutter")
                    .text(hasText(node.identifier()) ? "(" + node.identifier() + ")" : "");
            Element body = block.appendElement("div").addClass("indented-body");
            if (hasText(node.title())) {
                body.appendElement("div").addClass("node-title").text(node.title());
            }
            return body;
        }

        private Element genericBlock(DocumentNode node, Element parent, int depth) {
            Element block = anchored(node, parent.appendElement("div").addClass("hierarchy-generic"));
            if (depth > 0) {
                block.addClass("nested");
            }
            if (hasText(node.identifier()) || hasText(node.title())) {
                block.appendElement("div").addClass("node-heading")
                        .text(numberedHeading(node.identifier(), node.title()));
            }
            return block;
        }

        private Element anchored(DocumentNode node, Element element) {
            String nodeId = NodeIdDeriver.deriveNodeId(node);
            element.attr("id", nodeId);
            String sectionTitle = hasText(node.title()) ? node.title() : node.identifier();
            if (hasText(sectionTitle)) {
                element.attr("data-section-title", sectionTitle);
            }
            if (nodeId.equals(highlightedNodeId)) {
                element.addClass(HIGHLIGHT_CLASS);
            }
            return element;
        }

        private void appendBody(DocumentNode node, Element target, List<AncestorEntry> ancestors, int depth) {
            appendContent(node, target);
            node.tables().forEach(table -> target.appendChild(tableRenderer.renderStructured(table)));
            if (node.children().isEmpty()) {
                return;
            }
            List<AncestorEntry> childPath = AncestorPathFormatter.descend(ancestors, node);
            int childDepth = node.nodeType() == NodeType.DOCUMENT_ROOT ? depth : depth + 1;
            for (DocumentNode child : node.children()) {
                renderNode(child, target, childPath, childDepth);
            }
        }

        private void appendContent(DocumentNode node, Element target) {
            if (node.hasStyledText()) {
                Element content = target.appendElement("div").addClass("node-content");
                for (StyledTextBlock block : node.styledText()) {
                    Element paragraph = content.appendElement("p");
                    block.fragments().forEach(fragment -> appendFragment(fragment, paragraph));
                }
                return;
            }
            if (node.text().isEmpty()) {
                return;
            }
            Element content = target.appendElement("div").addClass("node-content");
            node.text().forEach(paragraph -> content.appendElement("p").text(paragraph));
        }

        private void appendFragment(TextFragment fragment, Element paragraph) {
            FragmentStyle style = AmendmentStyler.resolve(fragment);
            Element span = paragraph.appendElement(style.superscript() ? "sup" : "span").text(fragment.text());
            String classes = style.cssClasses();
            if (!classes.isEmpty()) {
                span.attr("class", classes);
            }
            if (hasText(style.color())) {
                span.attr("style", "color: " + style.color());
            }
            for (FootnoteRef ref : fragment.footnoteRefs()) {
                span.appendElement("sup").addClass("footnote-ref")
                        .attr("title", footnoteTooltip(ref))
                        .text(nullToEmpty(ref.marker()));
            }
        }

        private String footnoteTooltip(FootnoteRef ref) {
            FootnoteEntry footnote = ref.footnoteId() == null ? null : footnotesById.get(ref.footnoteId());
            if (footnote == null) {
                return "Footnote " + nullToEmpty(ref.marker());
            }
            return "Footnote " + nullToEmpty(ref.marker()) + ": " + nullToEmpty(footnote.content());
        }
    }

    static String dashedHeading(String kind, DocumentNode node) {
        boolean hasId = hasText(node.identifier());
        boolean hasTitle = hasText(node.title());
        if (hasId && hasTitle) {
            return kind + " " + node.identifier() + EN_DASH_SEPARATOR + node.title();
        }
        if (hasId) {
            return kind + " " + node.identifier();
        }
        return hasTitle ? node.title() : "";
    }

    static String numberedHeading(String number, String title) {
        boolean hasNumber = hasText(number);
        boolean hasTitle = hasText(title);
        if (hasNumber && hasTitle) {
            return number + ". " + title;
        }
        if (hasNumber) {
            return number + ".";
        }
        return hasTitle ? title : "";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
