package com.williamcallahan.lawlens.domain.document;

import java.util.List;
import java.util.Objects;

/**
 * One node of a hierarchical legal document.
 *
 * <p>The tree is immutable and single-owner: every list is copied on construction and a node
 * only ever appears under one parent. Cross-referencing uses the derived node id, never
 * object identity.</p>
 *
 * @param type raw structural type from the payload (e.g. "part", "section", "division")
 * @param aknEid stable externally-assigned element id, may be null
 * @param identifier number or label of the node, e.g. "II", "3", "a"
 * @param title heading text, may be null
 * @param text plain text paragraphs; null entries are dropped
 * @param styledText amendment-aware paragraphs; preferred over {@code text} when present
 * @param children ordered child nodes
 * @param tables ordered tables attached to this node
 * @param footnotes footnotes declared for the whole document (root only)
 */
public record DocumentNode(
        String type,
        String aknEid,
        String identifier,
        String title,
        List<String> text,
        List<StyledTextBlock> styledText,
        List<DocumentNode> children,
        List<DocumentTable> tables,
        List<FootnoteEntry> footnotes) {

    public DocumentNode {
        text = text == null ? List.of() : text.stream().filter(Objects::nonNull).toList();
        styledText = styledText == null ? List.of() : List.copyOf(styledText);
        children = children == null ? List.of() : List.copyOf(children);
        tables = tables == null ? List.of() : List.copyOf(tables);
        footnotes = footnotes == null ? List.of() : List.copyOf(footnotes);
    }

    /**
     * Resolves the raw type into the closed node variant.
     *
     * @return structural kind, {@link NodeType#GENERIC} when unrecognized
     */
    public NodeType nodeType() {
        return NodeType.fromValue(type);
    }

    public boolean hasStyledText() {
        return !styledText.isEmpty();
    }

    /**
     * Starts a builder for hand-assembled trees.
     *
     * @param type raw structural type
     * @return new builder
     */
    public static Builder builder(String type) {
        return new Builder(type);
    }

    /**
     * Fluent builder used by tests and fixtures.
     */
    public static final class Builder {
        private final String type;
        private String aknEid;
        private String identifier;
        private String title;
        private List<String> text = List.of();
        private List<StyledTextBlock> styledText = List.of();
        private List<DocumentNode> children = List.of();
        private List<DocumentTable> tables = List.of();
        private List<FootnoteEntry> footnotes = List.of();

        private Builder(String type) {
            this.type = type;
        }

        public Builder aknEid(String aknEid) {
            this.aknEid = aknEid;
            return this;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder text(String... paragraphs) {
            this.text = List.of(paragraphs);
            return this;
        }

        public Builder styledText(StyledTextBlock... blocks) {
            this.styledText = List.of(blocks);
            return this;
        }

        public Builder children(DocumentNode... children) {
            this.children = List.of(children);
            return this;
        }

        public Builder tables(DocumentTable... tables) {
            this.tables = List.of(tables);
            return this;
        }

        public Builder footnotes(FootnoteEntry... footnotes) {
            this.footnotes = List.of(footnotes);
            return this;
        }

        public DocumentNode build() {
            return new DocumentNode(type, aknEid, identifier, title, text, styledText, children, tables, footnotes);
        }
    }
}
