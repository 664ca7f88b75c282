package com.williamcallahan.lawlens.service.document;

import com.williamcallahan.lawlens.domain.document.DocumentNode;
import com.williamcallahan.lawlens.domain.document.TocEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Extracts a nested table of contents from a document tree.
 *
 * <p>Only navigational levels appear. Nodes of other kinds are skipped while their
 * descendants are still searched at the same depth.</p>
 */
@Component
public class TableOfContentsExtractor {
    private static final Set<String> TOC_TYPES = Set.of("part", "chapter", "section", "schedule", "article", "division");

    public List<TocEntry> extract(DocumentNode root) {
        if (root == null) {
            return List.of();
        }
        return collect(root, 0);
    }

    private List<TocEntry> collect(DocumentNode node, int depth) {
        String type = node.type() == null ? "" : node.type().toLowerCase(Locale.ROOT);
        boolean labelled = hasText(node.identifier()) || hasText(node.title());
        if (TOC_TYPES.contains(type) && labelled) {
            List<TocEntry> children = new ArrayList<>();
            for (DocumentNode child : node.children()) {
                children.addAll(collect(child, depth + 1));
            }
            return List.of(new TocEntry(
                    NodeIdDeriver.deriveNodeId(node),
                    type,
                    node.identifier(),
                    node.title(),
                    formatLabel(type, node.identifier(), node.title()),
                    depth,
                    children));
        }
        List<TocEntry> entries = new ArrayList<>();
        for (DocumentNode child : node.children()) {
            entries.addAll(collect(child, depth));
        }
        return entries;
    }

    static String formatLabel(String type, String identifier, String title) {
        boolean hasId = hasText(identifier);
        boolean hasTitle = hasText(title);
        return switch (type) {
            case "part" -> dashed("Part", identifier, title);
            case "chapter" -> dashed("Chapter", identifier, title);
            case "schedule" -> dashed("Schedule", identifier, title);
            case "section" -> hasId && hasTitle
                    ? identifier + ". " + title
                    : hasId ? "Section " + identifier : fallback(title, "Section");
            case "article" -> hasId && hasTitle
                    ? "Article " + identifier + ". " + title
                    : hasId ? "Article " + identifier : fallback(title, "Article");
            default -> hasId && hasTitle
                    ? identifier + ". " + title
                    : hasId ? identifier : fallback(title, type);
        };
    }

    private static String dashed(String kind, String identifier, String title) {
        if (hasText(identifier) && hasText(title)) {
            return kind + " " + identifier + " – " + title;
        }
        return hasText(identifier) ? kind + " " + identifier : fallback(title, kind);
    }

    private static String fallback(String title, String defaultLabel) {
        return hasText(title) ? title : defaultLabel;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
