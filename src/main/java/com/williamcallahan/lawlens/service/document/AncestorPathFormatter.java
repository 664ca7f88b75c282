package com.williamcallahan.lawlens.service.document;

import com.williamcallahan.lawlens.domain.document.AncestorEntry;
import com.williamcallahan.lawlens.domain.document.DocumentNode;
import com.williamcallahan.lawlens.domain.document.NodeType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds human labels like "Part II Section 3(2)(a). Title" from an ancestor path.
 *
 * <p>Sub-levels concatenate onto the previous entry with no separator; every other level is
 * space-joined. Document-root entries contribute nothing.</p>
 */
public final class AncestorPathFormatter {

    private AncestorPathFormatter() {}

    /**
     * Extends a path by one level without touching the original list.
     *
     * @param path current path
     * @param node node being descended into
     * @return new immutable path
     */
    public static List<AncestorEntry> descend(List<AncestorEntry> path, DocumentNode node) {
        List<AncestorEntry> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(AncestorEntry.of(node));
        return List.copyOf(extended);
    }

    /**
     * Formats the path to {@code currentNode}.
     *
     * @param path ancestors from the root, outermost first
     * @param currentNode node being labelled
     * @return path and full label
     */
    public static HierarchicalLabel formatPath(List<AncestorEntry> path, DocumentNode currentNode) {
        List<String> parts = new ArrayList<>();
        for (AncestorEntry entry : path) {
            append(parts, entry);
        }
        append(parts, AncestorEntry.of(currentNode));

        String hierarchicalPath = String.join(" ", parts);
        String title = currentNode.title();
        String fullLabel = title == null || title.isBlank()
                ? hierarchicalPath
                : hierarchicalPath + ". " + title;
        return new HierarchicalLabel(hierarchicalPath, fullLabel);
    }

    private static void append(List<String> parts, AncestorEntry entry) {
        NodeType type = entry.nodeType();
        if (type == NodeType.DOCUMENT_ROOT) {
            return;
        }
        String formatted = label(entry);
        if (type.isSubLevel() && !parts.isEmpty()) {
            int last = parts.size() - 1;
            parts.set(last, parts.get(last) + formatted);
        } else {
            parts.add(formatted);
        }
    }

    static String label(AncestorEntry entry) {
        String identifier = entry.identifier() == null ? "" : entry.identifier();
        return switch (entry.nodeType()) {
            case PART -> "Part " + identifier;
            case CHAPTER -> "Chapter " + identifier;
            case SECTION -> "Section " + identifier;
            case SCHEDULE -> "Schedule " + identifier;
            case ARTICLE -> "Article " + identifier;
            case SUBSECTION, PARAGRAPH, SUBPARAGRAPH -> "(" + identifier + ")";
            case DOCUMENT_ROOT -> "";
            case GENERIC -> capitalize(entry.type()) + " " + identifier;
        };
    }

    private static String capitalize(String rawType) {
        if (rawType == null || rawType.isBlank()) {
            return "Node";
        }
        String lower = rawType.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
