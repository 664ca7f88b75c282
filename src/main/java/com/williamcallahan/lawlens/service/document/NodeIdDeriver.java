package com.williamcallahan.lawlens.service.document;

import com.williamcallahan.lawlens.domain.document.DocumentNode;
import java.util.Locale;

/**
 * Derives the anchor id used for scroll targets, ToC links and bookmark keys.
 */
public final class NodeIdDeriver {
    private static final String MISSING_TYPE = "node";
    private static final String MISSING_IDENTIFIER = "unknown";

    private NodeIdDeriver() {}

    /**
     * Returns the stable element id when present, otherwise {@code <type>-<identifier>}.
     *
     * @param node document node
     * @return anchor id, e.g. "sec_3" or "section-3"
     */
    public static String deriveNodeId(DocumentNode node) {
        if (node.aknEid() != null && !node.aknEid().isBlank()) {
            return node.aknEid();
        }
        String type = node.type() == null || node.type().isBlank()
                ? MISSING_TYPE
                : node.type().toLowerCase(Locale.ROOT);
        String identifier = node.identifier() == null || node.identifier().isBlank()
                ? MISSING_IDENTIFIER
                : node.identifier();
        return type + "-" + identifier;
    }
}
