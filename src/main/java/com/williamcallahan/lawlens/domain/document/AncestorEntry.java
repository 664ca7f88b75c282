package com.williamcallahan.lawlens.domain.document;

/**
 * One level of the path from the document root to the node being rendered.
 *
 * @param type raw structural type
 * @param identifier node identifier, may be null
 * @param title node title, may be null
 */
public record AncestorEntry(String type, String identifier, String title) {

    public static AncestorEntry of(DocumentNode node) {
        return new AncestorEntry(node.type(), node.identifier(), node.title());
    }

    public NodeType nodeType() {
        return NodeType.fromValue(type);
    }
}
