package com.williamcallahan.lawlens.service.document;

import com.williamcallahan.lawlens.domain.document.AncestorEntry;
import com.williamcallahan.lawlens.domain.document.DocumentHeader;
import com.williamcallahan.lawlens.domain.document.DocumentNode;
import com.williamcallahan.lawlens.domain.document.SnippetExport;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the payload handed to the "save snippet" action for a rendered node.
 */
@Component
public class SnippetExportFactory {

    /**
     * Creates a snippet for {@code node} at the given position.
     *
     * @param documentId owning document, may be null
     * @param header document header used for the label prefix, may be null
     * @param ancestors path from the root to the node's parent
     * @param node node being exported
     * @return snippet payload
     */
    public SnippetExport create(String documentId, DocumentHeader header, List<AncestorEntry> ancestors, DocumentNode node) {
        HierarchicalLabel label = AncestorPathFormatter.formatPath(ancestors, node);
        String documentName = header == null ? "" : header.displayName();
        String snippetLabel = documentName.isBlank()
                ? label.fullLabel()
                : documentName + " - " + label.fullLabel();
        return new SnippetExport(
                snippetLabel,
                documentId,
                NodeIdDeriver.deriveNodeId(node),
                node.title(),
                node.identifier(),
                node.type(),
                label.hierarchicalPath());
    }
}
