package com.williamcallahan.lawlens.service.document;

/**
 * Formatted position of a node within its document.
 *
 * @param hierarchicalPath path without the title, e.g. "Part II Section 3(2)"
 * @param fullLabel path plus ". title" when the node has one
 */
public record HierarchicalLabel(String hierarchicalPath, String fullLabel) {}
