package com.williamcallahan.lawlens.domain.citation;

/**
 * Per-source details shown in hover previews.
 *
 * @param citationNumber 1-indexed citation number
 * @param documentId cited document
 * @param reference readable legal reference, null when none could be resolved
 * @param relevance relevance band
 * @param tableShape detected table shape of the excerpt
 * @param tableSummary summary such as "Table Data · 3 rows × 2 columns", null for prose
 */
public record SourceSummary(
        int citationNumber,
        String documentId,
        String reference,
        RelevanceBand relevance,
        TableShape tableShape,
        String tableSummary) {}
