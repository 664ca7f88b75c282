package com.williamcallahan.lawlens.domain.citation;

import java.util.List;

/**
 * Everything a chat surface needs to render an answer with interactive citations.
 *
 * @param segments answer text split into prose and markers
 * @param sources per-source summaries in citation order
 * @param deduplicatedSources distinct documents with occurrence counts
 * @param countsByType non-zero counts per document type
 * @param unresolvedNumbers cited numbers that point past the end of the source list
 */
public record AnswerAnnotation(
        List<CitationSegment> segments,
        List<SourceSummary> sources,
        List<DeduplicatedSource> deduplicatedSources,
        List<DocumentTypeCount> countsByType,
        List<Integer> unresolvedNumbers) {

    public AnswerAnnotation {
        segments = List.copyOf(segments);
        sources = List.copyOf(sources);
        deduplicatedSources = List.copyOf(deduplicatedSources);
        countsByType = List.copyOf(countsByType);
        unresolvedNumbers = List.copyOf(unresolvedNumbers);
    }
}
