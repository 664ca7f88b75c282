package com.williamcallahan.lawlens.service.citation;

import com.williamcallahan.lawlens.domain.citation.AnswerAnnotation;
import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.CitationSegment;
import com.williamcallahan.lawlens.domain.citation.SourceSummary;
import com.williamcallahan.lawlens.domain.citation.TableShape;
import com.williamcallahan.lawlens.service.table.PipeTableDetector;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Combines marker parsing, reference extraction, table detection and deduplication for one
 * generated answer.
 */
@Service
public class AnswerCitationService {
    private static final Logger logger = LoggerFactory.getLogger(AnswerCitationService.class);

    /**
     * Annotates an answer against its source list.
     *
     * @param text answer text
     * @param sources sources in citation order, number {@code n} at index {@code n - 1}
     * @return annotation; numbers past the end of the list are reported, never thrown
     */
    public AnswerAnnotation annotate(String text, List<ChatSource> sources) {
        List<ChatSource> sourceList = sources == null ? List.of() : sources;
        List<CitationSegment> segments = CitationMarkerParser.parse(text);

        List<SourceSummary> summaries = new ArrayList<>(sourceList.size());
        for (int index = 0; index < sourceList.size(); index++) {
            summaries.add(summarize(index + 1, sourceList.get(index)));
        }

        List<Integer> unresolved = CitationMarkerParser.citedNumbers(segments).stream()
                .filter(number -> number < 1 || number > sourceList.size())
                .toList();
        if (!unresolved.isEmpty()) {
            logger.debug("Answer cites {} numbers with no matching source: {}", unresolved.size(), unresolved);
        }

        return new AnswerAnnotation(
                segments,
                summaries,
                SourceDeduplicator.dedupe(sourceList),
                SourceDeduplicator.countByType(sourceList),
                unresolved);
    }

    /**
     * Builds the preview summary for a single source.
     *
     * @param citationNumber 1-indexed citation number
     * @param source cited source
     * @return summary
     */
    public SourceSummary summarize(int citationNumber, ChatSource source) {
        TableShape shape = PipeTableDetector.detect(source.excerpt());
        return new SourceSummary(
                citationNumber,
                source.documentId(),
                SectionReferenceExtractor.resolve(source).orElse(null),
                source.relevanceBand(),
                shape,
                shape.isTable() ? PipeTableDetector.summarize(shape) : null);
    }
}
