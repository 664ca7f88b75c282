package com.williamcallahan.lawlens.service.citation;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.DeduplicatedSource;
import com.williamcallahan.lawlens.domain.citation.DocumentType;
import com.williamcallahan.lawlens.domain.citation.DocumentTypeCount;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses repeated citations of the same document for source summaries.
 */
public final class SourceDeduplicator {

    private SourceDeduplicator() {}

    /**
     * One entry per distinct document id in first-seen order, keeping the first occurrence.
     *
     * @param occurrences sources in citation order
     * @return deduplicated sources whose counts sum to the input size
     */
    public static List<DeduplicatedSource> dedupe(List<ChatSource> occurrences) {
        Map<String, ChatSource> firstSeen = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ChatSource source : occurrences) {
            String key = Objects.toString(source.documentId(), "");
            firstSeen.putIfAbsent(key, source);
            counts.merge(key, 1, Integer::sum);
        }
        List<DeduplicatedSource> deduplicated = new ArrayList<>(firstSeen.size());
        firstSeen.forEach((key, source) -> deduplicated.add(new DeduplicatedSource(source, counts.get(key))));
        return List.copyOf(deduplicated);
    }

    /**
     * Counts sources per document type in the order act, judgment, regulation, constitution,
     * omitting types with no sources.
     *
     * @param sources cited sources
     * @return non-zero counts
     */
    public static List<DocumentTypeCount> countByType(List<ChatSource> sources) {
        Map<DocumentType, Integer> counts = new EnumMap<>(DocumentType.class);
        sources.forEach(source -> counts.merge(source.documentType(), 1, Integer::sum));
        List<DocumentTypeCount> result = new ArrayList<>();
        counts.forEach((type, count) -> result.add(new DocumentTypeCount(type, count)));
        return List.copyOf(result);
    }
}
