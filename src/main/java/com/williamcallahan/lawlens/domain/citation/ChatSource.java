package com.williamcallahan.lawlens.domain.citation;

/**
 * A retrieved passage cited by a generated answer.
 *
 * <p>Citation number {@code n} in the answer text refers to the source at index {@code n - 1}
 * of the answer's source list.</p>
 *
 * @param documentId repository id of the cited document
 * @param title document title
 * @param documentType kind of document
 * @param excerpt retrieved text passage
 * @param section raw section label, e.g. "3. Interpretation" or "Part I > 3. Interpretation"
 * @param sectionId raw section id, e.g. "sec_3__subsec_2"
 * @param legalReference backend-resolved reference, preferred when present
 * @param relevanceScore relevance in [0, 1]
 * @param humanReadableId citation id such as "[2019] UGSC 12"
 */
public record ChatSource(
        String documentId,
        String title,
        DocumentType documentType,
        String excerpt,
        String section,
        String sectionId,
        String legalReference,
        double relevanceScore,
        String humanReadableId) {

    public ChatSource {
        documentType = documentType == null ? DocumentType.ACT : documentType;
        excerpt = excerpt == null ? "" : excerpt;
        relevanceScore = Math.max(0.0, Math.min(1.0, relevanceScore));
    }

    public RelevanceBand relevanceBand() {
        return RelevanceBand.fromScore(relevanceScore);
    }
}
