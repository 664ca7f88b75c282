package com.williamcallahan.lawlens.service.retrieval;

import com.williamcallahan.lawlens.domain.retrieval.ExpandSourceRequest;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedExcerpt;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import reactor.core.publisher.Mono;

/**
 * Calls into the document back end that owns full section text.
 *
 * <p>Implementations signal failures as {@link SectionRetrievalException} errors on the
 * returned {@link Mono}.</p>
 */
public interface SectionRetrievalClient {

    /**
     * Fetches one section by element id.
     *
     * @param documentId document id
     * @param elementId element id such as "sec_3__subsec_2"
     * @return section payload
     */
    Mono<SectionResponse> getSection(String documentId, String elementId);

    /**
     * Asks the back end to widen an excerpt to its surrounding text and tables.
     *
     * @param documentId document id
     * @param request excerpt and optional section hint
     * @return widened excerpt
     */
    Mono<ExpandedExcerpt> expandSource(String documentId, ExpandSourceRequest request);
}
