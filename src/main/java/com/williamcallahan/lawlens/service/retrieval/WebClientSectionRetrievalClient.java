package com.williamcallahan.lawlens.service.retrieval;

import com.williamcallahan.lawlens.domain.retrieval.ExpandSourceRequest;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedExcerpt;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link SectionRetrievalClient} over HTTP using the reactive {@link WebClient}.
 */
@Service
public class WebClientSectionRetrievalClient implements SectionRetrievalClient {
    private static final Logger log = LoggerFactory.getLogger(WebClientSectionRetrievalClient.class);

    private static final String SECTION_PATH = "/api/v1/documents/{documentId}/sections/{elementId}";
    private static final String EXPAND_SOURCE_PATH = "/api/v1/documents/{documentId}/expand-source";

    private final WebClient webClient;

    public WebClientSectionRetrievalClient(@Qualifier("sectionRetrievalWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<SectionResponse> getSection(String documentId, String elementId) {
        return webClient.get()
                .uri(SECTION_PATH, documentId, elementId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(SectionResponse.class)
                .switchIfEmpty(Mono.error(() -> new SectionRetrievalException(
                        "Empty section response for " + documentId + "/" + elementId)))
                .onErrorMap(WebClientException.class, error -> translate("section " + elementId, documentId, error));
    }

    @Override
    public Mono<ExpandedExcerpt> expandSource(String documentId, ExpandSourceRequest request) {
        return webClient.post()
                .uri(EXPAND_SOURCE_PATH, documentId)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ExpandedExcerpt.class)
                .switchIfEmpty(Mono.error(() -> new SectionRetrievalException(
                        "Empty expand-source response for " + documentId)))
                .onErrorMap(WebClientException.class, error -> translate("expand-source", documentId, error));
    }

    private static SectionRetrievalException translate(String operation, String documentId, WebClientException error) {
        if (error instanceof WebClientResponseException responseError) {
            log.debug("Document back end answered {} for {} of {}", responseError.getStatusCode(), operation, documentId);
            return new SectionRetrievalException(
                    "Back end returned " + responseError.getStatusCode().value() + " for " + operation, error);
        }
        return new SectionRetrievalException("Back end unreachable for " + operation, error);
    }
}
