package com.williamcallahan.lawlens.service.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawlens.domain.retrieval.ExpandSourceRequest;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Exercises the HTTP client against a canned exchange function.
 */
class WebClientSectionRetrievalClientTest {

    private static WebClient cannedClient(HttpStatus status, String body, AtomicReference<ClientRequest> captured) {
        return WebClient.builder()
                .baseUrl("http://documents.test")
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    @Test
    void fetchesSectionByElementId() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClientSectionRetrievalClient client = new WebClientSectionRetrievalClient(cannedClient(
                HttpStatus.OK, "{\"heading\":\"Contracts\",\"content\":\"text\",\"number\":\"3\"}", captured));

        StepVerifier.create(client.getSection("EA-2007-11", "sec_3"))
                .assertNext(section -> {
                    assertEquals("Contracts", section.heading());
                    assertEquals("3", section.number());
                })
                .verifyComplete();
        assertEquals("/api/v1/documents/EA-2007-11/sections/sec_3", captured.get().url().getPath());
    }

    @Test
    void postsExpandSourceRequest() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClientSectionRetrievalClient client = new WebClientSectionRetrievalClient(cannedClient(
                HttpStatus.OK, "{\"fullExcerpt\":\"wider text\",\"tables\":[]}", captured));

        StepVerifier.create(client.expandSource("EA-2007-11", new ExpandSourceRequest("text", "Section 3")))
                .assertNext(expanded -> assertTrue(expanded.tables().isEmpty()))
                .verifyComplete();
        assertEquals("POST", captured.get().method().name());
        assertEquals("/api/v1/documents/EA-2007-11/expand-source", captured.get().url().getPath());
    }

    @Test
    void errorStatusBecomesRetrievalException() {
        WebClientSectionRetrievalClient client = new WebClientSectionRetrievalClient(
                cannedClient(HttpStatus.NOT_FOUND, "{\"detail\":\"missing\"}", new AtomicReference<>()));

        Mono<SectionResponse> section = client.getSection("EA-2007-11", "sec_99");

        StepVerifier.create(section)
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(SectionRetrievalException.class, error);
                    assertTrue(error.getMessage().contains("404"), error.getMessage());
                })
                .verify();
    }
}
