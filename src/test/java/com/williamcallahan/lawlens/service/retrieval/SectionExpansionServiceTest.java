package com.williamcallahan.lawlens.service.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.lawlens.config.AppProperties;
import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.DocumentType;
import com.williamcallahan.lawlens.domain.document.DocumentTable;
import com.williamcallahan.lawlens.domain.retrieval.ExpandSourceRequest;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedExcerpt;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedView;
import com.williamcallahan.lawlens.domain.retrieval.ExpansionKey;
import com.williamcallahan.lawlens.domain.retrieval.ExpansionStatus;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

/**
 * Verifies the two-strategy expansion, its sanity check, timeout and caching.
 */
class SectionExpansionServiceTest {
    private static final String EXCERPT = "An employer shall issue a written contract";

    private SectionRetrievalClient retrievalClient;
    private SectionExpansionService expansionService;

    @BeforeEach
    void setUp() {
        retrievalClient = mock(SectionRetrievalClient.class);
        expansionService = new SectionExpansionService(retrievalClient, new AppProperties(), Schedulers.parallel());
    }

    @AfterEach
    void resetVirtualTime() {
        VirtualTimeScheduler.reset();
    }

    private static ChatSource source(String sectionId) {
        return new ChatSource("EA-2007-11", "Employment Act", DocumentType.ACT, EXCERPT, null, sectionId, null, 0.9, null);
    }

    private static SectionResponse section(String content) {
        return new SectionResponse("Contracts", content, "<p>" + content + "</p>", "subsection", "2",
                "sec_3__subsec_2", null, List.of());
    }

    @Test
    void usesSectionWhenItContainsTheExcerpt() {
        when(retrievalClient.getSection("EA-2007-11", "sec_3__subsec_2"))
                .thenReturn(Mono.just(section("(2) An employer shall issue a written contract to every employee.")));

        ExpandedView view = expansionService.expand(source("sec_3__subsec_2")).block();

        assertNotNull(view);
        assertEquals(ExpansionStatus.EXPANDED, view.status());
        assertEquals("(2) An employer shall issue a written contract to every employee.", view.displayExcerpt());
        assertNotNull(view.sectionData());
        assertEquals("Section 3(2)", view.legalReference());
        verify(retrievalClient, never()).expandSource(anyString(), any(ExpandSourceRequest.class));
    }

    @Test
    void mismatchedSectionFallsThroughToExpandSource() {
        String widened = "Part II. " + EXCERPT + " within seven days of engagement.";
        when(retrievalClient.getSection(anyString(), anyString()))
                .thenReturn(Mono.just(section("Completely unrelated provision about leave.")));
        when(retrievalClient.expandSource(eq("EA-2007-11"), any(ExpandSourceRequest.class)))
                .thenReturn(Mono.just(new ExpandedExcerpt(widened, List.of())));

        ExpandedView view = expansionService.expand(source("sec_3__subsec_2")).block();

        assertEquals(ExpansionStatus.EXPANDED, view.status());
        assertEquals(widened, view.displayExcerpt());
        assertNull(view.sectionData());
    }

    @Test
    void sectionFailureFallsThroughToExpandSource() {
        DocumentTable table = DocumentTable.of(List.of(List.of("Item", "Fee")));
        when(retrievalClient.getSection(anyString(), anyString()))
                .thenReturn(Mono.error(new SectionRetrievalException("Back end returned 404 for section")));
        when(retrievalClient.expandSource(anyString(), any(ExpandSourceRequest.class)))
                .thenReturn(Mono.just(new ExpandedExcerpt(EXCERPT, List.of(table))));

        ExpandedView view = expansionService.expand(source("sec_3")).block();

        assertEquals(ExpansionStatus.EXPANDED, view.status());
        assertEquals(EXCERPT, view.displayExcerpt());
        assertEquals(1, view.tables().size());
    }

    @Test
    void partialIdsSkipSectionLookup() {
        when(retrievalClient.expandSource(anyString(), any(ExpandSourceRequest.class)))
                .thenReturn(Mono.just(new ExpandedExcerpt(EXCERPT + " and more.", List.of())));

        ExpandedView view = expansionService.expand(source("3")).block();

        assertTrue(view.isExpanded());
        verify(retrievalClient, never()).getSection(anyString(), anyString());
    }

    @Test
    void nothingNewMeansFallbackThatIsNotCached() {
        when(retrievalClient.expandSource(anyString(), any(ExpandSourceRequest.class)))
                .thenReturn(Mono.just(new ExpandedExcerpt("short", List.of())));
        ChatSource source = source(null);

        ExpandedView view = expansionService.expand(source).block();
        expansionService.expand(source).block();

        assertEquals(ExpansionStatus.FALLBACK, view.status());
        assertEquals(EXCERPT, view.displayExcerpt());
        assertNull(expansionService.cached(ExpansionKey.of(source)));
        verify(retrievalClient, times(2)).expandSource(anyString(), any(ExpandSourceRequest.class));
    }

    @Test
    void failuresResolveToExcerptAndAreNotCached() {
        when(retrievalClient.expandSource(anyString(), any(ExpandSourceRequest.class)))
                .thenReturn(Mono.error(new SectionRetrievalException("Back end unreachable for expand-source")));
        ChatSource source = source(null);

        StepVerifier.create(expansionService.expand(source))
                .assertNext(view -> assertFalse(view.isExpanded()))
                .verifyComplete();
        StepVerifier.create(expansionService.expand(source))
                .assertNext(view -> assertEquals(EXCERPT, view.displayExcerpt()))
                .verifyComplete();

        assertNull(expansionService.cached(ExpansionKey.of(source)));
        verify(retrievalClient, times(2)).expandSource(anyString(), any(ExpandSourceRequest.class));
    }

    @Test
    void successfulExpansionsAreCached() {
        when(retrievalClient.expandSource(anyString(), any(ExpandSourceRequest.class)))
                .thenReturn(Mono.just(new ExpandedExcerpt(EXCERPT + " in writing.", List.of())));
        ChatSource source = source(null);

        ExpandedView first = expansionService.expand(source).block();
        ExpandedView second = expansionService.expand(source).block();

        assertSame(first, second);
        assertSame(first, expansionService.cached(ExpansionKey.of(source)));
        verify(retrievalClient, times(1)).expandSource(anyString(), any(ExpandSourceRequest.class));
    }

    @Test
    void slowBackEndTimesOutToFallback() {
        VirtualTimeScheduler virtualTime = VirtualTimeScheduler.create();
        SectionExpansionService timedService = new SectionExpansionService(retrievalClient, new AppProperties(), virtualTime);
        when(retrievalClient.expandSource(anyString(), any(ExpandSourceRequest.class))).thenReturn(Mono.never());

        StepVerifier.withVirtualTime(() -> timedService.expand(source(null)), () -> virtualTime, Long.MAX_VALUE)
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(7))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(view -> assertEquals(ExpansionStatus.FALLBACK, view.status()))
                .verifyComplete();
    }

    @Test
    void recognizesFullElementIds() {
        assertTrue(SectionExpansionService.isFullElementId("sec_3"));
        assertTrue(SectionExpansionService.isFullElementId("part_2"));
        assertTrue(SectionExpansionService.isFullElementId("chp_1__sec_4"));
        assertFalse(SectionExpansionService.isFullElementId("3"));
        assertFalse(SectionExpansionService.isFullElementId(null));
    }

    @Test
    void sanityCheckIgnoresCaseAndWhitespace() {
        assertTrue(SectionExpansionService.contentMatchesExcerpt(
                section("AN   EMPLOYER shall\nissue a written contract."), EXCERPT));
        assertFalse(SectionExpansionService.contentMatchesExcerpt(section("Leave entitlement."), EXCERPT));
        assertFalse(SectionExpansionService.contentMatchesExcerpt(section(null), EXCERPT));
    }
}
