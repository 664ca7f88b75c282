package com.williamcallahan.lawlens.service.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.lawlens.config.AppProperties;
import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.retrieval.ExpandSourceRequest;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedExcerpt;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedView;
import com.williamcallahan.lawlens.domain.retrieval.ExpansionKey;
import com.williamcallahan.lawlens.domain.retrieval.ExpansionStatus;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import com.williamcallahan.lawlens.service.citation.SectionReferenceExtractor;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Fetches the fullest available content for a cited source.
 *
 * <p>When the source carries a full element id the section endpoint is tried first and its
 * content is used only if it actually contains the excerpt. Otherwise, or when that fails, the
 * expand-source endpoint widens the excerpt. Every failure and timeout resolves to the original
 * excerpt; expanded views are cached so re-opening a citation is instant.</p>
 */
@Service
public class SectionExpansionService {
    private static final Logger logger = LoggerFactory.getLogger(SectionExpansionService.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int EXCERPT_PROBE_CHARS = 50;
    private static final int SECTION_PROBE_CHARS = 100;
    private static final int PROBE_WORDS = 5;

    private final SectionRetrievalClient retrievalClient;
    private final Scheduler timeoutScheduler;
    private final Duration fetchTimeout;
    private final Cache<ExpansionKey, ExpandedView> expansionCache;

    public SectionExpansionService(
            SectionRetrievalClient retrievalClient,
            AppProperties appProperties,
            @Qualifier("retrievalTimeoutScheduler") Scheduler timeoutScheduler) {
        this.retrievalClient = retrievalClient;
        this.timeoutScheduler = timeoutScheduler;
        AppProperties.Retrieval retrieval = appProperties.getRetrieval();
        this.fetchTimeout = retrieval.getFetchTimeout();
        this.expansionCache = Caffeine.newBuilder()
                .maximumSize(retrieval.getCacheSize())
                .expireAfterWrite(retrieval.getCacheTtl())
                .recordStats()
                .build();
        logger.info("SectionExpansionService initialized with {} fetch timeout", fetchTimeout);
    }

    /**
     * Returns a cached expansion without fetching.
     *
     * @param key expansion key
     * @return cached view, or null when none is cached
     */
    public ExpandedView cached(ExpansionKey key) {
        return expansionCache.getIfPresent(key);
    }

    /**
     * Expands a source. The returned {@link Mono} always completes with a view and never errors.
     *
     * @param source cited source
     * @return expanded view, or the excerpt fallback after a failure or timeout
     */
    public Mono<ExpandedView> expand(ChatSource source) {
        ExpansionKey key = ExpansionKey.of(source);
        ExpandedView cachedView = expansionCache.getIfPresent(key);
        if (cachedView != null) {
            logger.debug("Expansion cache hit for {}", key);
            return Mono.just(cachedView);
        }
        return fetch(source)
                .timeout(fetchTimeout, timeoutScheduler)
                .doOnNext(view -> {
                    if (view.isExpanded()) {
                        expansionCache.put(key, view);
                    }
                })
                .onErrorResume(error -> {
                    if (error instanceof TimeoutException) {
                        logger.warn("Expansion of {} timed out after {}; showing excerpt", key, fetchTimeout);
                    } else {
                        logger.warn("Expansion of {} failed; showing excerpt: {}", key, error.getMessage());
                    }
                    return Mono.just(fallback(source));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> fallback(source)));
    }

    /**
     * View showing only the source's own excerpt.
     *
     * @param source cited source
     * @return fallback view
     */
    public ExpandedView fallback(ChatSource source) {
        return ExpandedView.fallback(source, SectionReferenceExtractor.resolve(source).orElse(null));
    }

    private Mono<ExpandedView> fetch(ChatSource source) {
        return fetchSection(source)
                .switchIfEmpty(Mono.defer(() -> fetchExpandedSource(source)));
    }

    private Mono<ExpandedView> fetchSection(ChatSource source) {
        if (!isFullElementId(source.sectionId())) {
            return Mono.empty();
        }
        return retrievalClient.getSection(source.documentId(), source.sectionId())
                .filter(section -> contentMatchesExcerpt(section, source.excerpt()))
                .map(section -> sectionView(section, source))
                .onErrorResume(SectionRetrievalException.class, error -> {
                    logger.debug("Section lookup failed for {}; trying expand-source", source.sectionId());
                    return Mono.empty();
                });
    }

    private Mono<ExpandedView> fetchExpandedSource(ChatSource source) {
        ExpandSourceRequest request = new ExpandSourceRequest(source.excerpt(), source.section());
        return retrievalClient.expandSource(source.documentId(), request)
                .map(expanded -> expandedSourceView(expanded, source));
    }

    private ExpandedView sectionView(SectionResponse section, ChatSource source) {
        String content = section.content() != null && !section.content().isBlank() ? section.content() : source.excerpt();
        String reference = SectionReferenceExtractor.resolveForDetail(section, source).orElse(null);
        return new ExpandedView(content, section.htmlContent(), section, List.of(), reference, ExpansionStatus.EXPANDED);
    }

    private ExpandedView expandedSourceView(ExpandedExcerpt expanded, ChatSource source) {
        boolean longer = expanded.fullExcerpt() != null && expanded.fullExcerpt().length() > source.excerpt().length();
        boolean hasTables = !expanded.tables().isEmpty();
        String reference = SectionReferenceExtractor.resolve(source).orElse(null);
        if (!longer && !hasTables) {
            return ExpandedView.fallback(source, reference);
        }
        String displayExcerpt = longer ? expanded.fullExcerpt() : source.excerpt();
        return new ExpandedView(displayExcerpt, null, null, expanded.tables(), reference, ExpansionStatus.EXPANDED);
    }

    /**
     * Whether a section id is specific enough to look up directly.
     *
     * @param sectionId raw section id
     * @return true for ids like "sec_3", "part_2" or anything containing "__"
     */
    static boolean isFullElementId(String sectionId) {
        return sectionId != null
                && (sectionId.contains("__") || sectionId.startsWith("sec_") || sectionId.startsWith("part_"));
    }

    /**
     * Sanity check that a fetched section is the one the excerpt came from: the excerpt's
     * first words must appear in the section content.
     *
     * @param section fetched section
     * @param excerpt original excerpt
     * @return whether the section content contains the excerpt's opening words
     */
    static boolean contentMatchesExcerpt(SectionResponse section, String excerpt) {
        String content = section.content() == null ? "" : section.content();
        String excerptStart = normalize(excerpt.substring(0, Math.min(EXCERPT_PROBE_CHARS, excerpt.length())));
        String probe = Arrays.stream(excerptStart.split(" ", -1))
                .limit(PROBE_WORDS)
                .collect(Collectors.joining(" "));
        String sectionStart = normalize(content.substring(0, Math.min(SECTION_PROBE_CHARS, content.length())));
        return sectionStart.contains(probe) || content.toLowerCase(Locale.ROOT).contains(probe);
    }

    private static String normalize(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
