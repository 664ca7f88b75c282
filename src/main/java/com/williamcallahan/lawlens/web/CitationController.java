package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.AnswerAnnotation;
import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.CitationSegment;
import com.williamcallahan.lawlens.domain.citation.CitationStyle;
import com.williamcallahan.lawlens.domain.citation.LegalCitation;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedView;
import com.williamcallahan.lawlens.service.citation.AnswerCitationService;
import com.williamcallahan.lawlens.service.citation.CitationMarkerParser;
import com.williamcallahan.lawlens.service.citation.CitationStyleFormatter;
import com.williamcallahan.lawlens.service.citation.LegalCitationParser;
import com.williamcallahan.lawlens.service.citation.SectionReferenceExtractor;
import com.williamcallahan.lawlens.service.retrieval.SectionExpansionService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Citation parsing, reference resolution, export formatting and excerpt expansion.
 */
@RestController
@RequestMapping(value = "/api/citations", produces = MediaType.APPLICATION_JSON_VALUE)
public class CitationController extends BaseController {
    private static final Logger logger = LoggerFactory.getLogger(CitationController.class);

    private final AnswerCitationService answerCitationService;
    private final LegalCitationParser legalCitationParser;
    private final CitationStyleFormatter styleFormatter;
    private final SectionExpansionService expansionService;

    public CitationController(
            AnswerCitationService answerCitationService,
            LegalCitationParser legalCitationParser,
            CitationStyleFormatter styleFormatter,
            SectionExpansionService expansionService,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.answerCitationService = answerCitationService;
        this.legalCitationParser = legalCitationParser;
        this.styleFormatter = styleFormatter;
        this.expansionService = expansionService;
    }

    @PostMapping(value = "/segments", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<CitationSegment> segments(@Valid @RequestBody TextRequest request) {
        return CitationMarkerParser.parse(request.text());
    }

    /**
     * Annotates an answer: segments, per-source summaries, deduplicated sources, type counts
     * and citation numbers that point past the source list.
     *
     * @param request answer text and sources
     * @return annotation
     */
    @PostMapping(value = "/annotate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AnswerAnnotation annotate(@Valid @RequestBody AnnotateRequest request) {
        AnswerAnnotation annotation = answerCitationService.annotate(request.text(), request.sources());
        logger.debug("Annotated answer with {} segments and {} sources",
                annotation.segments().size(), annotation.sources().size());
        return annotation;
    }

    /**
     * Resolves the readable reference for a source.
     *
     * @param source cited source
     * @return reference, or 204 when none could be derived
     */
    @PostMapping(value = "/reference", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReferenceResponse> reference(@RequestBody ChatSource source) {
        return SectionReferenceExtractor.resolve(source)
                .map(reference -> ResponseEntity.ok(new ReferenceResponse(reference)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping(value = "/legal", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LegalCitationsResponse legalCitations(@Valid @RequestBody TextRequest request) {
        List<LegalCitation> citations = legalCitationParser.parse(request.text());
        List<String> eids = citations.stream().map(LegalCitation::eId).distinct().toList();
        return new LegalCitationsResponse(citations, eids);
    }

    /**
     * Formats a source in a citation style.
     *
     * @param source cited source
     * @param style style name, defaults to legal
     * @return formatted citation
     */
    @PostMapping(value = "/format", consumes = MediaType.APPLICATION_JSON_VALUE)
    public FormattedCitationResponse format(
            @RequestBody ChatSource source,
            @RequestParam(name = "style", required = false) String style) {
        CitationStyle citationStyle = CitationStyle.fromValue(style);
        return new FormattedCitationResponse(citationStyle, styleFormatter.format(source, citationStyle));
    }

    /**
     * Expands a source's excerpt through the document back end, falling back to the excerpt.
     *
     * @param source cited source
     * @return expanded view
     */
    @PostMapping(value = "/expand", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ExpandedView> expand(@RequestBody ChatSource source) {
        return expansionService.expand(source);
    }
}
