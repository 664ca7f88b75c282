package com.williamcallahan.lawlens.service.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.DocumentType;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Verifies readable references are derived from the label shapes retrieval produces.
 */
class SectionReferenceExtractorTest {

    @Test
    void keepsSectionAsWritten() {
        assertEquals(Optional.of("Section 3(1)"), SectionReferenceExtractor.extractReference("Section 3(1) Definitions", null, null));
    }

    @Test
    void readsNumberedTitles() {
        assertEquals(Optional.of("Section 11"), SectionReferenceExtractor.extractReference("11. Imposition of duty", null, null));
    }

    @Test
    void readsBreadcrumbPaths() {
        assertEquals(Optional.of("Section 3"),
                SectionReferenceExtractor.extractReference("Part I > 3. Interpretation", null, null));
    }

    @Test
    void decimalBreadcrumbSegmentsAreNotSectionNumbers() {
        assertEquals(Optional.empty(),
                SectionReferenceExtractor.extractReference("EDA-2014-11 > Part I > 3.5 Rates", null, null));
    }

    @Test
    void readsElementIds() {
        assertEquals(Optional.of("Section 11(2)"), SectionReferenceExtractor.extractReference(null, "sec_11__subsec_2", null));
        assertEquals(Optional.of("Section 5(1)(b)"),
                SectionReferenceExtractor.extractReference(null, "sec_5__subsec_1__para_b", null));
    }

    @Test
    void documentIdsAreNeverSectionNumbers() {
        assertTrue(SectionReferenceExtractor.isDocumentId("EDA-2014-11"));
        assertTrue(SectionReferenceExtractor.isDocumentId("UGA-ACT-2024-001"));
        assertFalse(SectionReferenceExtractor.isDocumentId("sec_3"));

        assertEquals(Optional.of("Section 7"), SectionReferenceExtractor.extractReference("EDA-2014-11", "7", null));
        assertEquals(Optional.empty(), SectionReferenceExtractor.extractReference("EDA-2014-11", null, null));
    }

    @Test
    void fallsBackToLeadingSubsectionInExcerpt() {
        assertEquals(Optional.of("Subsection (2)"),
                SectionReferenceExtractor.extractReference("Preamble", null, "(2) An employer shall keep records."));
        assertEquals(Optional.empty(), SectionReferenceExtractor.extractReference("Preamble", null, "An employer shall."));
    }

    @Test
    void backendReferenceWins() {
        ChatSource source = new ChatSource("doc", "Act", DocumentType.ACT, "", "3. Title", null, "Section 9(3)", 0.7, null);
        assertEquals(Optional.of("Section 9(3)"), SectionReferenceExtractor.resolve(source));
    }

    @Test
    void derivesReferenceFromSectionData() {
        SectionResponse subsection = new SectionResponse(null, "text", null, "subsection", "2.", "sec_11__subsec_2", null, List.of());
        SectionResponse paragraph = new SectionResponse(null, "text", null, "paragraph", "b", null, null, List.of());
        SectionResponse section = new SectionResponse(null, "text", null, "Section", "11.", null, null, List.of());
        SectionResponse eidOnly = new SectionResponse(null, "text", null, null, null, "sec_4", null, List.of());

        assertEquals(Optional.of("Section 11(2)"), SectionReferenceExtractor.fromSectionData(subsection));
        assertEquals(Optional.of("Paragraph (b)"), SectionReferenceExtractor.fromSectionData(paragraph));
        assertEquals(Optional.of("Section 11"), SectionReferenceExtractor.fromSectionData(section));
        assertEquals(Optional.of("Section 4"), SectionReferenceExtractor.fromSectionData(eidOnly));
        assertEquals(Optional.empty(), SectionReferenceExtractor.fromSectionData(null));
    }

    @Test
    void detailResolutionPrefersSectionData() {
        ChatSource source = new ChatSource("doc", "Act", DocumentType.ACT, "", "3. Title", null, null, 0.7, null);
        SectionResponse section = new SectionResponse(null, "text", null, "section", "8", null, null, List.of());

        assertEquals(Optional.of("Section 8"), SectionReferenceExtractor.resolveForDetail(section, source));
        assertEquals(Optional.of("Section 3"), SectionReferenceExtractor.resolveForDetail(null, source));
    }
}
