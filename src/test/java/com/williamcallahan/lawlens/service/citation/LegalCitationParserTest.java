package com.williamcallahan.lawlens.service.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawlens.domain.citation.LegalCitation;
import com.williamcallahan.lawlens.domain.citation.LegalCitationKind;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LegalCitationParserTest {

    private final LegalCitationParser parser = new LegalCitationParser();

    @Test
    void findsCitationsInPositionOrder() {
        List<LegalCitation> citations = parser.parse(
                "Under Section 19(2)(a) and s. 4, read with Article 28(1) of Part II.");

        assertEquals(List.of("sec_19__subsec_2__para_a", "sec_4", "art_28__subsec_1", "part_2"),
                citations.stream().map(LegalCitation::eId).toList());
        assertEquals("Section 19(2)(a)", citations.get(0).text());
        assertEquals(LegalCitationKind.ARTICLE, citations.get(2).kind());
        assertEquals(LegalCitationKind.PART, citations.get(3).kind());
    }

    @Test
    void overlappingShorterMatchesAreSkipped() {
        List<LegalCitation> citations = parser.parse("Section 19(2)");

        assertEquals(1, citations.size());
        assertEquals("19", citations.get(0).number());
        assertEquals("2", citations.get(0).subsection());
        assertNull(citations.get(0).paragraph());
    }

    @Test
    void romanSubparagraphsBecomeArabic() {
        assertEquals(Optional.of("sec_19__subsec_2__para_a__subpara_2"), parser.citationToEid("section 19(2)(a)(ii)"));
        assertEquals(Optional.of("chp_4"), parser.citationToEid("Chapter IV"));
        assertEquals(Optional.of("reg_5__subsec_3"), parser.citationToEid("Regulation 5(3)"));
        assertEquals(Optional.empty(), parser.citationToEid("no citation here"));
    }

    @Test
    void bareNumberedReferencesAreSections() {
        assertEquals(Optional.of("sec_12__subsec_1"), parser.citationToEid("see 12(1) above"));
    }

    @Test
    void uniqueEidsKeepFirstAppearance() {
        assertEquals(List.of("sec_3", "sec_5"), parser.extractUniqueEids("Section 3, Section 5 and again Section 3"));
        assertTrue(parser.extractUniqueEids(null).isEmpty());
    }

    @Test
    void eidsConvertBackToCitations() {
        assertEquals("Section 19(2)(a)", LegalCitationParser.eidToCitation("sec_19__subsec_2__para_a"));
        assertEquals("Part 2 Section 3", LegalCitationParser.eidToCitation("part_2__sec_3"));
        assertEquals("Article 28(1)", LegalCitationParser.eidToCitation("art_28__subsec_1"));
    }

    @Test
    void convertsRomanNumerals() {
        assertEquals(4, LegalCitationParser.romanToArabic("IV"));
        assertEquals(9, LegalCitationParser.romanToArabic("ix"));
        assertEquals(14, LegalCitationParser.romanToArabic("XIV"));
    }
}
