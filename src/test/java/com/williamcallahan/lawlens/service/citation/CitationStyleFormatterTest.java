package com.williamcallahan.lawlens.service.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.CitationStyle;
import com.williamcallahan.lawlens.domain.citation.DocumentType;
import org.junit.jupiter.api.Test;

class CitationStyleFormatterTest {

    private static final ChatSource ACT = new ChatSource(
            "EA-2007-11", "Employment Act", DocumentType.ACT, "(2) A contract of service...",
            "3. Contracts", "sec_3__subsec_2", null, 0.9, "Act 11 of 2007");

    private static final ChatSource JUDGMENT = new ChatSource(
            "UGSC-2019-12", "Mukasa v Uganda", DocumentType.JUDGMENT, "The appeal is allowed.",
            null, null, null, 0.7, "[2019] UGSC 12");

    private final CitationStyleFormatter formatter = new CitationStyleFormatter();

    @Test
    void legalStyle() {
        assertEquals("Employment Act, Section 3, (Act 11 of 2007)", formatter.format(ACT, CitationStyle.LEGAL));
        assertEquals("Mukasa v Uganda, ([2019] UGSC 12)", formatter.format(JUDGMENT, CitationStyle.LEGAL));
    }

    @Test
    void academicStyle() {
        assertEquals("Employment Act. (2007). Act 11 of 2007. Section 3.", formatter.format(ACT, CitationStyle.ACADEMIC));
    }

    @Test
    void bibtexStyle() {
        String expected = "@legislation{employmentact2007,\n"
                + "  title = {Employment Act},\n"
                + "  number = {Act 11 of 2007},\n"
                + "  year = {2007},\n"
                + "  note = {Section 3},\n"
                + "  howpublished = {Kenya Law}\n"
                + "}";
        assertEquals(expected, formatter.format(ACT, CitationStyle.BIBTEX));
        assertEquals("@misc{mukasav2019,", formatter.format(JUDGMENT, CitationStyle.BIBTEX).lines().findFirst().orElseThrow());
    }

    @Test
    void bluebookStyle() {
        assertEquals("Employment Act § 3 (2007)", formatter.format(ACT, CitationStyle.BLUEBOOK));
        assertEquals("Mukasa v Uganda, [2019] UGSC 12, (2019)", formatter.format(JUDGMENT, CitationStyle.BLUEBOOK));
    }

    @Test
    void oscolaStyle() {
        assertEquals("Employment Act 2007, s 3", formatter.format(ACT, CitationStyle.OSCOLA));
        assertEquals("Mukasa v Uganda [2019] UGSC 12", formatter.format(JUDGMENT, CitationStyle.OSCOLA));
    }

    @Test
    void sourcesWithoutYearUseNoDateKey() {
        ChatSource undated = new ChatSource("doc", "Land Act", DocumentType.ACT, "", null, null, null, 0.5, null);

        assertEquals("@legislation{landactn.d.,", formatter.format(undated, CitationStyle.BIBTEX).lines().findFirst().orElseThrow());
        assertEquals("Land Act", formatter.format(undated, CitationStyle.BLUEBOOK));
    }

    @Test
    void yearComesOnlyFromHumanReadableId() {
        ChatSource yearInTitle = new ChatSource("doc", "Land Act 1998", DocumentType.ACT, "", null, null, null, 0.5, null);

        assertEquals("Land Act 1998", formatter.format(yearInTitle, CitationStyle.BLUEBOOK));
        assertEquals("@legislation{landactn.d.,", formatter.format(yearInTitle, CitationStyle.BIBTEX).lines().findFirst().orElseThrow());
    }

    @Test
    void styleNamesParseCaseInsensitively() {
        assertEquals(CitationStyle.OSCOLA, CitationStyle.fromValue("oscola"));
        assertEquals(CitationStyle.LEGAL, CitationStyle.fromValue(null));
        assertThrows(IllegalArgumentException.class, () -> CitationStyle.fromValue("mla"));
    }
}
