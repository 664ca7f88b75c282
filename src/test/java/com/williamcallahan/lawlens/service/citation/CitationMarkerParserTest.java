package com.williamcallahan.lawlens.service.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import com.williamcallahan.lawlens.domain.citation.CitationMarker;
import com.williamcallahan.lawlens.domain.citation.CitationSegment;
import com.williamcallahan.lawlens.domain.citation.TextSegment;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class CitationMarkerParserTest {

    @Test
    void splitsProseAndMarkers() {
        List<CitationSegment> segments = CitationMarkerParser.parse(
                "Contracts must be in writing [1]. Notice is required [2, 3].");

        assertEquals(5, segments.size());
        assertEquals(new TextSegment("Contracts must be in writing "), segments.get(0));
        assertEquals(new CitationMarker("[1]", List.of(1)), segments.get(1));
        assertEquals(new TextSegment(". Notice is required "), segments.get(2));
        assertEquals(new CitationMarker("[2, 3]", List.of(2, 3)), segments.get(3));
        assertEquals(new TextSegment("."), segments.get(4));
    }

    @Test
    void concatenationReproducesInput() {
        String answer = "[1][2] Start, middle [10 ,11] and brackets [a] [ 1] end [3]";
        String rebuilt = CitationMarkerParser.parse(answer).stream()
                .map(CitationSegment::text)
                .collect(Collectors.joining());
        assertEquals(answer, rebuilt);
    }

    @Test
    void adjacentMarkersStaySeparate() {
        List<CitationSegment> segments = CitationMarkerParser.parse("[1][2]");

        assertEquals(2, segments.size());
        assertInstanceOf(CitationMarker.class, segments.get(0));
        assertInstanceOf(CitationMarker.class, segments.get(1));
    }

    @Test
    void overflowingNumbersStayInText() {
        List<CitationSegment> segments = CitationMarkerParser.parse("see [99999999999] and [2]");

        assertEquals(new TextSegment("see [99999999999] and "), segments.get(0));
        assertEquals(new CitationMarker("[2]", List.of(2)), segments.get(1));
    }

    @Test
    void textWithoutMarkersIsOneSegment() {
        assertEquals(List.of(new TextSegment("")), CitationMarkerParser.parse(""));
        assertEquals(List.of(new TextSegment("")), CitationMarkerParser.parse(null));
        assertEquals(List.of(new TextSegment("no citations")), CitationMarkerParser.parse("no citations"));
    }

    @Test
    void citedNumbersAreDistinctInFirstUseOrder() {
        List<CitationSegment> segments = CitationMarkerParser.parse("[3] then [1, 3] then [2]");
        assertEquals(List.of(3, 1, 2), CitationMarkerParser.citedNumbers(segments));
    }
}
