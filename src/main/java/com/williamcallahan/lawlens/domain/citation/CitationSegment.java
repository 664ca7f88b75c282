package com.williamcallahan.lawlens.domain.citation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Piece of answer text: either plain prose or a bracketed citation marker.
 *
 * <p>Concatenating {@link #text()} over all segments of a parse reproduces the input.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextSegment.class, name = "text"),
    @JsonSubTypes.Type(value = CitationMarker.class, name = "citation")
})
public sealed interface CitationSegment permits TextSegment, CitationMarker {

    /**
     * Returns the original substring covered by this segment.
     *
     * @return verbatim text
     */
    String text();
}
