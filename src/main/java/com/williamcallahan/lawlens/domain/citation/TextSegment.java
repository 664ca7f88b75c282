package com.williamcallahan.lawlens.domain.citation;

import java.util.Objects;

/**
 * Plain prose between citation markers.
 *
 * @param text verbatim text
 */
public record TextSegment(String text) implements CitationSegment {

    public TextSegment {
        Objects.requireNonNull(text, "Segment text is required");
    }
}
