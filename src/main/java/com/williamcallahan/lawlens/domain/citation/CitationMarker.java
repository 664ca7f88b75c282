package com.williamcallahan.lawlens.domain.citation;

import java.util.List;
import java.util.Objects;

/**
 * Bracketed marker such as {@code [1]} or {@code [2, 3]}.
 *
 * @param text matched substring including brackets
 * @param numbers 1-indexed citation numbers in writing order
 */
public record CitationMarker(String text, List<Integer> numbers) implements CitationSegment {

    public CitationMarker {
        Objects.requireNonNull(text, "Marker text is required");
        numbers = numbers == null ? List.of() : List.copyOf(numbers);
    }
}
