package com.williamcallahan.lawlens.domain.document;

import java.util.List;

/**
 * One paragraph of amendment-aware text.
 *
 * @param fragments ordered fragments making up the paragraph
 */
public record StyledTextBlock(List<TextFragment> fragments) {

    public StyledTextBlock {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }
}
