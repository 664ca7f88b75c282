package com.williamcallahan.lawlens.domain.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A run of text with uniform styling inside a styled text block.
 *
 * @param text fragment text
 * @param styles inline style flags
 * @param amendment legislative-history marker, null when untouched
 * @param color explicit CSS color, may be null
 * @param isSuperscript whether the fragment renders raised
 * @param footnoteRefs footnote markers attached after the text, in order
 */
public record TextFragment(
        String text,
        Set<TextStyle> styles,
        AmendmentType amendment,
        String color,
        @JsonProperty("is_superscript") boolean isSuperscript,
        List<FootnoteRef> footnoteRefs) {

    public TextFragment {
        text = text == null ? "" : text;
        styles = styles == null
                ? Set.of()
                : styles.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
        footnoteRefs = footnoteRefs == null ? List.of() : List.copyOf(footnoteRefs);
    }

    /**
     * Creates an unstyled fragment.
     *
     * @param text fragment text
     * @return plain fragment
     */
    public static TextFragment plain(String text) {
        return new TextFragment(text, Set.of(), null, null, false, List.of());
    }

    public boolean hasStyle(TextStyle style) {
        return styles.contains(style);
    }
}
