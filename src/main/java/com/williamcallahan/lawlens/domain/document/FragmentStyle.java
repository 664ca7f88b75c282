package com.williamcallahan.lawlens.domain.document;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolved presentation of one text fragment.
 *
 * @param decorations combined inline and amendment decorations
 * @param color explicit CSS color, may be null
 * @param superscript whether the fragment renders raised
 */
public record FragmentStyle(Set<TextDecoration> decorations, String color, boolean superscript) {

    public FragmentStyle {
        decorations = decorations == null || decorations.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(decorations));
    }

    /**
     * CSS classes in declaration order of {@link TextDecoration}, space separated.
     *
     * @return class attribute value, empty when undecorated
     */
    public String cssClasses() {
        if (decorations.isEmpty()) {
            return "";
        }
        return EnumSet.copyOf(decorations).stream()
                .map(TextDecoration::cssClass)
                .collect(Collectors.joining(" "));
    }
}
