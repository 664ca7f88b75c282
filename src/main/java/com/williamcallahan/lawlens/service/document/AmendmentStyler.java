package com.williamcallahan.lawlens.service.document;

import com.williamcallahan.lawlens.domain.document.AmendmentType;
import com.williamcallahan.lawlens.domain.document.FragmentStyle;
import com.williamcallahan.lawlens.domain.document.TextDecoration;
import com.williamcallahan.lawlens.domain.document.TextFragment;
import com.williamcallahan.lawlens.domain.document.TextStyle;
import java.util.EnumSet;
import java.util.Set;

/**
 * Maps amendment markers and inline styles onto visual decorations.
 */
public final class AmendmentStyler {

    private AmendmentStyler() {}

    /**
     * Decorations implied by an amendment marker alone.
     *
     * @param amendment marker, null treated as active
     * @return decorations, empty for active text
     */
    public static Set<TextDecoration> decorationsFor(AmendmentType amendment) {
        if (amendment == null) {
            return Set.of();
        }
        return switch (amendment) {
            case ACTIVE -> Set.of();
            case INSERTION -> EnumSet.of(TextDecoration.BOLD, TextDecoration.ITALIC);
            case REPEALED -> EnumSet.of(TextDecoration.ITALIC, TextDecoration.MUTED, TextDecoration.STRIKETHROUGH);
            case SUBSTITUTED_OLD -> EnumSet.of(TextDecoration.MUTED_BACKGROUND);
            case SUBSTITUTED_NEW -> EnumSet.of(TextDecoration.BOLD);
        };
    }

    /**
     * Composes inline styles, amendment decoration, color and superscript for a fragment.
     *
     * @param fragment styled fragment
     * @return resolved style
     */
    public static FragmentStyle resolve(TextFragment fragment) {
        EnumSet<TextDecoration> decorations = EnumSet.noneOf(TextDecoration.class);
        if (fragment.hasStyle(TextStyle.BOLD)) {
            decorations.add(TextDecoration.BOLD);
        }
        if (fragment.hasStyle(TextStyle.ITALIC)) {
            decorations.add(TextDecoration.ITALIC);
        }
        decorations.addAll(decorationsFor(fragment.amendment()));
        return new FragmentStyle(decorations, fragment.color(), fragment.isSuperscript());
    }
}
