package com.williamcallahan.lawlens.service.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawlens.domain.document.AmendmentType;
import com.williamcallahan.lawlens.domain.document.FragmentStyle;
import com.williamcallahan.lawlens.domain.document.TextDecoration;
import com.williamcallahan.lawlens.domain.document.TextFragment;
import com.williamcallahan.lawlens.domain.document.TextStyle;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AmendmentStylerTest {

    @Test
    void activeTextIsUndecorated() {
        assertTrue(AmendmentStyler.decorationsFor(AmendmentType.ACTIVE).isEmpty());
        assertTrue(AmendmentStyler.decorationsFor(null).isEmpty());
    }

    @Test
    void repealedTextIsStruckThroughAndMuted() {
        assertEquals(
                Set.of(TextDecoration.ITALIC, TextDecoration.MUTED, TextDecoration.STRIKETHROUGH),
                AmendmentStyler.decorationsFor(AmendmentType.REPEALED));
    }

    @Test
    void substitutionPairsAreDistinguished() {
        assertEquals(Set.of(TextDecoration.MUTED_BACKGROUND), AmendmentStyler.decorationsFor(AmendmentType.SUBSTITUTED_OLD));
        assertEquals(Set.of(TextDecoration.BOLD), AmendmentStyler.decorationsFor(AmendmentType.SUBSTITUTED_NEW));
    }

    @Test
    void inlineStylesCombineWithAmendment() {
        TextFragment fragment = new TextFragment(
                "shall", Set.of(TextStyle.ITALIC), AmendmentType.INSERTION, "#b91c1c", true, List.of());

        FragmentStyle style = AmendmentStyler.resolve(fragment);

        assertEquals("font-bold italic", style.cssClasses());
        assertEquals("#b91c1c", style.color());
        assertTrue(style.superscript());
    }

    @Test
    void plainFragmentResolvesToNothing() {
        FragmentStyle style = AmendmentStyler.resolve(TextFragment.plain("text"));
        assertEquals("", style.cssClasses());
        assertFalse(style.superscript());
    }
}
