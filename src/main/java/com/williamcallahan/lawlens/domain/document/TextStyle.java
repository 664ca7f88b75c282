package com.williamcallahan.lawlens.domain.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Inline style flags a fragment can carry independently of its amendment status.
 */
public enum TextStyle {
    BOLD,
    ITALIC;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a payload style name.
     *
     * @param value style name such as "bold"
     * @return matching style, or null for styles this renderer does not support
     */
    @JsonCreator
    public static TextStyle fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TextStyle style : values()) {
            if (style.name().equals(normalized)) {
                return style;
            }
        }
        return null;
    }
}
