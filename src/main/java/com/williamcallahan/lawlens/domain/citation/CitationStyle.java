package com.williamcallahan.lawlens.domain.citation;

import java.util.Locale;

/**
 * Output styles supported when exporting a source as a formatted citation.
 */
public enum CitationStyle {
    LEGAL,
    ACADEMIC,
    BIBTEX,
    BLUEBOOK,
    OSCOLA;

    /**
     * Parses a style name, case-insensitively.
     *
     * @param value style name such as "bluebook"
     * @return matching style
     * @throws IllegalArgumentException when the name is not a supported style
     */
    public static CitationStyle fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LEGAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknownStyle) {
            throw new IllegalArgumentException("Unsupported citation style: " + value, unknownStyle);
        }
    }
}
