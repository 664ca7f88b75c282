package com.williamcallahan.lawlens.domain.citation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Coarse relevance shown next to a source: high from 80%, medium from 60%.
 */
public enum RelevanceBand {
    HIGH,
    MEDIUM,
    LOW;

    private static final double HIGH_THRESHOLD = 0.8;
    private static final double MEDIUM_THRESHOLD = 0.6;

    public static RelevanceBand fromScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
