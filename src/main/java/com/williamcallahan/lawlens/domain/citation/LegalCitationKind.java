package com.williamcallahan.lawlens.domain.citation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Structural unit named by a prose legal citation.
 */
public enum LegalCitationKind {
    SECTION("sec"),
    ARTICLE("art"),
    REGULATION("reg"),
    PART("part"),
    CHAPTER("chp"),
    SCHEDULE("schedule");

    private final String eidPrefix;

    LegalCitationKind(String eidPrefix) {
        this.eidPrefix = eidPrefix;
    }

    public String eidPrefix() {
        return eidPrefix;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
