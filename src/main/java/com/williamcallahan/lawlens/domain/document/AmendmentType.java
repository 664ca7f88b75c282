package com.williamcallahan.lawlens.domain.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Legislative-history status of a styled text fragment.
 */
public enum AmendmentType {
    ACTIVE("active"),
    INSERTION("insertion"),
    REPEALED("repealed"),
    /**
     * Superseded wording kept for audit next to its replacement.
     */
    SUBSTITUTED_OLD("substituted_old"),
    SUBSTITUTED_NEW("substituted_new");

    private final String wireValue;

    AmendmentType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses the payload value, treating unknown markers as {@link #ACTIVE}.
     *
     * @param value payload string, may be null
     * @return amendment type, never null
     */
    @JsonCreator
    public static AmendmentType fromValue(String value) {
        if (value == null) {
            return ACTIVE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AmendmentType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return ACTIVE;
    }
}
