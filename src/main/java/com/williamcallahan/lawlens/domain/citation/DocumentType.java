package com.williamcallahan.lawlens.domain.citation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kind of legal document a chat source was drawn from.
 */
public enum DocumentType {
    ACT,
    JUDGMENT,
    REGULATION,
    CONSTITUTION;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value, falling back to {@link #ACT} for unknown or missing values.
     *
     * @param value raw value such as "judgment"
     * @return matching type
     */
    @JsonCreator
    public static DocumentType fromValue(String value) {
        if (value == null) {
            return ACT;
        }
        for (DocumentType type : values()) {
            if (type.wireValue().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return ACT;
    }
}
