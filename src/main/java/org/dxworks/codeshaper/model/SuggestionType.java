package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestionType {
    COMPLEXITY,
    NAMING,
    DUPLICATION,
    PERFORMANCE,
    STRUCTURE;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SuggestionType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Suggestion type must not be null");
        }
        for (SuggestionType type : values()) {
            if (type.jsonName().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown suggestion type: " + name);
    }
}
