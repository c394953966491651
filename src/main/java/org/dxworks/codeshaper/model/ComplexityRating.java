package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplexityRating {
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    public static ComplexityRating of(int complexity) {
        if (complexity <= 5) return LOW;
        if (complexity <= 10) return MEDIUM;
        if (complexity <= 20) return HIGH;
        return VERY_HIGH;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }
}
