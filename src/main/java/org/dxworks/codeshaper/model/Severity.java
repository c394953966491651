package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW(2),
    MEDIUM(5),
    HIGH(10);

    private final int penalty;

    Severity(int penalty) {
        this.penalty = penalty;
    }

    /**
     * Points subtracted from a file's refactoring score for one suggestion of this severity.
     */
    public int getPenalty() {
        return penalty;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }
}
