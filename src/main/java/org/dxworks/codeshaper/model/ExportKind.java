package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportKind {
    NAMED,
    DEFAULT;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }
}
