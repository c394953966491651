package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SpecifierKind {
    DEFAULT,
    NAMED,
    NAMESPACE;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }
}
