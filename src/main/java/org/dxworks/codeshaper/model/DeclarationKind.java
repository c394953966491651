package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeclarationKind {
    CONST,
    LET,
    VAR;

    public static DeclarationKind fromKeyword(String keyword) {
        if (keyword == null) return VAR;
        switch (keyword.trim()) {
            case "const":
                return CONST;
            case "let":
                return LET;
            default:
                return VAR;
        }
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }
}
