package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportInfo {
    public final ExportKind kind;
    public final String name;
    public final String alias;

    public ExportInfo(ExportKind kind, String name, String alias) {
        this.kind = kind;
        this.name = name;
        this.alias = alias;
    }
}
