package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportSpecifier {
    public final SpecifierKind kind;
    public final String name;
    public final String alias;

    public ImportSpecifier(SpecifierKind kind, String name, String alias) {
        this.kind = kind;
        this.name = name;
        this.alias = alias;
    }

    /**
     * The binding the specifier introduces into the importing module.
     */
    public String localName() {
        return alias != null ? alias : name;
    }
}
