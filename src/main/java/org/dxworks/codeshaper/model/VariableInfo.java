package org.dxworks.codeshaper.model;

public class VariableInfo {
    public final String name;
    public final DeclarationKind declarationKind;
    public final int line;

    public VariableInfo(String name, DeclarationKind declarationKind, int line) {
        this.name = name;
        this.declarationKind = declarationKind;
        this.line = line;
    }
}
