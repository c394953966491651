package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class AddImportRequest extends ModificationRequest {

    static final String TYPE = "addImport";

    public final String importName;
    public final String importPath;

    @JsonCreator
    public AddImportRequest(@JsonProperty("importName") String importName,
                            @JsonProperty("importPath") String importPath) {
        this.importName = importName;
        this.importPath = importPath;
    }

    @Override
    public <R> R accept(ModificationVisitor<R> visitor) {
        return visitor.visitAddImport(this);
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public void validate() {
        requireIdentifier(importName, "importName");
        requireText(importPath, "importPath");
    }
}
