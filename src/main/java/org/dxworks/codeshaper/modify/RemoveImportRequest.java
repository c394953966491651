package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class RemoveImportRequest extends ModificationRequest {

    static final String TYPE = "removeImport";

    public final String importPath;

    @JsonCreator
    public RemoveImportRequest(@JsonProperty("importPath") String importPath) {
        this.importPath = importPath;
    }

    @Override
    public <R> R accept(ModificationVisitor<R> visitor) {
        return visitor.visitRemoveImport(this);
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public void validate() {
        requireText(importPath, "importPath");
    }
}
