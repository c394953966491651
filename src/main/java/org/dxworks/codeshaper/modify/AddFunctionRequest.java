package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class AddFunctionRequest extends ModificationRequest {

    static final String TYPE = "addFunction";

    public final String functionCode;

    @JsonCreator
    public AddFunctionRequest(@JsonProperty("functionCode") String functionCode) {
        this.functionCode = functionCode;
    }

    @Override
    public <R> R accept(ModificationVisitor<R> visitor) {
        return visitor.visitAddFunction(this);
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public void validate() {
        requireText(functionCode, "functionCode");
    }
}
