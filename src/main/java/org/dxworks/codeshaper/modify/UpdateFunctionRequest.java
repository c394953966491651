package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class UpdateFunctionRequest extends ModificationRequest {

    static final String TYPE = "updateFunction";

    public final String target;
    public final String functionCode;

    @JsonCreator
    public UpdateFunctionRequest(@JsonProperty("target") String target,
                                 @JsonProperty("functionCode") String functionCode) {
        this.target = target;
        this.functionCode = functionCode;
    }

    @Override
    public <R> R accept(ModificationVisitor<R> visitor) {
        return visitor.visitUpdateFunction(this);
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public void validate() {
        requireText(target, "target");
        requireText(functionCode, "functionCode");
    }
}
