package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Adds a class field. {@code propertyValue} is emitted verbatim as an expression, so
 * string literals must arrive already quoted.
 */
public class AddPropertyRequest extends ModificationRequest {

    static final String TYPE = "addProperty";

    public final String target;
    public final String propertyName;
    public final String propertyValue;

    @JsonCreator
    public AddPropertyRequest(@JsonProperty("target") String target,
                              @JsonProperty("propertyName") String propertyName,
                              @JsonProperty("propertyValue") String propertyValue) {
        this.target = target;
        this.propertyName = propertyName;
        this.propertyValue = propertyValue;
    }

    @Override
    public <R> R accept(ModificationVisitor<R> visitor) {
        return visitor.visitAddProperty(this);
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public void validate() {
        requireText(target, "target");
        requireIdentifier(propertyName, "propertyName");
        requireText(propertyValue, "propertyValue");
    }
}
