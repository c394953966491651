package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class RenameRequest extends ModificationRequest {

    static final String TYPE = "rename";

    public final String target;
    public final String newName;

    @JsonCreator
    public RenameRequest(@JsonProperty("target") String target,
                         @JsonProperty("newName") String newName) {
        this.target = target;
        this.newName = newName;
    }

    @Override
    public <R> R accept(ModificationVisitor<R> visitor) {
        return visitor.visitRename(this);
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public void validate() {
        requireText(target, "target");
        requireIdentifier(newName, "newName");
    }
}
