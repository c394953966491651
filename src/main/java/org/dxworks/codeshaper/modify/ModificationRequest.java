package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import static org.dxworks.codeshaper.parser.TreeSitterHelper.isValidIdentifier;

/**
 * One typed edit. The JSON {@code type} property selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RenameRequest.class, name = RenameRequest.TYPE),
        @JsonSubTypes.Type(value = AddImportRequest.class, name = AddImportRequest.TYPE),
        @JsonSubTypes.Type(value = RemoveImportRequest.class, name = RemoveImportRequest.TYPE),
        @JsonSubTypes.Type(value = AddFunctionRequest.class, name = AddFunctionRequest.TYPE),
        @JsonSubTypes.Type(value = UpdateFunctionRequest.class, name = UpdateFunctionRequest.TYPE),
        @JsonSubTypes.Type(value = AddPropertyRequest.class, name = AddPropertyRequest.TYPE)
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class ModificationRequest {

    public abstract <R> R accept(ModificationVisitor<R> visitor);

    /**
     * Name of the variant as it appears in the JSON {@code type} property.
     */
    public abstract String typeName();

    /**
     * Checks the fields this variant requires.
     *
     * @throws InvalidModificationException naming the first missing or malformed field
     */
    public abstract void validate();

    protected void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidModificationException(typeName() + ": " + field + " is required");
        }
    }

    protected void requireIdentifier(String value, String field) {
        requireText(value, field);
        if (!isValidIdentifier(value)) {
            throw new InvalidModificationException(typeName() + ": " + field + " '" + value + "' is not a valid identifier");
        }
    }
}
