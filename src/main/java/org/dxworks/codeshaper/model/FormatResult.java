package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public class FormatResult {
    public final boolean modified;
    public final List<LineChange> changes;
    @JsonIgnore
    public final String formattedContent;

    public FormatResult(boolean modified, List<LineChange> changes, String formattedContent) {
        this.modified = modified;
        this.changes = List.copyOf(changes);
        this.formattedContent = formattedContent;
    }
}
