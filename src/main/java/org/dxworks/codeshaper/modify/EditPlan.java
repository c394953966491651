package org.dxworks.codeshaper.modify;

import java.util.List;

/**
 * Outcome of resolving one request against the current tree: either the edits to apply
 * and the line reported back to the caller, or the reason nothing matched.
 */
final class EditPlan {

    private final List<TextEdit> edits;
    private final String description;
    private final String unmatchedReason;

    private EditPlan(List<TextEdit> edits, String description, String unmatchedReason) {
        this.edits = edits;
        this.description = description;
        this.unmatchedReason = unmatchedReason;
    }

    static EditPlan applied(String description, List<TextEdit> edits) {
        return new EditPlan(List.copyOf(edits), description, null);
    }

    static EditPlan unmatched(String reason) {
        return new EditPlan(List.of(), null, reason);
    }

    boolean isMatched() {
        return unmatchedReason == null;
    }

    List<TextEdit> getEdits() {
        return edits;
    }

    String getDescription() {
        return description;
    }

    String getUnmatchedReason() {
        return unmatchedReason;
    }
}
