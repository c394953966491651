package org.dxworks.codeshaper.model;

public class QualityIssue {
    public final String type;
    public final Severity severity;
    public final String message;
    public final String category;

    public QualityIssue(String type, Severity severity, String message, String category) {
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.category = category;
    }
}
