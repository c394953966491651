package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefactoringSuggestion {
    public final SuggestionType type;
    public final Severity severity;
    public final int line;
    public final String description;
    public final String suggestion;
    public final String example;

    public RefactoringSuggestion(SuggestionType type, Severity severity, int line,
                                 String description, String suggestion, String example) {
        this.type = type;
        this.severity = severity;
        this.line = line;
        this.description = description;
        this.suggestion = suggestion;
        this.example = example;
    }

    public RefactoringSuggestion(SuggestionType type, Severity severity, int line,
                                 String description, String suggestion) {
        this(type, severity, line, description, suggestion, null);
    }
}
