package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefactoringReport {
    public final String file;
    public final int score;
    public final List<RefactoringSuggestion> suggestions;

    public RefactoringReport(String file, int score, List<RefactoringSuggestion> suggestions) {
        this.file = file;
        this.score = score;
        this.suggestions = List.copyOf(suggestions);
    }
}
