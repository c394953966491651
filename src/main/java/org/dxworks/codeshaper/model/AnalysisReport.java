package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * Response of the analyze operation: the program summary fields flattened next to the
 * derived metrics.
 */
@JsonPropertyOrder({"file", "language", "summary", "complexity", "issues", "suggestions"})
public class AnalysisReport {
    public final String file;
    public final String language;
    public final Summary summary;
    public final Complexity complexity;
    public final List<QualityIssue> issues;
    public final List<AnalysisSuggestion> suggestions;

    @JsonUnwrapped
    public final ProgramSummary program;

    public AnalysisReport(String file, String language, Summary summary, Complexity complexity,
                          List<QualityIssue> issues, List<AnalysisSuggestion> suggestions,
                          ProgramSummary program) {
        this.file = file;
        this.language = language;
        this.summary = summary;
        this.complexity = complexity;
        this.issues = List.copyOf(issues);
        this.suggestions = List.copyOf(suggestions);
        this.program = program;
    }

    public static class Summary {
        public final int totalFunctions;
        public final int totalClasses;
        public final int totalImports;
        public final int totalExports;
        public final int linesOfCode;

        public Summary(int totalFunctions, int totalClasses, int totalImports, int totalExports, int linesOfCode) {
            this.totalFunctions = totalFunctions;
            this.totalClasses = totalClasses;
            this.totalImports = totalImports;
            this.totalExports = totalExports;
            this.linesOfCode = linesOfCode;
        }
    }

    public static class Complexity {
        public final int overall;
        public final int maintainability;
        public final ComplexityRating rating;

        public Complexity(int overall, int maintainability, ComplexityRating rating) {
            this.overall = overall;
            this.maintainability = maintainability;
            this.rating = rating;
        }
    }

    public static class AnalysisSuggestion {
        public final SuggestionType type;
        public final String message;
        public final Severity severity;

        public AnalysisSuggestion(SuggestionType type, String message, Severity severity) {
            this.type = type;
            this.message = message;
            this.severity = severity;
        }
    }
}
