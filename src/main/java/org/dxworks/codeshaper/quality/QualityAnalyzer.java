package org.dxworks.codeshaper.quality;

import org.dxworks.codeshaper.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level quality metrics: a branch-counting complexity over the raw source and a
 * bounded maintainability heuristic. Threshold crossings are reported as issues.
 */
public class QualityAnalyzer {

    public static final int MAX_FUNCTIONS = 20;
    public static final int MAX_COMPLEXITY = 10;
    public static final int MAX_AVERAGE_FUNCTION_LENGTH = 50;
    public static final int SHORT_NAME_LENGTH = 3;

    static final String TOO_MANY_FUNCTIONS = "File has too many functions, consider splitting";
    static final String HIGH_COMPLEXITY = "High complexity detected";

    private static final List<Pattern> COMPLEXITY_PATTERNS = List.of(
            Pattern.compile("\\bif\\s*\\("),
            Pattern.compile("\\belse\\s+if\\s*\\("),
            Pattern.compile("\\bwhile\\s*\\("),
            Pattern.compile("\\bfor\\s*\\("),
            Pattern.compile("\\bcase\\s+"),
            Pattern.compile("\\bcatch\\s*\\("),
            Pattern.compile("\\|\\|"),
            Pattern.compile("&&"),
            // ternary '?', not '??', '?.', '?:' or '??='
            Pattern.compile("(?<!\\?)\\?(?![?.:=])")
    );

    public QualityMetrics analyzeQuality(String sourceCode, ProgramSummary summary) {
        int linesOfCode = countLines(sourceCode);
        int functionCount = summary.functions.size();
        int complexity = calculateComplexity(sourceCode);
        int maintainability = calculateMaintainability(linesOfCode, functionCount, complexity);

        List<QualityIssue> issues = new ArrayList<>();
        if (functionCount > MAX_FUNCTIONS) {
            issues.add(warning(TOO_MANY_FUNCTIONS));
        }
        if (complexity > MAX_COMPLEXITY) {
            issues.add(warning(HIGH_COMPLEXITY));
        }

        return new QualityMetrics(linesOfCode, functionCount, summary.classes.size(), complexity,
                maintainability, ComplexityRating.of(complexity), issues);
    }

    /**
     * Coarse per-file suggestions attached to an analysis report.
     */
    public List<AnalysisReport.AnalysisSuggestion> coarseSuggestions(QualityMetrics metrics, ProgramSummary summary) {
        List<AnalysisReport.AnalysisSuggestion> suggestions = new ArrayList<>();
        if (metrics.complexity > MAX_COMPLEXITY) {
            suggestions.add(new AnalysisReport.AnalysisSuggestion(SuggestionType.COMPLEXITY,
                    "Consider breaking down complex functions", Severity.MEDIUM));
        }
        if (summary.functions.size() > MAX_FUNCTIONS) {
            suggestions.add(new AnalysisReport.AnalysisSuggestion(SuggestionType.STRUCTURE,
                    "Consider splitting this file into smaller modules", Severity.LOW));
        }
        if (summary.functions.stream().anyMatch(f -> f.name == null || f.name.length() < SHORT_NAME_LENGTH)) {
            suggestions.add(new AnalysisReport.AnalysisSuggestion(SuggestionType.NAMING,
                    "Use more descriptive function names", Severity.LOW));
        }
        return suggestions;
    }

    public static int calculateComplexity(String sourceCode) {
        int complexity = 1;
        for (Pattern pattern : COMPLEXITY_PATTERNS) {
            Matcher matcher = pattern.matcher(sourceCode);
            while (matcher.find()) {
                complexity++;
            }
        }
        return complexity;
    }

    public static int calculateMaintainability(int linesOfCode, int functionCount, int complexity) {
        double avgFunctionLength = (double) linesOfCode / Math.max(functionCount, 1);

        int maintainability = 100;
        maintainability -= avgFunctionLength > MAX_AVERAGE_FUNCTION_LENGTH ? 20 : 0;
        maintainability -= complexity > MAX_COMPLEXITY ? 20 : 0;
        maintainability -= functionCount > MAX_FUNCTIONS ? 10 : 0;

        return Math.max(0, maintainability);
    }

    static int countLines(String sourceCode) {
        return sourceCode.split("\n", -1).length;
    }

    private static QualityIssue warning(String message) {
        return new QualityIssue("warning", Severity.MEDIUM, message, categorize(message));
    }

    static String categorize(String message) {
        String lower = message.toLowerCase();
        if (lower.contains("function")) return "structure";
        if (lower.contains("complex")) return "complexity";
        if (lower.contains("naming")) return "naming";
        return "general";
    }
}
