package org.dxworks.codeshaper.refactoring;

import org.dxworks.codeshaper.model.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based refactoring suggestions over a program summary. Each rule is independent;
 * the score is a fold over the severities of everything the rules produce.
 */
public class RefactoringAdvisor {

    public static final int MAX_PARAMETERS = 3;
    public static final int MAX_METHODS = 10;

    private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z][a-zA-Z0-9]*$");
    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern UNDERSCORE_LETTER = Pattern.compile("_([a-z])");

    private static final Comparator<RefactoringSuggestion> BY_SEVERITY_DESCENDING =
            Comparator.comparingInt((RefactoringSuggestion s) -> s.severity.getPenalty()).reversed();

    public RefactoringReport suggestRefactoring(ProgramSummary summary) {
        return suggestRefactoring(null, summary, SuggestionOptions.all());
    }

    /**
     * Runs every rule, scores the complete result, then orders and filters the suggestions.
     * The score ignores the filter so it stays comparable between calls.
     */
    public RefactoringReport suggestRefactoring(String file, ProgramSummary summary, SuggestionOptions options) {
        List<RefactoringSuggestion> suggestions = new ArrayList<>();
        checkFunctionComplexity(summary, suggestions);
        checkNamingConventions(summary, suggestions);
        checkClassSize(summary, suggestions);
        checkUnusedVariables(summary, suggestions);
        checkMissingExports(summary, suggestions);

        int score = calculateScore(suggestions);

        List<RefactoringSuggestion> ordered = suggestions.stream()
                .sorted(BY_SEVERITY_DESCENDING)
                .filter(s -> options.accepts(s.type))
                .limit(options.getMaxSuggestions())
                .collect(Collectors.toList());

        return new RefactoringReport(file, score, ordered);
    }

    private void checkFunctionComplexity(ProgramSummary summary, List<RefactoringSuggestion> out) {
        for (FunctionInfo func : summary.functions) {
            if (func.params.size() > MAX_PARAMETERS) {
                String joined = String.join(", ", func.params);
                out.add(new RefactoringSuggestion(
                        SuggestionType.COMPLEXITY,
                        Severity.MEDIUM,
                        func.line,
                        "Function '" + func.name + "' has " + func.params.size()
                                + " parameters. Consider using an options object.",
                        "Refactor to use a single options parameter: " + func.name + "(options: { " + joined + " })",
                        "function " + func.name + "({ " + joined + " }) { ... }\n"
                                + func.name + "({ " + joined + " });"));
            }
        }
    }

    private void checkNamingConventions(ProgramSummary summary, List<RefactoringSuggestion> out) {
        for (FunctionInfo func : summary.functions) {
            if (!isCamelCase(func.name)) {
                out.add(new RefactoringSuggestion(
                        SuggestionType.NAMING,
                        Severity.LOW,
                        func.line,
                        "Function '" + func.name + "' should use camelCase naming.",
                        "Rename to: " + toCamelCase(func.name)));
            }
        }

        for (ClassInfo cls : summary.classes) {
            if (!isPascalCase(cls.name)) {
                out.add(new RefactoringSuggestion(
                        SuggestionType.NAMING,
                        Severity.LOW,
                        cls.line,
                        "Class '" + cls.name + "' should use PascalCase naming.",
                        "Rename to: " + toPascalCase(cls.name)));
            }
        }

        for (VariableInfo variable : summary.variables) {
            if (variable.declarationKind != DeclarationKind.CONST) continue;
            // UPPER_CASE constants are fine
            if (variable.name.toUpperCase().equals(variable.name)) continue;
            if (!isCamelCase(variable.name)) {
                out.add(new RefactoringSuggestion(
                        SuggestionType.NAMING,
                        Severity.LOW,
                        variable.line,
                        "Constant '" + variable.name + "' should use camelCase or UPPER_CASE naming.",
                        "Rename to: " + toCamelCase(variable.name)));
            }
        }
    }

    private void checkClassSize(ProgramSummary summary, List<RefactoringSuggestion> out) {
        for (ClassInfo cls : summary.classes) {
            if (cls.methods.size() > MAX_METHODS) {
                out.add(new RefactoringSuggestion(
                        SuggestionType.STRUCTURE,
                        Severity.HIGH,
                        cls.line,
                        "Class '" + cls.name + "' has " + cls.methods.size()
                                + " methods. Consider splitting into smaller classes.",
                        "Apply Single Responsibility Principle and extract related methods into separate classes."));
            }
        }
    }

    /**
     * Naming-convention heuristic only: a leading underscore is taken to mean "unused".
     * No usage analysis happens, so intentionally ignored bindings are flagged too.
     */
    private void checkUnusedVariables(ProgramSummary summary, List<RefactoringSuggestion> out) {
        for (VariableInfo variable : summary.variables) {
            if (variable.name.startsWith("_")) {
                out.add(new RefactoringSuggestion(
                        SuggestionType.STRUCTURE,
                        Severity.LOW,
                        variable.line,
                        "Variable '" + variable.name + "' appears to be unused (prefixed with _).",
                        "Remove unused variables to keep code clean."));
            }
        }
    }

    private void checkMissingExports(ProgramSummary summary, List<RefactoringSuggestion> out) {
        Set<String> exportedNames = new HashSet<>();
        for (ExportInfo export : summary.exports) {
            exportedNames.add(export.name);
        }

        for (ClassInfo cls : summary.classes) {
            if (!cls.topLevel || cls.exported) continue;
            if (!exportedNames.contains(cls.name) && !cls.name.startsWith("_")) {
                out.add(new RefactoringSuggestion(
                        SuggestionType.STRUCTURE,
                        Severity.MEDIUM,
                        cls.line,
                        "Class '" + cls.name + "' is not exported. Consider exporting if it's part of the public API.",
                        "Add: export { " + cls.name + " };"));
            }
        }
    }

    /**
     * 100 minus the severity penalty of every suggestion, floored at 0.
     */
    public static int calculateScore(Collection<RefactoringSuggestion> suggestions) {
        int score = 100;
        for (RefactoringSuggestion suggestion : suggestions) {
            score -= suggestion.severity.getPenalty();
        }
        return Math.max(0, score);
    }

    static boolean isCamelCase(String name) {
        return name != null && CAMEL_CASE.matcher(name).matches();
    }

    static boolean isPascalCase(String name) {
        return name != null && PASCAL_CASE.matcher(name).matches();
    }

    static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toLowerCase(name.charAt(0)) + upperAfterUnderscore(name.substring(1));
    }

    static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) return name;
        return Character.toUpperCase(name.charAt(0)) + upperAfterUnderscore(name.substring(1));
    }

    private static String upperAfterUnderscore(String s) {
        Matcher matcher = UNDERSCORE_LETTER.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, matcher.group(1).toUpperCase());
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
