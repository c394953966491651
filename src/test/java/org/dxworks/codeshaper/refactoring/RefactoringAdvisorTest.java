package org.dxworks.codeshaper.refactoring;

import org.dxworks.codeshaper.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

public class RefactoringAdvisorTest {

    private final RefactoringAdvisor advisor = new RefactoringAdvisor();

    private static FunctionInfo function(String name, String... params) {
        return new FunctionInfo(name, List.of(params), false, false, 1);
    }

    private static ClassInfo exportedClass(String name, int methodCount) {
        List<MethodInfo> methods = new ArrayList<>();
        for (int i = 0; i < methodCount; i++) {
            methods.add(new MethodInfo("method" + i, false, false, i + 2));
        }
        return new ClassInfo(name, null, methods, 1, true, true);
    }

    @Test
    void suggestRefactoring_tooManyParameters_suggestsOptionsObject() {
        ProgramSummary summary = ProgramSummary.builder().addFunction(function("foo", "a", "b", "c", "d")).build();

        RefactoringReport report = advisor.suggestRefactoring(summary);

        assertThat(report.suggestions).hasSize(1);
        RefactoringSuggestion suggestion = report.suggestions.get(0);
        assertThat(suggestion.type).isEqualTo(SuggestionType.COMPLEXITY);
        assertThat(suggestion.severity).isEqualTo(Severity.MEDIUM);
        assertThat(suggestion.example).contains("foo({ a, b, c, d })");
        assertThat(report.score).isEqualTo(95);
    }

    @Test
    void suggestRefactoring_threeParameters_isFine() {
        ProgramSummary summary = ProgramSummary.builder().addFunction(function("foo", "a", "b", "c")).build();

        assertThat(advisor.suggestRefactoring(summary).suggestions).isEmpty();
        assertThat(advisor.suggestRefactoring(summary).score).isEqualTo(100);
    }

    @Test
    void suggestRefactoring_twoLowAndOneMedium_scores91() {
        ProgramSummary summary = ProgramSummary.builder()
                .addFunction(function("Bad_name"))
                .addClass(new ClassInfo("lowerCase", null, List.of(), 3, false, true))
                .build();

        RefactoringReport report = advisor.suggestRefactoring(summary);

        assertThat(report.suggestions).extracting(s -> s.severity)
                .containsExactly(Severity.MEDIUM, Severity.LOW, Severity.LOW);
        assertThat(report.score).isEqualTo(91);
        assertThat(report.suggestions.get(1).suggestion).isEqualTo("Rename to: badName");
    }

    @Test
    void suggestRefactoring_largeClass_flagsStructureHigh() {
        ProgramSummary summary = ProgramSummary.builder().addClass(exportedClass("Service", 11)).build();

        RefactoringReport report = advisor.suggestRefactoring(summary);

        assertThat(report.suggestions).hasSize(1);
        assertThat(report.suggestions.get(0).type).isEqualTo(SuggestionType.STRUCTURE);
        assertThat(report.suggestions.get(0).severity).isEqualTo(Severity.HIGH);
        assertThat(report.score).isEqualTo(90);
    }

    @Test
    void suggestRefactoring_tenMethods_isFine() {
        ProgramSummary summary = ProgramSummary.builder().addClass(exportedClass("Service", 10)).build();

        assertThat(advisor.suggestRefactoring(summary).suggestions).isEmpty();
    }

    @Test
    void suggestRefactoring_constNaming_acceptsCamelAndUpperCase() {
        ProgramSummary summary = ProgramSummary.builder()
                .addVariable(new VariableInfo("MAX_SIZE", DeclarationKind.CONST, 1))
                .addVariable(new VariableInfo("maxSize", DeclarationKind.CONST, 2))
                .addVariable(new VariableInfo("max_size", DeclarationKind.CONST, 3))
                .addVariable(new VariableInfo("Other_value", DeclarationKind.LET, 4))
                .build();

        RefactoringReport report = advisor.suggestRefactoring(summary);

        assertThat(report.suggestions).hasSize(1);
        assertThat(report.suggestions.get(0).line).isEqualTo(3);
        assertThat(report.suggestions.get(0).suggestion).isEqualTo("Rename to: maxSize");
    }

    @Test
    void suggestRefactoring_underscoreVariable_flaggedAsUnused() {
        ProgramSummary summary = ProgramSummary.builder()
                .addVariable(new VariableInfo("_ignored", DeclarationKind.LET, 7))
                .build();

        RefactoringReport report = advisor.suggestRefactoring(summary);

        assertThat(report.suggestions).hasSize(1);
        assertThat(report.suggestions.get(0).type).isEqualTo(SuggestionType.STRUCTURE);
        assertThat(report.suggestions.get(0).severity).isEqualTo(Severity.LOW);
        assertThat(report.suggestions.get(0).line).isEqualTo(7);
    }

    @Test
    void suggestRefactoring_classExportedByName_isNotFlagged() {
        ProgramSummary summary = ProgramSummary.builder()
                .addClass(new ClassInfo("Widget", null, List.of(), 1, false, true))
                .addClass(new ClassInfo("_Internal", null, List.of(), 5, false, true))
                .addClass(new ClassInfo("Nested", null, List.of(), 9, false, false))
                .addExport(new ExportInfo(ExportKind.NAMED, "Widget", null))
                .build();

        assertThat(advisor.suggestRefactoring(summary).suggestions)
                .noneMatch(s -> s.description.contains("not exported"));
    }

    @Test
    void suggestRefactoring_focusAndLimit_keepScoreOfAllSuggestions() {
        ProgramSummary summary = ProgramSummary.builder()
                .addFunction(function("Bad_name", "a", "b", "c", "d"))
                .addClass(exportedClass("Big", 12))
                .build();

        RefactoringReport all = advisor.suggestRefactoring(summary);
        RefactoringReport naming = advisor.suggestRefactoring("f.js", summary,
                SuggestionOptions.of(Set.of(SuggestionType.NAMING), 0));
        RefactoringReport limited = advisor.suggestRefactoring("f.js", summary, SuggestionOptions.of(null, 1));

        assertThat(all.suggestions).extracting(s -> s.severity)
                .containsExactly(Severity.HIGH, Severity.MEDIUM, Severity.LOW);
        assertThat(naming.suggestions).extracting(s -> s.type).containsExactly(SuggestionType.NAMING);
        assertThat(limited.suggestions).extracting(s -> s.severity).containsExactly(Severity.HIGH);
        assertThat(naming.score).isEqualTo(all.score).isEqualTo(83);
        assertThat(naming.file).isEqualTo("f.js");
    }

    @Test
    void calculateScore_floorsAtZero() {
        List<RefactoringSuggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            suggestions.add(new RefactoringSuggestion(SuggestionType.STRUCTURE, Severity.HIGH, 1, "d", "s"));
        }

        assertThat(RefactoringAdvisor.calculateScore(suggestions)).isZero();
    }

    @Test
    void caseConversion_removesUnderscores() {
        assertThat(RefactoringAdvisor.toCamelCase("Save_orders")).isEqualTo("saveOrders");
        assertThat(RefactoringAdvisor.toPascalCase("my_class")).isEqualTo("MyClass");
        assertThat(RefactoringAdvisor.isCamelCase("saveOrders")).isTrue();
        assertThat(RefactoringAdvisor.isPascalCase("saveOrders")).isFalse();
    }

    @Test
    void forArea_unknownArea_isRejected() {
        assertThatThrownBy(() -> SuggestionOptions.forArea("style", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
