package org.dxworks.codeshaper;

import org.dxworks.codeshaper.format.FormatOptions;
import org.dxworks.codeshaper.io.FileSystemSourceStore;
import org.dxworks.codeshaper.io.TimestampedBackupPolicy;
import org.dxworks.codeshaper.model.*;
import org.dxworks.codeshaper.parser.DeclarationScope;
import org.dxworks.codeshaper.refactoring.SuggestionOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

public class CodeEngineTest {

    private static final Path JS_SAMPLE = Paths.get("src/test/resources/samples/javascript/order-service.js");

    @TempDir
    Path tempDir;

    private final CodeEngine engine = new CodeEngine(CodeshaperConfig.defaults(), new FileSystemSourceStore(),
            new TimestampedBackupPolicy(), Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC));

    @Test
    void analyze_javaScriptSample_reportsCountsAndMetrics() throws IOException {
        AnalysisReport report = engine.analyze(JS_SAMPLE);

        assertThat(report.language).isEqualTo("javascript");
        assertThat(report.summary.totalFunctions).isEqualTo(3);
        assertThat(report.summary.totalClasses).isEqualTo(1);
        assertThat(report.summary.totalImports).isEqualTo(3);
        assertThat(report.summary.totalExports).isEqualTo(2);
        assertThat(report.complexity.overall).isEqualTo(4);
        assertThat(report.complexity.rating).isEqualTo(ComplexityRating.LOW);
        assertThat(report.complexity.maintainability).isEqualTo(100);
        assertThat(report.issues).isEmpty();
        assertThat(report.program.functions).extracting(f -> f.name).contains("save_orders");
    }

    @Test
    void suggestRefactoring_javaScriptSample_scoresAllRules() throws IOException {
        RefactoringReport report = engine.suggestRefactoring(JS_SAMPLE);

        assertThat(report.score).isEqualTo(86);
        assertThat(report.suggestions).hasSize(4);
        assertThat(report.suggestions).extracting(s -> s.severity)
                .containsExactly(Severity.MEDIUM, Severity.MEDIUM, Severity.LOW, Severity.LOW);
        assertThat(report.file).isEqualTo(JS_SAMPLE.toString());

        RefactoringReport naming = engine.suggestRefactoring(JS_SAMPLE, SuggestionOptions.forArea("naming", 0));
        assertThat(naming.suggestions).extracting(s -> s.type).containsOnly(SuggestionType.NAMING);
        assertThat(naming.score).isEqualTo(86);
    }

    @Test
    void modify_jsonRequests_appliesInOrder() throws IOException {
        Path file = tempDir.resolve("app.js");
        Files.writeString(file, "import old from './old';\nconst value = old();\n");

        ModifyResult result = engine.modify(file, engine.parseRequests("["
                + "{\"type\":\"removeImport\",\"importPath\":\"./old\"},"
                + "{\"type\":\"addImport\",\"importName\":\"fresh\",\"importPath\":\"./fresh\"},"
                + "{\"type\":\"rename\",\"target\":\"old\",\"newName\":\"fresh\"}"
                + "]"));

        assertThat(Files.readString(file)).isEqualTo("import fresh from \"./fresh\";\nconst value = fresh();\n");
        assertThat(result.appliedModifications).hasSize(3);
        assertThat(Files.readString(Paths.get(result.backupPath)))
                .isEqualTo("import old from './old';\nconst value = old();\n");
    }

    @Test
    void modify_byteOrderMark_isKept() throws IOException {
        Path file = tempDir.resolve("bom.js");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "const a = 1;\n".getBytes(StandardCharsets.UTF_8);
        byte[] original = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, original, 0, bom.length);
        System.arraycopy(body, 0, original, bom.length, body.length);
        Files.write(file, original);

        ModifyResult result = engine.modify(file, engine.parseRequests(
                "[{\"type\":\"addImport\",\"importName\":\"x\",\"importPath\":\"./x\"}]"));

        byte[] written = Files.readAllBytes(file);
        assertThat(Arrays.copyOf(written, 3)).isEqualTo(bom);
        assertThat(new String(written, 3, written.length - 3, StandardCharsets.UTF_8))
                .isEqualTo("import x from \"./x\";\nconst a = 1;\n");
        assertThat(Files.readAllBytes(Paths.get(result.backupPath))).isEqualTo(original);
    }

    @Test
    void format_checkMode_doesNotWrite() throws IOException {
        Path file = tempDir.resolve("messy.js");
        String messy = "function f() {\nreturn 1\n}\n";
        Files.writeString(file, messy);

        FormatResult check = engine.format(file, FormatOptions.checkOnly());
        assertThat(check.modified).isTrue();
        assertThat(Files.readString(file)).isEqualTo(messy);

        FormatResult fix = engine.format(file);
        assertThat(fix.modified).isTrue();
        assertThat(Files.readString(file)).isEqualTo("function f() {\n  return 1;\n}\n");

        assertThat(engine.format(file).modified).isFalse();
    }

    @Test
    void analyze_allDeclarationScope_countsNestedFunctions() throws IOException {
        Path file = tempDir.resolve("nested.js");
        Files.writeString(file, "function outer() {\n  function inner() {}\n  return inner;\n}\n");
        CodeEngine everyLevel = new CodeEngine(CodeshaperConfig.defaults().withDeclarationScope(DeclarationScope.ALL));

        assertThat(engine.analyze(file).summary.totalFunctions).isEqualTo(1);
        assertThat(everyLevel.analyze(file).summary.totalFunctions).isEqualTo(2);
    }

    @Test
    void analyze_oversizeFile_isRejected() throws IOException {
        Path file = tempDir.resolve("big.js");
        Files.writeString(file, "a();\nb();\nc();\nd();\n");
        CodeEngine limited = new CodeEngine(CodeshaperConfig.defaults().withLimits(3, 0, 0));

        assertThatThrownBy(() -> limited.analyze(file))
                .isInstanceOf(LimitExceededException.class)
                .satisfies(e -> assertThat(((CodeshaperException) e).getKind()).isEqualTo(ErrorKind.LIMIT_EXCEEDED));
    }
}
