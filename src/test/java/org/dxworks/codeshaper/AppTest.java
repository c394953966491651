package org.dxworks.codeshaper;

import org.dxworks.codeshaper.model.AnalysisReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class AppTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final CodeEngine engine = new CodeEngine(CodeshaperConfig.defaults());

    private int run(String... args) {
        return App.run(args, engine, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_withoutArguments_printsUsage() {
        assertThat(run()).isEqualTo(App.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage:");
    }

    @Test
    void run_unknownCommand_isUsageError() {
        assertThat(run("explode", "a.js")).isEqualTo(App.EXIT_USAGE);
    }

    @Test
    void analyze_printsJsonReport() {
        assertThat(run("analyze", "src/test/resources/samples/javascript/order-service.js")).isEqualTo(App.EXIT_OK);
        assertThat(stdout()).contains("\"totalFunctions\" : 3").contains("\"rating\" : \"low\"");
    }

    @Test
    void suggest_withTypeAndMax_filtersSuggestions() {
        assertThat(run("suggest", "src/test/resources/samples/javascript/order-service.js", "--type=naming", "--max=1"))
                .isEqualTo(App.EXIT_OK);
        assertThat(stdout()).contains("\"score\" : 86").contains("\"type\" : \"naming\"")
                .doesNotContain("\"type\" : \"complexity\"");
    }

    @Test
    void suggest_badMax_isUsageError() {
        assertThat(run("suggest", "src/test/resources/samples/javascript/order-service.js", "--max=lots"))
                .isEqualTo(App.EXIT_USAGE);
    }

    @Test
    void modify_readsRequestFile() throws IOException {
        Path source = tempDir.resolve("a.js");
        Path requests = tempDir.resolve("requests.json");
        Files.writeString(source, "let count = 1;\ncount++;\n");
        Files.writeString(requests, "[{\"type\":\"rename\",\"target\":\"count\",\"newName\":\"total\"}]");

        assertThat(run("modify", source.toString(), requests.toString())).isEqualTo(App.EXIT_OK);
        assertThat(Files.readString(source)).isEqualTo("let count = 1;\ntotal++;\n");
        assertThat(stdout()).contains("Renamed count to total").contains("backupPath");
    }

    @Test
    void format_malformedSource_reportsParseError() throws IOException {
        Path source = tempDir.resolve("broken.js");
        Files.writeString(source, "function (\n");

        assertThat(run("format", source.toString(), "--check")).isEqualTo(App.EXIT_FAILURE);
        assertThat(stdout()).contains("\"errorKind\" : \"PARSE\"");
    }

    @Test
    void analyze_unexpectedFailure_reportsInternalError() {
        CodeEngine failing = new CodeEngine(CodeshaperConfig.defaults()) {
            @Override
            public AnalysisReport analyze(Path file) {
                throw new IllegalStateException("Overlapping edits");
            }
        };

        int exitCode = App.run(new String[]{"analyze", "a.js"}, failing,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(exitCode).isEqualTo(App.EXIT_FAILURE);
        assertThat(stdout()).contains("\"errorKind\" : \"INTERNAL\"").contains("IllegalStateException: Overlapping edits");
    }

    @Test
    void analyze_missingFile_reportsIoError() {
        assertThat(run("analyze", tempDir.resolve("nope.js").toString())).isEqualTo(App.EXIT_FAILURE);
        assertThat(stdout()).contains("\"errorKind\" : \"IO\"");
    }
}
