package org.dxworks.codeshaper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CodeEngineApprovalTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final Path JAVASCRIPT_SAMPLE = Paths.get("src/test/resources/samples/javascript/order-service.js");
    private static final Path TYPESCRIPT_SAMPLE = Paths.get("src/test/resources/samples/typescript/user-service.ts");

    private final CodeEngine engine = new CodeEngine(CodeshaperConfig.defaults());

    @Test
    void analyze_JavaScript_Sample() throws IOException {
        Approvals.verify(MAPPER.writeValueAsString(engine.analyze(JAVASCRIPT_SAMPLE)));
    }

    @Test
    void analyze_TypeScript_Sample() throws IOException {
        Approvals.verify(MAPPER.writeValueAsString(engine.analyze(TYPESCRIPT_SAMPLE)));
    }

    @Test
    void suggest_JavaScript_Sample() throws IOException {
        Approvals.verify(MAPPER.writeValueAsString(engine.suggestRefactoring(JAVASCRIPT_SAMPLE)));
    }

    @Test
    void suggest_TypeScript_Sample() throws IOException {
        Approvals.verify(MAPPER.writeValueAsString(engine.suggestRefactoring(TYPESCRIPT_SAMPLE)));
    }
}
