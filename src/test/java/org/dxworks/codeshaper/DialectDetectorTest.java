package org.dxworks.codeshaper;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

public class DialectDetectorTest {

    @Test
    void detectDialect_mapsExtensions() {
        assertThat(DialectDetector.detectDialect(Paths.get("a/b.js"))).isEqualTo(Dialect.JAVASCRIPT);
        assertThat(DialectDetector.detectDialect(Paths.get("b.JSX"))).isEqualTo(Dialect.JAVASCRIPT);
        assertThat(DialectDetector.detectDialect(Paths.get("b.mjs"))).isEqualTo(Dialect.JAVASCRIPT);
        assertThat(DialectDetector.detectDialect(Paths.get("b.ts"))).isEqualTo(Dialect.TYPESCRIPT);
        assertThat(DialectDetector.detectDialect(Paths.get("b.tsx"))).isEqualTo(Dialect.JAVASCRIPT);
        assertThat(DialectDetector.detectDialect(Paths.get("README"))).isEqualTo(Dialect.AUTO);
    }
}
