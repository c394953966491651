package org.dxworks.codeshaper.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SourceTextTest {

    @Test
    void lineOf_multiByteCharacters_countsUtf8Bytes() {
        SourceText source = new SourceText("const s = 'é';\nlet x;\n");

        int secondLine = source.lineStart(2);
        assertThat(secondLine).isEqualTo("const s = 'é';\n".getBytes(java.nio.charset.StandardCharsets.UTF_8).length);
        assertThat(source.lineOf(secondLine)).isEqualTo(2);
        assertThat(source.text(secondLine, source.lineEnd(2))).isEqualTo("let x;");
        assertThat(source.getLineCount()).isEqualTo(3);
    }

    @Test
    void columnOf_returnsOneBasedColumn() {
        SourceText source = new SourceText("ab\ncd");

        assertThat(source.columnOf(0)).isEqualTo(1);
        assertThat(source.columnOf(4)).isEqualTo(2);
        assertThat(source.lineEnd(2)).isEqualTo(5);
    }
}
