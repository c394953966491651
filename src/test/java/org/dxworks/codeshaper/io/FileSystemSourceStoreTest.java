package org.dxworks.codeshaper.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

public class FileSystemSourceStoreTest {

    @TempDir
    Path tempDir;

    private final FileSystemSourceStore store = new FileSystemSourceStore();

    @Test
    void write_thenRead_keepsUtf8Content() throws IOException {
        Path file = tempDir.resolve("a.js");

        store.write(file, "const s = 'ünïcödé';\n");
        store.write(file, "const t = 'ß';\n");

        assertThat(store.read(file)).isEqualTo("const t = 'ß';\n");
        assertThat(store.exists(file)).isTrue();
    }

    @Test
    void writeNew_existingFile_fails() throws IOException {
        Path file = tempDir.resolve("a.js");
        Files.writeString(file, "x");

        assertThatThrownBy(() -> store.writeNew(file, "y")).isInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readString(file)).isEqualTo("x");
    }

    @Test
    void read_directoryOrMissingFile_fails() {
        assertThatThrownBy(() -> store.read(tempDir)).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> store.read(tempDir.resolve("missing.js"))).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void backupPolicy_appendsEpochMillis() {
        Path backup = new TimestampedBackupPolicy()
                .backupPathFor(tempDir.resolve("src/app.ts"), Instant.ofEpochMilli(1234L));

        assertThat(backup).isEqualTo(tempDir.resolve("src/app.ts.backup.1234"));
    }

    @Test
    void byteOrderMark_stripAndRestore() {
        String withBom = ByteOrderMark.BOM + "x";

        assertThat(ByteOrderMark.isPresent(withBom)).isTrue();
        assertThat(ByteOrderMark.strip(withBom)).isEqualTo("x");
        assertThat(ByteOrderMark.restore("y", true)).isEqualTo(ByteOrderMark.BOM + "y");
        assertThat(ByteOrderMark.restore("y", false)).isEqualTo("y");
    }
}
