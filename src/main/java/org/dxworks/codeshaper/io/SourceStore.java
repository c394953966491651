package org.dxworks.codeshaper.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Storage capability the engine persists through. Each call is one complete
 * open/write/close cycle.
 */
public interface SourceStore {

    String read(Path path) throws IOException;

    boolean exists(Path path);

    /**
     * Replaces the content of an existing or new file.
     */
    void write(Path path, String content) throws IOException;

    /**
     * Writes a file that must not exist yet.
     */
    void writeNew(Path path, String content) throws IOException;
}
