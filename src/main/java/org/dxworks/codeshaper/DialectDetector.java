package org.dxworks.codeshaper;

import java.nio.file.Path;

public class DialectDetector {

    public static Dialect detectDialect(Path filePath) {
        if (filePath == null || filePath.getFileName() == null) {
            return Dialect.AUTO;
        }
        String fileName = filePath.getFileName().toString().toLowerCase();

        if (fileName.endsWith(".ts") || fileName.endsWith(".mts") || fileName.endsWith(".cts")) {
            return Dialect.TYPESCRIPT;
        } else if (fileName.endsWith(".js") || fileName.endsWith(".jsx")
                || fileName.endsWith(".tsx") || fileName.endsWith(".mjs") || fileName.endsWith(".cjs")) {
            return Dialect.JAVASCRIPT;
        }

        return Dialect.AUTO;
    }
}
