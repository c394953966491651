package org.dxworks.codeshaper.model;

import java.util.List;

public class ImportInfo {
    public final String sourcePath;
    public final List<ImportSpecifier> specifiers;
    public final int line;

    public ImportInfo(String sourcePath, List<ImportSpecifier> specifiers, int line) {
        this.sourcePath = sourcePath;
        this.specifiers = List.copyOf(specifiers);
        this.line = line;
    }
}
