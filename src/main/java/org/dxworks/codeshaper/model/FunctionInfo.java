package org.dxworks.codeshaper.model;

import java.util.List;

public class FunctionInfo {
    public final String name;
    public final List<String> params;
    public final boolean isAsync;
    public final boolean isGenerator;
    public final int line;

    public FunctionInfo(String name, List<String> params, boolean isAsync, boolean isGenerator, int line) {
        this.name = name;
        this.params = List.copyOf(params);
        this.isAsync = isAsync;
        this.isGenerator = isGenerator;
        this.line = line;
    }
}
