package org.dxworks.codeshaper.model;

public class MethodInfo {
    public final String name;
    public final boolean isStatic;
    public final boolean isAsync;
    public final int line;

    public MethodInfo(String name, boolean isStatic, boolean isAsync, int line) {
        this.name = name;
        this.isStatic = isStatic;
        this.isAsync = isAsync;
        this.line = line;
    }
}
