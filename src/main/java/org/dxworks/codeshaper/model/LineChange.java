package org.dxworks.codeshaper.model;

public class LineChange {
    public final int line;
    public final String description;

    public LineChange(int line, String description) {
        this.line = line;
        this.description = description;
    }
}
