package org.dxworks.codeshaper.modify;

import org.treesitter.TSNode;

/**
 * Replacement of a UTF-8 byte range of the current source.
 */
public final class TextEdit {

    final int startByte;
    final int endByte;
    final String replacement;

    private TextEdit(int startByte, int endByte, String replacement) {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid edit range [" + startByte + ", " + endByte + ")");
        }
        this.startByte = startByte;
        this.endByte = endByte;
        this.replacement = replacement;
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(offset, offset, text);
    }

    public static TextEdit replace(TSNode node, String text) {
        return new TextEdit(node.getStartByte(), node.getEndByte(), text);
    }

    public static TextEdit replace(int startByte, int endByte, String text) {
        return new TextEdit(startByte, endByte, text);
    }

    public static TextEdit delete(int startByte, int endByte) {
        return new TextEdit(startByte, endByte, "");
    }

    public int getStartByte() {
        return startByte;
    }

    public int getEndByte() {
        return endByte;
    }

    public String getReplacement() {
        return replacement;
    }
}
