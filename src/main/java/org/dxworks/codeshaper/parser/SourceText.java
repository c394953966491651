package org.dxworks.codeshaper.parser;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Source code together with its UTF-8 encoding. Tree-sitter reports UTF-8 byte offsets,
 * so node text and line numbers are resolved against the byte array.
 */
public final class SourceText {

    private final String text;
    private final byte[] bytes;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        this.lineStarts = computeLineStarts(bytes);
    }

    private static int[] computeLineStarts(byte[] bytes) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts.add(i + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }

    public String getText() {
        return text;
    }

    public byte[] getBytes() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public String text(TSNode node) {
        if (node == null || node.isNull()) return null;
        return text(node.getStartByte(), node.getEndByte());
    }

    public String text(int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > bytes.length) endByte = bytes.length;
        if (startByte >= endByte) return "";
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /**
     * 1-based line containing the given byte offset.
     */
    public int lineOf(int byteOffset) {
        int idx = Arrays.binarySearch(lineStarts, byteOffset);
        if (idx >= 0) return idx + 1;
        return -idx - 1;
    }

    /**
     * 1-based column (in bytes) of the given byte offset.
     */
    public int columnOf(int byteOffset) {
        return byteOffset - lineStart(lineOf(byteOffset)) + 1;
    }

    public int lineOf(TSNode node) {
        return lineOf(node.getStartByte());
    }

    /**
     * Byte offset where the given 1-based line starts.
     */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Byte offset of the line break ending the given 1-based line, or the end of input.
     */
    public int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] - 1 : bytes.length;
    }
}
