package org.dxworks.codeshaper.io;

/**
 * Leading UTF-8 byte order mark, as it appears after decoding.
 */
public final class ByteOrderMark {

    public static final String BOM = "\uFEFF";

    private ByteOrderMark() {
    }

    public static boolean isPresent(String text) {
        return text != null && text.startsWith(BOM);
    }

    public static String strip(String text) {
        return isPresent(text) ? text.substring(BOM.length()) : text;
    }

    public static String restore(String text, boolean hadBom) {
        return hadBom && !isPresent(text) ? BOM + text : text;
    }
}
