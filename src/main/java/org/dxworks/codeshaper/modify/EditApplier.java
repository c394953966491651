package org.dxworks.codeshaper.modify;

import org.dxworks.codeshaper.parser.SourceText;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders a list of non-overlapping edits against the text they were computed from.
 */
public final class EditApplier {

    private EditApplier() {
    }

    public static String apply(SourceText source, List<TextEdit> edits) {
        if (edits.isEmpty()) {
            return source.getText();
        }
        List<TextEdit> ordered = new ArrayList<>(edits);
        // stable: inserts at the same offset keep their relative order
        ordered.sort(Comparator.comparingInt(TextEdit::getStartByte));

        byte[] bytes = source.getBytes();
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length + 64);
        int cursor = 0;
        for (TextEdit edit : ordered) {
            if (edit.startByte < cursor) {
                throw new IllegalStateException("Overlapping edits at byte " + edit.startByte);
            }
            if (edit.endByte > bytes.length) {
                throw new IllegalStateException("Edit ends past the source at byte " + edit.endByte);
            }
            out.write(bytes, cursor, edit.startByte - cursor);
            byte[] replacement = edit.replacement.getBytes(StandardCharsets.UTF_8);
            out.write(replacement, 0, replacement.length);
            cursor = edit.endByte;
        }
        out.write(bytes, cursor, bytes.length - cursor);
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
}
