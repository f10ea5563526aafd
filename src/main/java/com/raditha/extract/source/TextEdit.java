package com.raditha.extract.source;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replace a character range of a document.
 *
 * @param offset      Start offset
 * @param length      Number of characters replaced, 0 for an insertion
 * @param replacement New text
 */
public record TextEdit(int offset, int length, String replacement) {

    public TextEdit {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("offset and length must be >= 0");
        }
        if (replacement == null) {
            replacement = "";
        }
    }

    public static TextEdit replace(int startOffset, int endOffset, String replacement) {
        return new TextEdit(startOffset, endOffset - startOffset, replacement);
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(offset, 0, text);
    }

    public int end() {
        return offset + length;
    }

    /**
     * Apply the edits to a text, last edit first so earlier offsets stay valid.
     *
     * @throws IllegalArgumentException if edits overlap or fall outside the text
     */
    public static String applyAll(String text, List<TextEdit> edits) {
        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(TextEdit::offset).thenComparingInt(TextEdit::length));

        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).offset() < ordered.get(i - 1).end()) {
                throw new IllegalArgumentException("Overlapping edits at offset " + ordered.get(i).offset());
            }
        }

        StringBuilder result = new StringBuilder(text);
        for (int i = ordered.size() - 1; i >= 0; i--) {
            TextEdit edit = ordered.get(i);
            if (edit.end() > text.length()) {
                throw new IllegalArgumentException("Edit ends at " + edit.end() + " beyond text length " + text.length());
            }
            result.replace(edit.offset(), edit.end(), edit.replacement());
        }
        return result.toString();
    }
}
