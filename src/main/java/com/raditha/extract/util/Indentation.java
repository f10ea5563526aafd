package com.raditha.extract.util;

import java.util.List;

/**
 * Re-indents generated text for the place it is inserted.
 */
public class Indentation {

    private Indentation() {
        /* this is only a utility class */
    }

    /**
     * Prefix every non-blank line with {@code indent} and join with {@code lineSeparator}.
     *
     * @param skipFirst leave the first line alone, for text inserted after existing indentation
     */
    public static String reindent(String text, String indent, String lineSeparator, boolean skipFirst) {
        List<String> lines = text.lines().toList();
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i > 0) {
                result.append(lineSeparator);
            }
            if (!line.isBlank() && !(skipFirst && i == 0)) {
                result.append(indent);
            }
            result.append(line.isBlank() ? "" : line);
        }
        return result.toString();
    }
}
