package com.raditha.extract.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps between 1-based line/column positions and character offsets.
 * Recognizes \n, \r\n and \r line terminators the same way JavaParser does.
 */
public final class LineIndex {

    private final String text;
    private final int[] lineStarts;
    private final int[] lineEnds;

    private LineIndex(String text, int[] lineStarts, int[] lineEnds) {
        this.text = text;
        this.lineStarts = lineStarts;
        this.lineEnds = lineEnds;
    }

    public static LineIndex of(String text) {
        List<Integer> starts = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        starts.add(0);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                ends.add(i);
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
            i++;
        }
        ends.add(text.length());
        return new LineIndex(text,
                starts.stream().mapToInt(Integer::intValue).toArray(),
                ends.stream().mapToInt(Integer::intValue).toArray());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public String text() {
        return text;
    }

    public int lineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the last character of the line, before its terminator.
     */
    public int lineEnd(int line) {
        checkLine(line);
        return lineEnds[line - 1];
    }

    /**
     * Offset of a position. Columns past the end of the line clamp to the line end.
     */
    public int offset(int line, int column) {
        int start = lineStart(line);
        return Math.min(start + Math.max(column, 1) - 1, lineEnd(line));
    }

    public int offset(com.github.javaparser.Position position) {
        return offset(position.line, position.column);
    }

    /**
     * Line containing the offset.
     */
    public int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    public int columnOf(int offset) {
        return offset - lineStart(lineOf(offset)) + 1;
    }

    /**
     * Leading whitespace of a line.
     */
    public String indentationOf(int line) {
        int start = lineStart(line);
        int end = lineEnd(line);
        int i = start;
        while (i < end && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(start, i);
    }

    /**
     * The line terminator used by the document, \n when it has none.
     */
    public String lineSeparator() {
        if (lineStarts.length < 2) {
            return "\n";
        }
        int end = lineEnds[0];
        return text.substring(end, lineStarts[1]);
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("Line " + line + " outside 1.." + lineStarts.length);
        }
    }
}
