package com.raditha.extract.model;

import com.github.javaparser.ast.Node;

/**
 * A source code range in line and column positions.
 * Columns count characters, so a tab occupies a single column.
 *
 * @param startLine   Starting line number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param startColumn Starting column number (1-indexed)
 * @param endColumn   Ending column number (1-indexed, inclusive)
 */
public record Range(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn) {

    public Range {
        if (startLine < 1 || endLine < 1 || startColumn < 1 || endColumn < 1) {
            throw new IllegalArgumentException("Range positions are 1-based: " + startLine + ":" + startColumn
                    + "-" + endLine + ":" + endColumn);
        }
    }

    /**
     * Create from a JavaParser range.
     */
    public static Range from(com.github.javaparser.Range jpRange) {
        return new Range(
                jpRange.begin.line,
                jpRange.end.line,
                jpRange.begin.column,
                jpRange.end.column);
    }

    /**
     * Create from the first and last nodes of a contiguous run.
     */
    public static Range spanning(Node first, Node last) {
        com.github.javaparser.Range start = first.getRange().orElseThrow();
        com.github.javaparser.Range end = last.getRange().orElseThrow();
        return new Range(start.begin.line, end.end.line, start.begin.column, end.end.column);
    }

    /**
     * Convenience factory taking positions in reading order.
     */
    public static Range of(int startLine, int startColumn, int endLine, int endColumn) {
        return new Range(startLine, endLine, startColumn, endColumn);
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * True when the start position does not come after the end position.
     */
    public boolean isOrdered() {
        return startLine < endLine || (startLine == endLine && startColumn <= endColumn);
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
