package com.raditha.extract.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {

    @Test
    void testOffsetsWithUnixLineEndings() {
        LineIndex index = LineIndex.of("ab\ncd\n  ef");

        assertEquals(3, index.lineCount());
        assertEquals(0, index.offset(1, 1));
        assertEquals(3, index.offset(2, 1));
        assertEquals(8, index.offset(3, 3));
        assertEquals("\n", index.lineSeparator());
    }

    @Test
    void testWindowsLineEndingsCountAsOneTerminator() {
        LineIndex index = LineIndex.of("ab\r\ncd\r\nef");

        assertEquals(3, index.lineCount());
        assertEquals(4, index.lineStart(2));
        assertEquals(6, index.lineEnd(2));
        assertEquals("\r\n", index.lineSeparator());
    }

    @Test
    void testColumnPastLineEndClampsToEnd() {
        LineIndex index = LineIndex.of("ab\ncd");

        assertEquals(2, index.offset(1, 40));
    }

    @Test
    void testLineAndColumnOfOffset() {
        LineIndex index = LineIndex.of("ab\ncd\nef");

        assertEquals(1, index.lineOf(0));
        assertEquals(2, index.lineOf(3));
        assertEquals(2, index.lineOf(4));
        assertEquals(3, index.lineOf(6));
        assertEquals(2, index.columnOf(4));
    }

    @Test
    void testIndentationOfLine() {
        LineIndex index = LineIndex.of("class A {\n    \tint x;\n}");

        assertEquals("", index.indentationOf(1));
        assertEquals("    \t", index.indentationOf(2));
    }

    @Test
    void testSingleLineDefaultsToUnixSeparator() {
        assertEquals("\n", LineIndex.of("int x;").lineSeparator());
    }

    @Test
    void testLineOutsideDocumentIsRejected() {
        LineIndex index = LineIndex.of("a\nb");

        assertThrows(IndexOutOfBoundsException.class, () -> index.lineStart(0));
        assertThrows(IndexOutOfBoundsException.class, () -> index.lineStart(3));
    }
}
