package com.raditha.extract.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndentationTest {

    @Test
    void testReindentPrefixesEveryLine() {
        String result = Indentation.reindent("a();\nif (x) {\n    b();\n}", "  ", "\n", false);

        assertEquals("  a();\n  if (x) {\n      b();\n  }", result);
    }

    @Test
    void testSkipFirstLeavesFirstLineAlone() {
        String result = Indentation.reindent("int y = f();\ng(y);", "\t", "\r\n", true);

        assertEquals("int y = f();\r\n\tg(y);", result);
    }

    @Test
    void testBlankLinesStayEmpty() {
        String result = Indentation.reindent("a();\n   \nb();", "    ", "\n", false);

        assertEquals("    a();\n\n    b();", result);
    }
}
