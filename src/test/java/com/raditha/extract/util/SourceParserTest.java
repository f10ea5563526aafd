package com.raditha.extract.util;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceParserTest {

    private final SourceParser parser = new SourceParser();

    @Test
    void testParsesJava17Constructs() {
        CompilationUnit cu = parser.parseCompilationUnit("""
                class A {
                    record Point(int x, int y) {}
                    String describe(Object o) {
                        if (o instanceof String s) {
                            return s;
                        }
                        return switch (o.hashCode()) {
                            case 1 -> "one";
                            default -> "other";
                        };
                    }
                }
                """);

        assertEquals(1, cu.findAll(MethodDeclaration.class).size());
    }

    @Test
    void testSymbolResolverIsAttached() {
        CompilationUnit cu = parser.parseCompilationUnit("class A { void f() { String s = \"x\"; } }");

        assertTrue(cu.containsData(Node.SYMBOL_RESOLVER_KEY));
    }

    @Test
    void testUnparseableTextIsAnInternalFailure() {
        ExtractionException e = assertThrows(ExtractionException.class,
                () -> parser.parseBodyDeclaration("void f( {"));

        assertEquals(ErrorKind.INTERNAL_ANALYSIS_FAILURE, e.getKind());
        assertTrue(e.getDetail().contains("void f( {"));
    }

    @Test
    void testTryParseType() {
        assertTrue(parser.tryParseType("java.util.Map<String, List<Integer>>").isPresent());
        assertTrue(parser.tryParseType("not a type").isEmpty());
    }

    @Test
    void testTryParseCompilationUnitReportsProblems() {
        assertFalse(parser.tryParseCompilationUnit("class {").isSuccessful());
        assertTrue(parser.tryParseCompilationUnit("class A {}").isSuccessful());
    }
}
