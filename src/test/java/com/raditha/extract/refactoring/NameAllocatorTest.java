package com.raditha.extract.refactoring;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.raditha.extract.util.SourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameAllocatorTest {

    private NameAllocator names;

    @BeforeEach
    void setUp() {
        CompilationUnit cu = new SourceParser().parseCompilationUnit("""
                class Worker {
                    private int result;

                    void run(int value) {
                        body:
                        {
                            int exit = value;
                        }
                    }
                }

                class Helper {
                    int item;
                }
                """);
        names = new NameAllocator(cu.findFirst(ClassOrInterfaceDeclaration.class,
                c -> c.getNameAsString().equals("Worker")).orElseThrow());
    }

    @Test
    void testFieldsLocalsAndLabelsAreTaken() {
        assertEquals("result1", names.fresh("result"));
        assertEquals("exit1", names.fresh("exit"));
        assertEquals("body1", names.fresh("body"));
        assertEquals("value1", names.fresh("value"));
    }

    @Test
    void testTypeNamesFromTheWholeFile() {
        assertTrue(names.isTaken("Helper"));
        assertEquals("Helper1", names.fresh("Helper"));
    }

    @Test
    void testMembersOfOtherTypesAreFree() {
        assertFalse(names.isTaken("item"));
        assertEquals("item", names.fresh("item"));
    }

    @Test
    void testFreshNamesAreReserved() {
        assertEquals("emitted", names.fresh("emitted"));
        assertEquals("emitted1", names.fresh("emitted"));
        assertEquals("emitted2", names.fresh("emitted"));
    }

    @Test
    void testKeywordsAndReservations() {
        assertEquals("class1", names.fresh("class"));
        names.reserve("helper");
        assertTrue(names.isTaken("helper"));
        assertEquals("helper1", names.fresh("helper"));
    }
}
