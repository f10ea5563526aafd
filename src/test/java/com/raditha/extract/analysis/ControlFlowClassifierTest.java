package com.raditha.extract.analysis;

import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExitKind;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.testing.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowClassifierTest {

    @Test
    void testStraightLineCodeOnlyFallsThrough() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Calculator {
                    int total(int a, int b) {
                        «int sum = a + b;
                        int y = sum * 2;»
                        return y;
                    }
                }
                """).flow();

        assertEquals(1, flow.exitPoints().size());
        assertEquals(ExitKind.FALLTHROUGH, flow.exitPoints().get(0).kind());
        assertTrue(flow.canCompleteNormally());
        assertFalse(flow.hasEarlyExit());
        assertFalse(flow.hasMultipleExits());
        assertEquals(1, flow.entryCount());
    }

    @Test
    void testEarlyReturn() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Printer {
                    void run(String input) {
                        «if (input == null) {
                            return;
                        }
                        System.out.println(input);»
                        System.out.println("done");
                    }
                }
                """).flow();

        assertEquals(2, flow.exitPoints().size());
        assertEquals(ExitKind.EXPLICIT_RETURN, flow.exitPoints().get(0).kind());
        assertFalse(flow.exitPoints().get(0).carriesValue());
        assertEquals(4, flow.exitPoints().get(0).line());
        assertEquals(ExitKind.FALLTHROUGH, flow.exitPoints().get(1).kind());
        assertTrue(flow.hasEarlyExit());
        assertEquals(1, flow.jumps().size());
    }

    @Test
    void testEveryPathReturnsAValue() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Signs {
                    int sign(int x) {
                        «if (x < 0) {
                            return -1;
                        }
                        return 1;»
                    }
                }
                """).flow();

        assertFalse(flow.canCompleteNormally());
        assertEquals(2, flow.exitsOf(ExitKind.EXPLICIT_RETURN).size());
        assertTrue(flow.exitsOf(ExitKind.FALLTHROUGH).isEmpty());
        assertTrue(flow.exitPoints().get(0).carriesValue());
    }

    @Test
    void testBreakAndContinueLeavingTheLoop() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Summer {
                    int sum(int[] values) {
                        int sum = 0;
                        for (int x : values) {
                            «if (x < 0) {
                                break;
                            }
                            if (x == 0) {
                                continue;
                            }
                            sum += x;»
                        }
                        return sum;
                    }
                }
                """).flow();

        assertEquals(2, flow.exitsOf(ExitKind.LOOP_EXIT).size());
        assertEquals(ExitKind.FALLTHROUGH, flow.exitPoints().get(2).kind());
        assertNotNull(flow.exitPoints().get(0).target());
    }

    @Test
    void testJumpsInsideSelectedLoopAreNotExits() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Summer {
                    int sum(int[] values) {
                        int sum = 0;
                        «for (int x : values) {
                            if (x < 0) {
                                break;
                            }
                            sum += x;
                        }»
                        return sum;
                    }
                }
                """).flow();

        assertEquals(1, flow.exitPoints().size());
        assertTrue(flow.jumps().isEmpty());
    }

    @Test
    void testThrowCaughtInsideIsNotAnExit() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Parser {
                    int parse(String text) {
                        int value = 0;
                        «try {
                            if (text.isEmpty()) {
                                throw new IllegalStateException("empty");
                            }
                            value = Integer.parseInt(text);
                        } catch (IllegalStateException e) {
                            value = -1;
                        }»
                        return value;
                    }
                }
                """).flow();

        assertTrue(flow.exitsOf(ExitKind.PROPAGATED_EXCEPTION).isEmpty());
    }

    @Test
    void testUncaughtThrowPropagates() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Guard {
                    void check(String text) {
                        «if (text == null) {
                            throw new IllegalArgumentException("text");
                        }»
                        System.out.println(text);
                    }
                }
                """).flow();

        assertEquals(1, flow.exitsOf(ExitKind.PROPAGATED_EXCEPTION).size());
        assertTrue(flow.canCompleteNormally());
        assertFalse(flow.hasEarlyExit());
    }

    @Test
    void testReturnInsideLambdaIsIgnored() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Tasks {
                    Runnable task(String name) {
                        «Runnable r = () -> {
                            if (name == null) {
                                return;
                            }
                            System.out.println(name);
                        };»
                        return r;
                    }
                }
                """).flow();

        assertEquals(1, flow.exitPoints().size());
        assertEquals(ExitKind.FALLTHROUGH, flow.exitPoints().get(0).kind());
    }

    @Test
    void testSuspensionAndGeneratorPoints() {
        ControlFlowSummary flow = Fixtures.analyze("""
                class Feed {
                    void pump(int id) {
                        «String value = await(fetch(id));
                        emit(value);»
                    }

                    static String await(String value) {
                        return value;
                    }

                    String fetch(int id) {
                        return "x" + id;
                    }

                    void emit(String value) {
                    }
                }
                """).flow();

        assertTrue(flow.containsSuspensionPoint());
        assertTrue(flow.containsGeneratorPoint());
        assertEquals("await", flow.suspensionPoints().get(0).getNameAsString());
    }

    @Test
    void testYieldLeavingSwitchExpression() {
        ExtractionException e = assertThrows(ExtractionException.class, () -> Fixtures.analyze("""
                class Sizes {
                    int size(int code) {
                        int size = switch (code) {
                            case 1 -> {
                                «System.out.println("one");
                                yield 1;»
                            }
                            default -> 0;
                        };
                        return size;
                    }
                }
                """));

        assertEquals(ErrorKind.UNSUPPORTED_JUMP_CONSTRUCT, e.getKind());
    }
}
