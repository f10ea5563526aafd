package com.raditha.extract.workflow;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.extract.config.ExitNormalization;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.model.Accessibility;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionMode;
import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.ExtractionResult;
import com.raditha.extract.model.Warning;
import com.raditha.extract.source.EditApplier;
import com.raditha.extract.source.EditOutcome;
import com.raditha.extract.source.FileDocumentStore;
import com.raditha.extract.source.InMemoryDocumentStore;
import com.raditha.extract.source.SourceAccess;
import com.raditha.extract.source.SourceSnapshot;
import com.raditha.extract.testing.Fixtures;
import com.raditha.extract.testing.MarkedSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExtractionOrchestratorTest {

    private static final String CALCULATOR = """
            class Calculator {
                int total(int a, int b) {
                    «int sum = a + b;
                    int y = sum * 2;»
                    return y;
                }
            }
            """;

    private static final String MIN_MAX = """
            class Stats {
                void report(int[] values) {
                    «int min = Integer.MAX_VALUE;
                    int max = Integer.MIN_VALUE;
                    for (int v : values) {
                        min = Math.min(min, v);
                        max = Math.max(max, v);
                    }»
                    System.out.println(min + " " + max);
                }
            }
            """;

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    private ExtractionResult extract(String marked, UnaryOperator<ExtractionRequest> customize) {
        return extract(marked, ExtractionConfig.defaults(), customize);
    }

    private ExtractionResult extract(String marked, ExtractionConfig config,
            UnaryOperator<ExtractionRequest> customize) {
        MarkedSource source = MarkedSource.of(marked);
        store.open(Fixtures.FILE, source.text());
        ExtractionRequest request = customize.apply(
                ExtractionRequest.preview(Fixtures.FILE, source.range()).withName("helper"));
        return new ExtractionOrchestrator(store, store, config).execute(request);
    }

    private static String modified(ExtractionResult result) {
        return result.preview().modifiedSource();
    }

    @Test
    void testSingleOutputVariable() {
        ExtractionResult result = extract(CALCULATOR, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("helper", result.methodName());
        assertEquals("int y = helper(a, b);", result.callSiteReplacement());
        assertEquals("int", result.returnType());
        assertEquals(2, result.parameters().size());
        assertTrue(result.characteristics().staticMethod());
        assertEquals("""
                class Calculator {
                    int total(int a, int b) {
                        int y = helper(a, b);
                        return y;
                    }

                    private static int helper(int a, int b) {
                        int sum = a + b;
                        int y = sum * 2;
                        return y;
                    }
                }
                """, modified(result));
        assertNull(result.newVersion());
        assertEquals(1, store.snapshot(Fixtures.FILE).version());
    }

    @Test
    void testPreviewDiff() {
        ExtractionResult result = extract(CALCULATOR, r -> r);

        String diff = result.preview().unifiedDiff();
        assertTrue(diff.contains("--- a/Sample.java"));
        assertTrue(diff.contains("+++ b/Sample.java"));
        assertTrue(diff.contains("+        int y = helper(a, b);"));
        assertTrue(diff.contains("+    private static int helper(int a, int b) {"));
        assertEquals(store.text(Fixtures.FILE), result.preview().originalSource());
    }

    @Test
    void testEarlyReturnBecomesFlag() {
        ExtractionResult result = extract("""
                class Printer {
                    void run(String input) {
                        «if (input == null) {
                            return;
                        }
                        System.out.println(input);»
                        System.out.println("done");
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("if (helper(input)) {\n    return;\n}", result.callSiteReplacement());
        String method = result.generatedMethod();
        assertTrue(method.contains("private static boolean helper(String input) {"));
        assertTrue(method.contains("boolean exit = false;"));
        assertTrue(method.contains("body: {"));
        assertTrue(method.contains("exit = true;"));
        assertTrue(method.contains("break body;"));
        assertTrue(method.contains("return exit;"));
        assertTrue(modified(result).contains(
                "        if (helper(input)) {\n            return;\n        }\n        System.out.println(\"done\");"));
        assertTrue(result.characteristics().earlyExit());
        assertTrue(result.characteristics().multipleExits());
    }

    @Test
    void testPartialTryIsExpanded() {
        ExtractionResult result = extract("""
                class Loader {
                    String load(java.io.Reader reader) {
                        String text = "";
                        «try {
                            text = read(reader);»
                        } catch (java.io.IOException e) {
                            text = "failed";
                        }
                        return text;
                    }

                    static String read(java.io.Reader reader) throws java.io.IOException {
                        return "x";
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals(Warning.BOUNDARY_EXPANDED, result.warnings().get(0).code());
        assertEquals("text = helper(reader);", result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("String text;"));
        assertTrue(result.generatedMethod().contains("return text;"));
        assertTrue(modified(result).contains("        text = helper(reader);\n        return text;"));
    }

    @Test
    void testNameCollision() {
        ExtractionResult result = extract(CALCULATOR, r -> r.withName("total"));

        assertFalse(result.success());
        assertEquals(ErrorKind.NAME_COLLISION, result.errorCode());
        assertTrue(result.errorDetail().contains("total"));
        assertEquals(1, result.suggestions().size());
        assertNull(result.preview());
    }

    @Test
    void testInvalidName() {
        ExtractionResult result = extract(CALCULATOR, r -> r.withName("2fast"));

        assertEquals(ErrorKind.INVALID_NAME, result.errorCode());
    }

    @Test
    void testExpression() {
        ExtractionResult result = extract("""
                class Shapes {
                    int area(int width, int height) {
                        int area = «width * height» + 1;
                        return area;
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("helper(width, height)", result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("return width * height;"));
        assertTrue(modified(result).contains("int area = helper(width, height) + 1;"));
    }

    @Test
    void testTwoOutputsUseRecord() {
        ExtractionResult result = extract(MIN_MAX, r -> r.withName("range"));

        assertTrue(result.success(), result.errorDetail());
        assertEquals("RangeResult result = range(values);\nint min = result.min();\nint max = result.max();",
                result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("private static RangeResult range(int[] values) {"));
        assertTrue(result.generatedMethod().contains("return new RangeResult(min, max);"));
        assertTrue(result.generatedMethod().contains("private record RangeResult(int min, int max)"));
        assertTrue(modified(result).contains("    private record RangeResult(int min, int max)"));
        assertEquals("RangeResult", result.returnType());
    }

    @Test
    void testTwoOutputsWithHolder() {
        ExtractionResult result = extract(MIN_MAX, ExtractionConfig.outParams(), r -> r.withName("range"));

        assertTrue(result.success(), result.errorDetail());
        assertEquals("java.util.concurrent.atomic.AtomicReference<Integer> maxRef = "
                        + "new java.util.concurrent.atomic.AtomicReference<>();\n"
                        + "int min = range(values, maxRef);\n"
                        + "int max = maxRef.get();",
                result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("maxRef.set(max);"));
        assertTrue(result.generatedMethod().contains("return min;"));
        assertFalse(result.generatedMethod().contains("record"));
    }

    @Test
    void testAsyncSelection() {
        ExtractionResult result = extract("""
                import java.util.concurrent.CompletableFuture;

                class Loader {
                    void load(int id) {
                        «String value = await(fetch(id));
                        System.out.println(value);»
                    }

                    static <T> T await(CompletableFuture<T> future) {
                        return future.join();
                    }

                    CompletableFuture<String> fetch(int id) {
                        return CompletableFuture.completedFuture("x" + id);
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("java.util.concurrent.CompletableFuture<Void>", result.returnType());
        assertEquals("await(helper(id));", result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("return java.util.concurrent.CompletableFuture.completedFuture(null);"));
        assertTrue(result.characteristics().async());
        assertFalse(result.characteristics().staticMethod());
    }

    @Test
    void testGeneratorSelection() {
        ExtractionResult result = extract("""
                import java.util.List;

                class Evens {
                    void evens(List<Integer> input) {
                        «for (Integer n : input) {
                            if (n % 2 == 0) {
                                emit(n);
                            }
                        }»
                    }

                    void emit(int value) {
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("java.util.List<Integer>", result.returnType());
        assertEquals("for (Integer item : helper(input)) {\n    emit(item);\n}", result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("emitted.add(n);"));
        assertTrue(result.generatedMethod().contains("return emitted;"));
        assertTrue(result.warnings().stream().anyMatch(w -> w.code().equals(Warning.GENERATOR_EAGER)));
    }

    @Test
    void testBreakAndContinueDispatch() {
        ExtractionResult result = extract("""
                class Summer {
                    void print(int[] values) {
                        for (int x : values) {
                            «if (x < 0) {
                                break;
                            }
                            if (x == 0) {
                                continue;
                            }
                            System.out.println(x);»
                        }
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("int exit = helper(x);\n"
                + "if (exit == 1) {\n    break;\n} else if (exit == 2) {\n    continue;\n}",
                result.callSiteReplacement());
        String method = result.generatedMethod();
        assertTrue(method.contains("int exit = 0;"));
        assertTrue(method.contains("exit = 1;"));
        assertTrue(method.contains("exit = 2;"));
        assertTrue(method.contains("return exit;"));
    }

    @Test
    void testEveryPathReturns() {
        ExtractionResult result = extract("""
                class Signs {
                    int sign(int x) {
                        «if (x < 0) {
                            return -1;
                        }
                        return 1;»
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("return helper(x);", result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("return -1;"));
        assertTrue(modified(result).contains("        return helper(x);\n    }"));
    }

    @Test
    void testLambdaWithMismatchedReturns() {
        ExtractionResult result = extract("""
                import java.util.function.Function;

                class Labels {
                    Function<Integer, Object> labeler() {
                        return x -> {
                            «if (x > 0) {
                                return "positive";
                            }
                            return 0;»
                        };
                    }
                }
                """, r -> r);

        assertEquals(ErrorKind.TYPE_MISMATCH_ON_RETURN, result.errorCode());
    }

    @Test
    void testInterfaceHelperIsPrivate() {
        ExtractionResult result = extract("""
                interface Greeter {
                    default String greet(String name) {
                        «String text = "Hello " + name;»
                        return text;
                    }
                }
                """, r -> r.withAccessibility(Accessibility.PUBLIC));

        assertTrue(result.success(), result.errorDetail());
        assertTrue(result.generatedMethod().startsWith("private static String helper(String name)"));
        assertEquals(Warning.ACCESSIBILITY_ADJUSTED, result.warnings().get(0).code());
    }

    @Test
    void testStaticRequestedWithInstanceState() {
        ExtractionResult result = extract("""
                class Counter {
                    private int count;

                    void bump() {
                        «count++;»
                    }
                }
                """, r -> r.withMakeStatic(true));

        assertEquals(ErrorKind.UNSUPPORTED_COMBINATION, result.errorCode());
    }

    @Test
    void testUnparseableSource() {
        ExtractionResult result = extract("""
                class Broken {
                    void run() {
                        «int x = ;»
                    }
                }
                """, r -> r);

        assertEquals(ErrorKind.INTERNAL_ANALYSIS_FAILURE, result.errorCode());
    }

    @Test
    void testUnknownDocument() {
        ExtractionRequest request = ExtractionRequest.preview(Path.of("Missing.java"),
                MarkedSource.of(CALCULATOR).range());
        ExtractionResult result = new ExtractionOrchestrator(store, store, ExtractionConfig.defaults())
                .execute(request);

        assertEquals(ErrorKind.INTERNAL_ANALYSIS_FAILURE, result.errorCode());
        assertTrue(result.errorDetail().startsWith("NoSuchElementException"));
    }

    @Test
    void testApplyBumpsVersion() {
        ExtractionResult result = extract(CALCULATOR, r -> r.withMode(ExtractionMode.APPLY));

        assertTrue(result.success(), result.errorDetail());
        assertEquals(2L, result.newVersion());
        assertEquals(modified(result), store.text(Fixtures.FILE));
    }

    @Test
    void testApplyToFile(@TempDir Path tempDir) throws IOException {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        Path file = tempDir.resolve("Calculator.java");
        Files.writeString(file, source.text());
        FileDocumentStore files = new FileDocumentStore();

        ExtractionResult result = new ExtractionOrchestrator(files, files, ExtractionConfig.defaults())
                .execute(ExtractionRequest.apply(file, source.range()).withName("helper"));

        assertTrue(result.success(), result.errorDetail());
        String written = Files.readString(file);
        assertTrue(written.contains("int y = helper(a, b);"));
        assertEquals(files.snapshot(file).version(), result.newVersion());
    }

    @Test
    void testStaleSnapshot() throws IOException {
        EditApplier applier = mock(EditApplier.class);
        when(applier.apply(any(), anyLong(), anyList())).thenReturn(EditOutcome.stale(1, 2));
        MarkedSource source = MarkedSource.of(CALCULATOR);
        store.open(Fixtures.FILE, source.text());

        ExtractionResult result = new ExtractionOrchestrator(store, applier, ExtractionConfig.defaults())
                .execute(ExtractionRequest.apply(Fixtures.FILE, source.range()).withName("helper"));

        assertFalse(result.success());
        assertEquals(ErrorKind.STALE_SNAPSHOT, result.errorCode());
        assertTrue(result.errorCode().isRetryable());
        assertEquals("expected version 1 but document is at 2", result.errorDetail());
    }

    @Test
    void testDocumentChangedBeforeApply() {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        store.open(Fixtures.FILE, source.text());
        EditApplier racing = (path, version, edits) -> {
            store.open(path, store.text(path) + "\n");
            return store.apply(path, version, edits);
        };

        ExtractionResult result = new ExtractionOrchestrator(store, racing, ExtractionConfig.defaults())
                .execute(ExtractionRequest.apply(Fixtures.FILE, source.range()).withName("helper"));

        assertEquals(ErrorKind.STALE_SNAPSHOT, result.errorCode());
        assertEquals(source.text() + "\n", store.text(Fixtures.FILE));
    }

    @Test
    void testWriteFailure() throws IOException {
        EditApplier applier = mock(EditApplier.class);
        when(applier.apply(any(), anyLong(), anyList())).thenThrow(new IOException("disk full"));
        MarkedSource source = MarkedSource.of(CALCULATOR);
        store.open(Fixtures.FILE, source.text());

        ExtractionResult result = new ExtractionOrchestrator(store, applier, ExtractionConfig.defaults())
                .execute(ExtractionRequest.apply(Fixtures.FILE, source.range()).withName("helper"));

        assertEquals(ErrorKind.INTERNAL_ANALYSIS_FAILURE, result.errorCode());
        assertTrue(result.errorDetail().contains("disk full"));
    }

    @Test
    void testCancelledBeforeStart() {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        store.open(Fixtures.FILE, source.text());

        ExtractionResult result = new ExtractionOrchestrator(store, store, ExtractionConfig.defaults())
                .execute(ExtractionRequest.apply(Fixtures.FILE, source.range()), () -> true);

        assertEquals(ErrorKind.CANCELLED, result.errorCode());
        assertEquals(1, store.snapshot(Fixtures.FILE).version());
    }

    @Test
    void testCancelledMidway() {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        store.open(Fixtures.FILE, source.text());
        AtomicInteger checks = new AtomicInteger();

        ExtractionResult result = new ExtractionOrchestrator(store, store, ExtractionConfig.defaults())
                .execute(ExtractionRequest.apply(Fixtures.FILE, source.range()), () -> checks.incrementAndGet() > 2);

        assertEquals(ErrorKind.CANCELLED, result.errorCode());
        assertEquals("Cancelled before INFERRING_SIGNATURE", result.errorDetail());
        assertEquals(source.text(), store.text(Fixtures.FILE));
    }

    @Test
    void testGeneratedNameWhenNoneRequested() {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        store.open(Fixtures.FILE, source.text());

        ExtractionResult result = new ExtractionOrchestrator(store, store, ExtractionConfig.defaults())
                .execute(ExtractionRequest.preview(Fixtures.FILE, source.range()));

        assertTrue(result.success(), result.errorDetail());
        assertEquals("getY", result.methodName());
        assertEquals("int y = getY(a, b);", result.callSiteReplacement());
    }

    @Test
    void testConfiguredFromClasspath() {
        MarkedSource source = MarkedSource.of(MIN_MAX);
        store.open(Fixtures.FILE, source.text());

        ExtractionResult result = new ExtractionOrchestrator(store, store)
                .execute(ExtractionRequest.preview(Fixtures.FILE, source.range()).withName("range"));

        assertTrue(result.success(), result.errorDetail());
        assertEquals("RangeResult", result.returnType());
    }

    @Test
    void testDiffRebuildsModifiedSource() throws Exception {
        ExtractionResult result = extract(CALCULATOR, r -> r);

        Patch<String> patch = UnifiedDiffUtils.parseUnifiedDiff(result.preview().unifiedDiff().lines().toList());
        List<String> rebuilt = DiffUtils.patch(result.preview().originalSource().lines().toList(), patch);
        assertEquals(result.preview().modifiedSource().lines().toList(), rebuilt);
    }

    @Test
    void testBlockLambdaOverInferredParameter() {
        ExtractionResult result = extract("""
                import java.util.List;

                class Doubler {
                    void print(List<Integer> xs) {
                        xs.forEach(x -> {
                            «int d = x * 2;
                            System.out.println(d);»
                        });
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("helper(x);", result.callSiteReplacement());
        assertEquals("Integer", result.parameters().get(0).type());
        assertTrue(result.generatedMethod().startsWith("private static void helper(Integer x)"));
    }

    @Test
    void testExpressionLambdaBody() {
        ExtractionResult result = extract("""
                import java.util.function.IntUnaryOperator;

                class Scaler {
                    IntUnaryOperator scaler(int k) {
                        return x -> «x * k + 1»;
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("helper(x, k)", result.callSiteReplacement());
        assertTrue(result.generatedMethod().contains("return x * k + 1;"));
        assertTrue(modified(result).contains("return x -> helper(x, k);"));
    }

    @Test
    void testReturnInPlace() {
        ExtractionConfig config = ExtractionConfig.defaults().withExitNormalization(ExitNormalization.RETURN_IN_PLACE);
        ExtractionResult result = extract("""
                class Lookup {
                    int find(int[] values, int wanted) {
                        int seen = 0;
                        «for (int v : values) {
                            if (v == wanted) {
                                return v;
                            }
                            seen++;
                        }»
                        return -seen;
                    }
                }
                """, config, r -> r);

        assertTrue(result.success(), result.errorDetail());
        String record = result.returnType();
        String method = result.generatedMethod();
        assertTrue(method.contains("return new " + record + "(true, v, seen);"), method);
        assertTrue(method.contains("return new " + record + "(false, 0, seen);"), method);
        assertFalse(method.contains("break"));
    }

    @Test
    void testRepeatedJumpIsOneOutcome() {
        ExtractionResult result = extract("""
                class Printer {
                    void print(int[] values) {
                        for (int x : values) {
                            «if (x < 0) {
                                break;
                            }
                            System.out.println(x);
                            if (x > 100) {
                                break;
                            }»
                        }
                    }
                }
                """, r -> r);

        assertTrue(result.success(), result.errorDetail());
        assertEquals("if (helper(x)) {\n    break;\n}", result.callSiteReplacement());
    }

    @Test
    void testPreviewsRunAlongsideApply() throws Exception {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        SourceSnapshot snapshot = store.open(Fixtures.FILE, source.text());
        SourceAccess pinned = path -> snapshot;
        ExtractionRequest preview = ExtractionRequest.preview(Fixtures.FILE, source.range()).withName("helper");
        ExtractionResult expected = new ExtractionOrchestrator(pinned, store, ExtractionConfig.defaults())
                .execute(preview);
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(pinned, store, ExtractionConfig.defaults());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ExtractionResult>> previews = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                previews.add(executor.submit(() -> {
                    start.await();
                    return orchestrator.execute(preview);
                }));
            }
            Future<ExtractionResult> collision = executor.submit(() -> {
                start.await();
                return orchestrator.execute(preview.withName("total"));
            });
            Future<ExtractionResult> apply = executor.submit(() -> {
                start.await();
                return orchestrator.execute(preview.withMode(ExtractionMode.APPLY));
            });
            start.countDown();

            for (Future<ExtractionResult> future : previews) {
                ExtractionResult result = future.get(30, TimeUnit.SECONDS);
                assertTrue(result.success(), result.errorDetail());
                assertEquals(source.text(), result.preview().originalSource());
                assertEquals(expected.preview().modifiedSource(), result.preview().modifiedSource());
                assertNull(result.newVersion());
            }
            assertEquals(ErrorKind.NAME_COLLISION, collision.get(30, TimeUnit.SECONDS).errorCode());
            ExtractionResult applied = apply.get(30, TimeUnit.SECONDS);
            assertEquals(2L, applied.newVersion());
            assertEquals(expected.preview().modifiedSource(), store.text(Fixtures.FILE));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testConcurrentAppliesOnOneSnapshot() throws Exception {
        MarkedSource source = MarkedSource.of(CALCULATOR);
        SourceSnapshot snapshot = store.open(Fixtures.FILE, source.text());
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(path -> snapshot, store,
                ExtractionConfig.defaults());
        ExtractionRequest request = ExtractionRequest.apply(Fixtures.FILE, source.range()).withName("helper");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ExtractionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return orchestrator.execute(request);
                }));
            }
            start.countDown();

            List<ExtractionResult> results = new ArrayList<>();
            for (Future<ExtractionResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            assertEquals(1, results.stream().filter(ExtractionResult::success).count());
            assertEquals(1, results.stream().filter(r -> r.errorCode() == ErrorKind.STALE_SNAPSHOT).count());
            assertEquals(2, store.snapshot(Fixtures.FILE).version());
        } finally {
            executor.shutdownNow();
        }
    }
}
