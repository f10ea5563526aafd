package com.raditha.extract.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ErrorKindTest {

    @Test
    void testOnlyStaleSnapshotIsRetryable() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind == ErrorKind.STALE_SNAPSHOT, kind.isRetryable(), kind.name());
            assertFalse(kind.suggestion().isBlank(), kind.name());
        }
    }

    @Test
    void testFailureResultCarriesSuggestion() {
        ExtractionResult result = ExtractionResult.failure(
                new ExtractionException(ErrorKind.NAME_COLLISION, "process already exists"));

        assertFalse(result.success());
        assertEquals(ErrorKind.NAME_COLLISION, result.errorCode());
        assertEquals("process already exists", result.errorDetail());
        assertEquals(1, result.suggestions().size());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testAccessibilityFromString() {
        assertEquals(Accessibility.PRIVATE, Accessibility.fromString("private"));
        assertEquals(Accessibility.PACKAGE_PRIVATE, Accessibility.fromString("package-private"));
        assertEquals(Accessibility.PACKAGE_PRIVATE, Accessibility.fromString("default"));
        assertEquals("", Accessibility.PACKAGE_PRIVATE.keyword());
        assertEquals("public", Accessibility.fromString(" PUBLIC ").keyword());
    }

    @Test
    void testRequestDefaultsToPreview() {
        ExtractionRequest request = new ExtractionRequest(Path.of("A.java"), new Range(1, 1, 1, 2),
                null, null, null, null);

        assertEquals(ExtractionMode.PREVIEW, request.mode());
        assertEquals(ExtractionMode.APPLY, request.withMode(ExtractionMode.APPLY).mode());
        assertThrows(IllegalArgumentException.class,
                () -> new ExtractionRequest(null, new Range(1, 1, 1, 2), null, null, null, null));
    }
}
