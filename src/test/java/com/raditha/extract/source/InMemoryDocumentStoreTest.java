package com.raditha.extract.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private static final Path FILE = Path.of("src/Sample.java");

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    @Test
    void testOpenAssignsIncreasingVersions() {
        SourceSnapshot first = store.open(FILE, "a");
        SourceSnapshot second = store.open(FILE, "b");

        assertEquals(1, first.version());
        assertEquals(2, second.version());
        assertEquals("b", store.text(FILE));
    }

    @Test
    void testApplyBumpsVersion() {
        SourceSnapshot snapshot = store.open(FILE, "hello world");

        EditOutcome outcome = store.apply(FILE, snapshot.version(), List.of(TextEdit.replace(0, 5, "goodbye")));

        assertTrue(outcome.applied());
        assertEquals(snapshot.version() + 1, outcome.version());
        assertEquals("goodbye world", store.text(FILE));
    }

    @Test
    void testStaleVersionIsRejectedWithoutChange() {
        SourceSnapshot snapshot = store.open(FILE, "hello");
        store.open(FILE, "hello again");

        EditOutcome outcome = store.apply(FILE, snapshot.version(), List.of(TextEdit.insert(0, "x")));

        assertFalse(outcome.applied());
        assertEquals(2, outcome.version());
        assertTrue(outcome.detail().contains("expected version 1"));
        assertEquals("hello again", store.text(FILE));
    }

    @Test
    void testUnknownDocument() {
        assertThrows(NoSuchElementException.class, () -> store.snapshot(Path.of("Missing.java")));
    }
}
