package com.raditha.extract.workflow;

import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PhaseTrackerTest {

    private static final Path FILE = Path.of("A.java");

    @Test
    void testStartsIdle() {
        PhaseTracker tracker = new PhaseTracker(FILE, () -> false);

        assertEquals(ExtractionPhase.IDLE, tracker.current());
        assertNull(tracker.failure());
        assertEquals(List.of(ExtractionPhase.IDLE), tracker.history());
    }

    @Test
    void testRecordsHistory() {
        PhaseTracker tracker = new PhaseTracker(FILE, () -> false);
        tracker.enter(ExtractionPhase.VALIDATING);
        tracker.enter(ExtractionPhase.ANALYZING_FLOW);

        assertEquals(List.of(ExtractionPhase.IDLE, ExtractionPhase.VALIDATING, ExtractionPhase.ANALYZING_FLOW),
                tracker.history());
    }

    @Test
    void testRejectsInvalidTransition() {
        PhaseTracker tracker = new PhaseTracker(FILE, () -> false);

        assertThrows(IllegalStateException.class, () -> tracker.enter(ExtractionPhase.GENERATING));
        assertThrows(IllegalStateException.class, () -> tracker.enter(ExtractionPhase.FAILED));
        assertEquals(ExtractionPhase.IDLE, tracker.current());
    }

    @Test
    void testCancellationStopsBeforeNextPhase() {
        AtomicBoolean cancelled = new AtomicBoolean();
        PhaseTracker tracker = new PhaseTracker(FILE, cancelled::get);
        tracker.enter(ExtractionPhase.VALIDATING);
        cancelled.set(true);

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> tracker.enter(ExtractionPhase.ANALYZING_FLOW));
        assertEquals(ErrorKind.CANCELLED, e.getKind());
        assertEquals("Cancelled before ANALYZING_FLOW", e.getDetail());
        assertEquals(ExtractionPhase.VALIDATING, tracker.current());
    }

    @Test
    void testDoneIgnoresCancellation() {
        AtomicBoolean cancelled = new AtomicBoolean();
        PhaseTracker tracker = new PhaseTracker(FILE, cancelled::get);
        for (ExtractionPhase phase : List.of(ExtractionPhase.VALIDATING, ExtractionPhase.ANALYZING_FLOW,
                ExtractionPhase.INFERRING_SIGNATURE, ExtractionPhase.TRANSFORMING, ExtractionPhase.GENERATING,
                ExtractionPhase.APPLYING)) {
            tracker.enter(phase);
        }
        cancelled.set(true);

        tracker.enter(ExtractionPhase.DONE);
        assertEquals(ExtractionPhase.DONE, tracker.current());
    }

    @Test
    void testFailOnce() {
        PhaseTracker tracker = new PhaseTracker(FILE, () -> false);
        tracker.enter(ExtractionPhase.VALIDATING);
        tracker.fail(ErrorKind.EMPTY_SELECTION);
        tracker.fail(ErrorKind.INTERNAL_ANALYSIS_FAILURE);

        assertEquals(ExtractionPhase.FAILED, tracker.current());
        assertEquals(ErrorKind.EMPTY_SELECTION, tracker.failure());
        assertEquals(3, tracker.history().size());
    }
}
