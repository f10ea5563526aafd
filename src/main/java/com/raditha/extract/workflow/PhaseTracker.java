package com.raditha.extract.workflow;

import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Tracks the phase of one extraction request and checks for cancellation at each boundary.
 * One tracker per request; not shared between threads.
 */
public class PhaseTracker {
    private static final Logger logger = LoggerFactory.getLogger(PhaseTracker.class);

    private final Path file;
    private final BooleanSupplier cancelled;
    private final List<ExtractionPhase> history = new ArrayList<>();
    private ExtractionPhase current = ExtractionPhase.IDLE;
    private ErrorKind failure;

    public PhaseTracker(Path file, BooleanSupplier cancelled) {
        this.file = file;
        this.cancelled = cancelled;
        history.add(current);
    }

    /**
     * Move to the next phase.
     *
     * @throws IllegalStateException if the transition is not allowed
     * @throws ExtractionException   CANCELLED when the cancellation hook fired before a working phase
     */
    public void enter(ExtractionPhase next) {
        if (next == ExtractionPhase.FAILED) {
            throw new IllegalStateException("Use fail() to record a failure");
        }
        if (next != ExtractionPhase.DONE && cancelled.getAsBoolean()) {
            throw new ExtractionException(ErrorKind.CANCELLED, "Cancelled before " + next);
        }
        move(next);
    }

    /**
     * Record a failure. Failing an already terminal request is ignored.
     */
    public void fail(ErrorKind kind) {
        if (current.isTerminal()) {
            return;
        }
        failure = kind;
        move(ExtractionPhase.FAILED);
    }

    private void move(ExtractionPhase next) {
        if (!current.canMoveTo(next)) {
            throw new IllegalStateException("Invalid transition " + current + " -> " + next);
        }
        logger.debug("{}: {} -> {}", file, current, next);
        current = next;
        history.add(next);
    }

    public ExtractionPhase current() {
        return current;
    }

    public ErrorKind failure() {
        return failure;
    }

    public List<ExtractionPhase> history() {
        return List.copyOf(history);
    }
}
