package com.raditha.extract.workflow;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Phases an extraction request moves through.
 * Every non-terminal phase may move to {@link #FAILED}.
 */
public enum ExtractionPhase {
    /** Request received, nothing done yet */
    IDLE,

    /** Selection normalization */
    VALIDATING,

    /** Exit and data flow analysis */
    ANALYZING_FLOW,

    /** Parameters, return strategy, modifiers and name */
    INFERRING_SIGNATURE,

    /** Body rewriting */
    TRANSFORMING,

    /** Method, call site and edits */
    GENERATING,

    /** Diff of the modified source, no mutation */
    PREVIEWING,

    /** Edits handed to the applier */
    APPLYING,

    DONE,

    FAILED;

    private static final Map<ExtractionPhase, Set<ExtractionPhase>> TRANSITIONS = new EnumMap<>(ExtractionPhase.class);

    static {
        TRANSITIONS.put(IDLE, EnumSet.of(VALIDATING, FAILED));
        TRANSITIONS.put(VALIDATING, EnumSet.of(ANALYZING_FLOW, FAILED));
        TRANSITIONS.put(ANALYZING_FLOW, EnumSet.of(INFERRING_SIGNATURE, FAILED));
        TRANSITIONS.put(INFERRING_SIGNATURE, EnumSet.of(TRANSFORMING, FAILED));
        TRANSITIONS.put(TRANSFORMING, EnumSet.of(GENERATING, FAILED));
        TRANSITIONS.put(GENERATING, EnumSet.of(PREVIEWING, APPLYING, FAILED));
        TRANSITIONS.put(PREVIEWING, EnumSet.of(DONE, FAILED));
        TRANSITIONS.put(APPLYING, EnumSet.of(DONE, FAILED));
        TRANSITIONS.put(DONE, EnumSet.noneOf(ExtractionPhase.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(ExtractionPhase.class));
    }

    public boolean canMoveTo(ExtractionPhase next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
