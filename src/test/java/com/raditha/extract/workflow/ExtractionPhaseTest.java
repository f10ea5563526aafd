package com.raditha.extract.workflow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionPhaseTest {

    @Test
    void testHappyPathTransitions() {
        assertTrue(ExtractionPhase.IDLE.canMoveTo(ExtractionPhase.VALIDATING));
        assertTrue(ExtractionPhase.VALIDATING.canMoveTo(ExtractionPhase.ANALYZING_FLOW));
        assertTrue(ExtractionPhase.ANALYZING_FLOW.canMoveTo(ExtractionPhase.INFERRING_SIGNATURE));
        assertTrue(ExtractionPhase.INFERRING_SIGNATURE.canMoveTo(ExtractionPhase.TRANSFORMING));
        assertTrue(ExtractionPhase.TRANSFORMING.canMoveTo(ExtractionPhase.GENERATING));
        assertTrue(ExtractionPhase.GENERATING.canMoveTo(ExtractionPhase.PREVIEWING));
        assertTrue(ExtractionPhase.GENERATING.canMoveTo(ExtractionPhase.APPLYING));
        assertTrue(ExtractionPhase.PREVIEWING.canMoveTo(ExtractionPhase.DONE));
        assertTrue(ExtractionPhase.APPLYING.canMoveTo(ExtractionPhase.DONE));
    }

    @Test
    void testPhasesCannotBeSkipped() {
        assertFalse(ExtractionPhase.IDLE.canMoveTo(ExtractionPhase.GENERATING));
        assertFalse(ExtractionPhase.VALIDATING.canMoveTo(ExtractionPhase.TRANSFORMING));
        assertFalse(ExtractionPhase.PREVIEWING.canMoveTo(ExtractionPhase.APPLYING));
        assertFalse(ExtractionPhase.IDLE.canMoveTo(ExtractionPhase.DONE));
    }

    @ParameterizedTest
    @EnumSource(value = ExtractionPhase.class, names = {"DONE", "FAILED"}, mode = EnumSource.Mode.EXCLUDE)
    void testEveryWorkingPhaseCanFail(ExtractionPhase phase) {
        assertTrue(phase.canMoveTo(ExtractionPhase.FAILED));
        assertFalse(phase.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = ExtractionPhase.class, names = {"DONE", "FAILED"})
    void testTerminalPhasesGoNowhere(ExtractionPhase phase) {
        assertTrue(phase.isTerminal());
        for (ExtractionPhase next : ExtractionPhase.values()) {
            assertFalse(phase.canMoveTo(next), phase + " -> " + next);
        }
    }
}
