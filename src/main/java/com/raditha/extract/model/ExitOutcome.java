package com.raditha.extract.model;

import com.github.javaparser.ast.Node;

/**
 * A distinct place control reaches after the extracted code runs.
 * Several exit points can share one outcome, such as two returns.
 *
 * @param index         Position used when the outcome is encoded in a selector
 * @param kind          Outcome kind
 * @param jumpStatement Statement the call site executes for this outcome, null for fallthrough
 * @param target        Statement left by a jump outcome
 */
public record ExitOutcome(int index, Kind kind, String jumpStatement, Node target) {

    public enum Kind {
        FALLTHROUGH,
        RETURN,
        JUMP
    }

    public boolean isFallthrough() {
        return kind == Kind.FALLTHROUGH;
    }
}
