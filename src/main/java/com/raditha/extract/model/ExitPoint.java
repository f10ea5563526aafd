package com.raditha.extract.model;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.Statement;

/**
 * One way out of the selection.
 *
 * @param kind         Exit classification
 * @param statement    The jump, return or throw statement; null for fallthrough
 * @param target       Statement a break or continue leaves; null otherwise
 * @param carriesValue True for a return with an expression
 * @param line         Source line of the exit
 */
public record ExitPoint(
        ExitKind kind,
        Statement statement,
        Node target,
        boolean carriesValue,
        int line) {

    public static ExitPoint fallthrough(int line) {
        return new ExitPoint(ExitKind.FALLTHROUGH, null, null, false, line);
    }

    public boolean isJump() {
        return kind == ExitKind.EXPLICIT_RETURN || kind == ExitKind.LOOP_EXIT;
    }
}
