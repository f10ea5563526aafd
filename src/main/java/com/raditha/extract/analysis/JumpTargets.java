package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.extract.util.ASTUtility;

import java.util.Optional;

/**
 * Resolves the statement a break, continue or yield transfers control out of.
 * Labeled jumps resolve to the {@link LabeledStmt}; unlabeled ones to the innermost
 * loop (or switch, for break).
 */
public class JumpTargets {

    private JumpTargets() {
        /* this is only a utility class */
    }

    public static Optional<Node> targetOf(Statement jump) {
        if (jump instanceof BreakStmt breakStmt) {
            return breakStmt.getLabel().isPresent()
                    ? labeled(jump, breakStmt.getLabel().get())
                    : enclosing(jump, true);
        }
        if (jump instanceof ContinueStmt continueStmt) {
            return continueStmt.getLabel().isPresent()
                    ? labeled(jump, continueStmt.getLabel().get())
                    : enclosing(jump, false);
        }
        if (jump instanceof YieldStmt) {
            return enclosingSwitchExpression(jump);
        }
        return Optional.empty();
    }

    public static boolean isLoop(Node node) {
        return node instanceof WhileStmt || node instanceof DoStmt
                || node instanceof ForStmt || node instanceof ForEachStmt;
    }

    private static Optional<Node> labeled(Node jump, SimpleName label) {
        Node current = jump.getParentNode().orElse(null);
        while (current != null && !ASTUtility.isScopeBoundary(current)) {
            if (current instanceof LabeledStmt labeledStmt
                    && labeledStmt.getLabel().asString().equals(label.asString())) {
                return Optional.of(current);
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    private static Optional<Node> enclosing(Node jump, boolean acceptSwitch) {
        Node current = jump.getParentNode().orElse(null);
        while (current != null && !ASTUtility.isScopeBoundary(current) && !(current instanceof SwitchExpr)) {
            if (isLoop(current) || (acceptSwitch && current instanceof SwitchStmt)) {
                return Optional.of(current);
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    private static Optional<Node> enclosingSwitchExpression(Node yield) {
        Node current = yield.getParentNode().orElse(null);
        while (current != null && !ASTUtility.isScopeBoundary(current)) {
            if (current instanceof SwitchExpr) {
                return Optional.of(current);
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }
}
