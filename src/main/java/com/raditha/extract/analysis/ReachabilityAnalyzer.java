package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.extract.util.ASTUtility;

import java.util.List;

/**
 * Decides whether statements can complete normally, following the structure of
 * the JLS reachability rules (14.22) with constant expressions limited to literals.
 */
public class ReachabilityAnalyzer {

    public boolean canCompleteNormally(List<? extends Statement> statements) {
        for (Statement statement : statements) {
            if (!canCompleteNormally(statement)) {
                return false;
            }
        }
        return true;
    }

    public boolean canCompleteNormally(Statement statement) {
        if (statement instanceof ReturnStmt || statement instanceof ThrowStmt
                || statement instanceof BreakStmt || statement instanceof ContinueStmt
                || statement instanceof YieldStmt) {
            return false;
        }
        if (statement instanceof BlockStmt block) {
            return canCompleteNormally(block.getStatements());
        }
        if (statement instanceof IfStmt ifStmt) {
            return ifStmt.getElseStmt().isEmpty()
                    || canCompleteNormally(ifStmt.getThenStmt())
                    || canCompleteNormally(ifStmt.getElseStmt().get());
        }
        if (statement instanceof WhileStmt loop) {
            return !isConstantTrue(loop.getCondition()) || hasBreakTo(loop);
        }
        if (statement instanceof DoStmt loop) {
            return (!isConstantTrue(loop.getCondition())
                    && (canCompleteNormally(loop.getBody()) || hasContinueTo(loop)))
                    || hasBreakTo(loop);
        }
        if (statement instanceof ForStmt loop) {
            boolean infinite = loop.getCompare().isEmpty() || isConstantTrue(loop.getCompare().get());
            return !infinite || hasBreakTo(loop);
        }
        if (statement instanceof LabeledStmt labeled) {
            return canCompleteNormally(labeled.getStatement()) || hasBreakTo(labeled);
        }
        if (statement instanceof SwitchStmt switchStmt) {
            return switchCanCompleteNormally(switchStmt);
        }
        if (statement instanceof TryStmt tryStmt) {
            boolean body = canCompleteNormally(tryStmt.getTryBlock())
                    || tryStmt.getCatchClauses().stream().anyMatch(c -> canCompleteNormally(c.getBody()));
            boolean fin = tryStmt.getFinallyBlock().map(this::canCompleteNormally).orElse(true);
            return body && fin;
        }
        if (statement instanceof SynchronizedStmt sync) {
            return canCompleteNormally(sync.getBody());
        }
        return true;
    }

    public static boolean isConstantTrue(Expression condition) {
        Expression current = condition;
        while (current instanceof EnclosedExpr enclosed) {
            current = enclosed.getInner();
        }
        return current instanceof BooleanLiteralExpr literal && literal.getValue();
    }

    private boolean switchCanCompleteNormally(SwitchStmt switchStmt) {
        List<SwitchEntry> entries = switchStmt.getEntries();
        if (entries.isEmpty() || hasBreakTo(switchStmt)) {
            return true;
        }
        boolean hasDefault = entries.stream().anyMatch(e -> e.getLabels().isEmpty());
        if (!hasDefault) {
            return true;
        }
        SwitchEntry last = entries.get(entries.size() - 1);
        if (last.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
            return canCompleteNormally(last.getStatements());
        }
        for (SwitchEntry entry : entries) {
            if (entry.getType() == SwitchEntry.Type.EXPRESSION || canCompleteNormally(entry.getStatements())) {
                return true;
            }
        }
        return false;
    }

    private boolean hasBreakTo(Node target) {
        return ASTUtility.findSameCallable(target, BreakStmt.class).stream()
                .anyMatch(b -> JumpTargets.targetOf(b).orElse(null) == target);
    }

    private boolean hasContinueTo(Node loop) {
        Node target = loop.getParentNode().orElse(null) instanceof LabeledStmt labeled ? labeled : loop;
        return ASTUtility.findSameCallable(loop, ContinueStmt.class).stream()
                .anyMatch(c -> {
                    Node t = JumpTargets.targetOf(c).orElse(null);
                    return t == loop || t == target;
                });
    }
}
