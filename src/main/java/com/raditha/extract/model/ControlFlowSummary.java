package com.raditha.extract.model;

import com.github.javaparser.ast.expr.MethodCallExpr;

import java.util.List;

/**
 * Control flow facts about a validated selection. Computed once per request.
 *
 * @param entryCount          Number of ways into the selection, always 1 once validated
 * @param exitPoints          Exits in source order, fallthrough last
 * @param canCompleteNormally Whether execution can run off the end of the selection
 * @param hasEarlyExit        Whether a return or loop exit occurs before the final statement
 * @param suspensionPoints    Await calls found at the selection's own nesting level
 * @param generatorPoints     Emit calls found at the selection's own nesting level
 */
public record ControlFlowSummary(
        int entryCount,
        List<ExitPoint> exitPoints,
        boolean canCompleteNormally,
        boolean hasEarlyExit,
        List<MethodCallExpr> suspensionPoints,
        List<MethodCallExpr> generatorPoints) {

    public ControlFlowSummary {
        exitPoints = List.copyOf(exitPoints);
        suspensionPoints = List.copyOf(suspensionPoints);
        generatorPoints = List.copyOf(generatorPoints);
    }

    public boolean hasMultipleExits() {
        return exitPoints.size() > 1;
    }

    public boolean containsSuspensionPoint() {
        return !suspensionPoints.isEmpty();
    }

    public boolean containsGeneratorPoint() {
        return !generatorPoints.isEmpty();
    }

    public List<ExitPoint> exitsOf(ExitKind kind) {
        return exitPoints.stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * Returns and loop exits, the exits that need rewriting in a new method body.
     */
    public List<ExitPoint> jumps() {
        return exitPoints.stream().filter(ExitPoint::isJump).toList();
    }
}
