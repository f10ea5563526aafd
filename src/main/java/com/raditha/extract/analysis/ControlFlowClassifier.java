package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnionType;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExitKind;
import com.raditha.extract.model.ExitPoint;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies the ways control can leave a validated selection.
 * Lambda bodies and class bodies inside the selection are not part of its control flow.
 */
public class ControlFlowClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowClassifier.class);

    private static final Set<String> CATCH_ALL = Set.of("Throwable", "java.lang.Throwable", "Exception", "java.lang.Exception");

    private final ReachabilityAnalyzer reachability = new ReachabilityAnalyzer();

    /**
     * Build the control flow summary for a selection.
     *
     * @throws ExtractionException UNSUPPORTED_JUMP_CONSTRUCT for a yield that leaves the selection
     */
    public ControlFlowSummary classify(NormalizedSelection selection, ExtractionConfig config) {
        List<ExitPoint> exits = new ArrayList<>();
        List<MethodCallExpr> suspensions = new ArrayList<>();
        List<MethodCallExpr> generators = new ArrayList<>();

        for (Node root : selection.nodes()) {
            ASTUtility.walkSameCallable(root, node -> visit(node, selection, config, exits, suspensions, generators));
        }

        boolean completes = selection.mode() == SelectionMode.EXPRESSION
                || reachability.canCompleteNormally(selection.statements());
        if (completes) {
            exits.add(ExitPoint.fallthrough(selection.range().endLine()));
        }

        Node last = selection.last();
        boolean earlyExit = exits.stream()
                .anyMatch(e -> e.isJump() && e.statement() != last);

        ControlFlowSummary summary = new ControlFlowSummary(1, exits, completes, earlyExit, suspensions, generators);
        logger.debug("Selection {} has {} exit(s): {}", selection.range(), exits.size(),
                exits.stream().map(e -> e.kind() + "@" + e.line()).toList());
        return summary;
    }

    private void visit(Node node, NormalizedSelection selection, ExtractionConfig config,
            List<ExitPoint> exits, List<MethodCallExpr> suspensions, List<MethodCallExpr> generators) {
        if (node instanceof ReturnStmt returnStmt) {
            exits.add(new ExitPoint(ExitKind.EXPLICIT_RETURN, returnStmt, null,
                    returnStmt.getExpression().isPresent(), ASTUtility.line(returnStmt)));
        } else if (node instanceof BreakStmt || node instanceof ContinueStmt) {
            Statement jump = (Statement) node;
            Optional<Node> target = JumpTargets.targetOf(jump);
            if (target.isPresent() && !selection.contains(target.get())) {
                exits.add(new ExitPoint(ExitKind.LOOP_EXIT, jump, target.get(), false, ASTUtility.line(jump)));
            }
        } else if (node instanceof YieldStmt yield) {
            Optional<Node> target = JumpTargets.targetOf(yield);
            if (target.isEmpty() || !selection.contains(target.get())) {
                throw new ExtractionException(ErrorKind.UNSUPPORTED_JUMP_CONSTRUCT,
                        "yield at line " + ASTUtility.line(yield) + " leaves a switch expression outside the selection");
            }
        } else if (node instanceof ThrowStmt throwStmt) {
            if (!isCaughtInside(throwStmt, selection)) {
                exits.add(new ExitPoint(ExitKind.PROPAGATED_EXCEPTION, throwStmt, null, false,
                        ASTUtility.line(throwStmt)));
            }
        } else if (node instanceof MethodCallExpr call) {
            if (config.isSuspensionMethod(call.getNameAsString())) {
                suspensions.add(call);
            } else if (config.isGeneratorMethod(call.getNameAsString())) {
                generators.add(call);
            }
        }
    }

    /**
     * A throw is caught when a try statement inside the selection guards it with a
     * catch clause naming the thrown type or a catch-all type.
     */
    private boolean isCaughtInside(ThrowStmt throwStmt, NormalizedSelection selection) {
        String thrown = thrownTypeName(throwStmt.getExpression());
        Node child = throwStmt;
        Node current = throwStmt.getParentNode().orElse(null);
        while (current != null && selection.contains(current) && !ASTUtility.isScopeBoundary(current)) {
            if (current instanceof TryStmt tryStmt && child == tryStmt.getTryBlock()) {
                for (CatchClause clause : tryStmt.getCatchClauses()) {
                    if (catches(clause.getParameter().getType(), thrown)) {
                        return true;
                    }
                }
            }
            child = current;
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private static boolean catches(Type caught, String thrown) {
        List<Type> alternatives = caught instanceof UnionType union
                ? new ArrayList<>(union.getElements())
                : List.of(caught);
        for (Type alternative : alternatives) {
            String name = alternative.asString();
            String simple = alternative instanceof ClassOrInterfaceType type ? type.getNameAsString() : name;
            if (CATCH_ALL.contains(name) || simple.equals(thrown)) {
                return true;
            }
        }
        return false;
    }

    private static String thrownTypeName(Expression expression) {
        if (expression instanceof ObjectCreationExpr creation) {
            return creation.getType().getNameAsString();
        }
        return null;
    }
}
