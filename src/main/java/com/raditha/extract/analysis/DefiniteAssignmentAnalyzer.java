package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.github.javaparser.ast.type.Type;
import com.raditha.extract.util.ASTUtility;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structured definite assignment analysis over local variables.
 *
 * A state is the set of declarations definitely assigned at a program point.
 * {@code null} stands for an unreachable point, where every variable is vacuously
 * assigned. Branches merge by intersection.
 */
public class DefiniteAssignmentAnalyzer {

    /**
     * Analysis outcome.
     *
     * @param assignedAfter        Declarations assigned when the code completes normally, null if it cannot
     * @param readBeforeAssignment Tracked declarations read at a point where they were not yet assigned
     * @param hookReached          Whether the hook node was visited
     * @param stateAtHook          Assignment state just before the hook, null if unreachable
     */
    public record Result(
            Set<Node> assignedAfter,
            Set<Node> readBeforeAssignment,
            boolean hookReached,
            Set<Node> stateAtHook) {

        public boolean completesNormally() {
            return assignedAfter != null;
        }

        public boolean isAssignedAfter(Node declaration) {
            return assignedAfter == null || assignedAfter.contains(declaration);
        }

        public boolean isAssignedAtHook(Node declaration) {
            return !hookReached || stateAtHook == null || stateAtHook.contains(declaration);
        }
    }

    private record Branches(Set<Node> whenTrue, Set<Node> whenFalse) {
    }

    private final LocalScopeResolver resolver;

    public DefiniteAssignmentAnalyzer(LocalScopeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Walk statements starting from an empty state.
     *
     * @param statements Statements in execution order
     * @param tracked    Declarations whose unassigned reads are reported
     * @param hook       Node whose entry state is recorded, may be null
     */
    public Result analyze(List<? extends Statement> statements, Set<Node> tracked, Node hook) {
        Walk walk = new Walk(tracked, hook);
        Set<Node> out = walk.statements(statements, ASTUtility.identitySet());
        return new Result(out, walk.reads, walk.hookReached, walk.hookState);
    }

    public Result analyze(Expression expression, Set<Node> tracked) {
        Walk walk = new Walk(tracked, null);
        Set<Node> out = walk.expression(expression, ASTUtility.identitySet());
        return new Result(out, walk.reads, walk.hookReached, walk.hookState);
    }

    /**
     * Variables assigned by their own declaration form, such as parameters and loop variables.
     */
    public static boolean isImplicitlyAssigned(Node declaration) {
        if (!(declaration instanceof VariableDeclarator declarator)) {
            return true;
        }
        Node parent = declarator.getParentNode().orElse(null);
        return parent != null && parent.getParentNode().orElse(null) instanceof ForEachStmt;
    }

    private static Set<Node> copy(Set<Node> state) {
        if (state == null) {
            return null;
        }
        Set<Node> copy = ASTUtility.identitySet();
        copy.addAll(state);
        return copy;
    }

    private static Set<Node> intersect(Set<Node> a, Set<Node> b) {
        if (a == null) {
            return copy(b);
        }
        if (b == null) {
            return copy(a);
        }
        Set<Node> result = copy(a);
        result.retainAll(b);
        return result;
    }

    private final class Walk {
        private final Set<Node> tracked;
        private final Node hook;
        private final Set<Node> reads = ASTUtility.identitySet();
        private final Map<Node, Set<Node>> breaks = new IdentityHashMap<>();
        private final Map<Node, Set<Node>> continues = new IdentityHashMap<>();
        private boolean hookReached;
        private Set<Node> hookState;

        Walk(Set<Node> tracked, Node hook) {
            this.tracked = tracked;
            this.hook = hook;
        }

        Set<Node> statements(List<? extends Statement> list, Set<Node> in) {
            Set<Node> state = in;
            for (Statement statement : list) {
                state = statement(statement, state);
            }
            return state;
        }

        Set<Node> statement(Statement s, Set<Node> in) {
            checkHook(s, in);
            if (s instanceof BlockStmt block) {
                return statements(block.getStatements(), in);
            }
            if (s instanceof ExpressionStmt expressionStmt) {
                return expression(expressionStmt.getExpression(), in);
            }
            if (s instanceof IfStmt ifStmt) {
                Branches c = condition(ifStmt.getCondition(), in);
                Set<Node> then = statement(ifStmt.getThenStmt(), c.whenTrue());
                Set<Node> otherwise = ifStmt.getElseStmt().isPresent()
                        ? statement(ifStmt.getElseStmt().get(), c.whenFalse())
                        : c.whenFalse();
                return intersect(then, otherwise);
            }
            if (s instanceof WhileStmt loop) {
                Branches c = condition(loop.getCondition(), in);
                statement(loop.getBody(), copy(c.whenTrue()));
                takeContinues(loop);
                return intersect(c.whenFalse(), breaks.remove(loop));
            }
            if (s instanceof DoStmt loop) {
                Set<Node> body = statement(loop.getBody(), in);
                Branches c = condition(loop.getCondition(), intersect(body, takeContinues(loop)));
                return intersect(c.whenFalse(), breaks.remove(loop));
            }
            if (s instanceof ForStmt loop) {
                return forLoop(loop, in);
            }
            if (s instanceof ForEachStmt loop) {
                Set<Node> state = expression(loop.getIterable(), in);
                statement(loop.getBody(), copy(state));
                takeContinues(loop);
                return intersect(state, breaks.remove(loop));
            }
            if (s instanceof LabeledStmt labeled) {
                Set<Node> out = statement(labeled.getStatement(), in);
                continues.remove(labeled);
                return intersect(out, breaks.remove(labeled));
            }
            if (s instanceof SwitchStmt switchStmt) {
                return switchStatement(switchStmt, in);
            }
            if (s instanceof TryStmt tryStmt) {
                return tryStatement(tryStmt, in);
            }
            if (s instanceof SynchronizedStmt sync) {
                return statement(sync.getBody(), expression(sync.getExpression(), in));
            }
            if (s instanceof ReturnStmt returnStmt) {
                returnStmt.getExpression().ifPresent(e -> expression(e, in));
                return null;
            }
            if (s instanceof ThrowStmt throwStmt) {
                expression(throwStmt.getExpression(), in);
                return null;
            }
            if (s instanceof YieldStmt yieldStmt) {
                expression(yieldStmt.getExpression(), in);
                return null;
            }
            if (s instanceof BreakStmt || s instanceof ContinueStmt) {
                Map<Node, Set<Node>> jumps = s instanceof BreakStmt ? breaks : continues;
                Optional<Node> target = JumpTargets.targetOf(s);
                if (target.isPresent() && in != null) {
                    jumps.merge(target.get(), copy(in), DefiniteAssignmentAnalyzer::intersect);
                }
                return null;
            }
            if (s instanceof LocalClassDeclarationStmt || s instanceof LocalRecordDeclarationStmt) {
                captured(s, in);
                return in;
            }
            if (s instanceof AssertStmt assertStmt) {
                condition(assertStmt.getCheck(), copy(in));
                return in;
            }
            return children(s, in);
        }

        private Set<Node> forLoop(ForStmt loop, Set<Node> in) {
            Set<Node> state = in;
            for (Expression init : loop.getInitialization()) {
                state = expression(init, state);
            }
            Branches c = loop.getCompare().isPresent()
                    ? condition(loop.getCompare().get(), state)
                    : new Branches(state, null);
            Set<Node> body = statement(loop.getBody(), copy(c.whenTrue()));
            Set<Node> beforeUpdate = intersect(body, takeContinues(loop));
            for (Expression update : loop.getUpdate()) {
                beforeUpdate = expression(update, beforeUpdate);
            }
            return intersect(c.whenFalse(), breaks.remove(loop));
        }

        private Set<Node> switchStatement(SwitchStmt switchStmt, Set<Node> in) {
            Set<Node> selector = expression(switchStmt.getSelector(), in);
            Set<Node> out = null;
            Set<Node> fallthrough = null;
            boolean grouped = false;
            boolean hasDefault = false;
            for (SwitchEntry entry : switchStmt.getEntries()) {
                hasDefault |= entry.getLabels().isEmpty();
                if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                    grouped = true;
                    fallthrough = statements(entry.getStatements(), intersect(selector, fallthrough));
                } else {
                    out = intersect(out, statements(entry.getStatements(), copy(selector)));
                }
            }
            if (grouped) {
                out = intersect(out, fallthrough);
            }
            if (!hasDefault || switchStmt.getEntries().isEmpty()) {
                out = intersect(out, selector);
            }
            return intersect(out, breaks.remove(switchStmt));
        }

        private Set<Node> tryStatement(TryStmt tryStmt, Set<Node> in) {
            Set<Node> state = copy(in);
            for (Expression resource : tryStmt.getResources()) {
                state = expression(resource, state);
            }
            Set<Node> result = statement(tryStmt.getTryBlock(), state);
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                result = intersect(result, statement(clause.getBody(), copy(in)));
            }
            if (tryStmt.getFinallyBlock().isPresent()) {
                Set<Node> fin = statement(tryStmt.getFinallyBlock().get(), copy(in));
                if (fin == null || result == null) {
                    return null;
                }
                result = copy(result);
                result.addAll(fin);
            }
            return result;
        }

        Set<Node> expression(Expression e, Set<Node> in) {
            checkHook(e, in);
            if (e instanceof NameExpr name) {
                read(name, in);
                return in;
            }
            if (e instanceof AssignExpr assign) {
                if (assign.getTarget() instanceof NameExpr target) {
                    if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
                        read(target, in);
                    }
                    Set<Node> state = expression(assign.getValue(), in);
                    assign(target, state);
                    return state;
                }
                return expression(assign.getValue(), expression(assign.getTarget(), in));
            }
            if (e instanceof UnaryExpr unary && isIncrementOrDecrement(unary)
                    && unary.getExpression() instanceof NameExpr target) {
                read(target, in);
                assign(target, in);
                return in;
            }
            if (e instanceof BinaryExpr binary && isLogical(binary)) {
                Branches c = condition(e, in);
                return intersect(c.whenTrue(), c.whenFalse());
            }
            if (e instanceof ConditionalExpr conditional) {
                Branches c = condition(conditional.getCondition(), in);
                Set<Node> then = expression(conditional.getThenExpr(), copy(c.whenTrue()));
                Set<Node> otherwise = expression(conditional.getElseExpr(), copy(c.whenFalse()));
                return intersect(then, otherwise);
            }
            if (e instanceof VariableDeclarationExpr declaration) {
                Set<Node> state = in;
                for (VariableDeclarator declarator : declaration.getVariables()) {
                    if (declarator.getInitializer().isPresent()) {
                        state = expression(declarator.getInitializer().get(), state);
                        if (state != null) {
                            state.add(declarator);
                        }
                    }
                }
                return state;
            }
            if (e instanceof LambdaExpr) {
                captured(e, in);
                return in;
            }
            if (e instanceof SwitchExpr switchExpr) {
                Set<Node> state = expression(switchExpr.getSelector(), in);
                for (SwitchEntry entry : switchExpr.getEntries()) {
                    statements(entry.getStatements(), copy(state));
                }
                return state;
            }
            return children(e, in);
        }

        private Branches condition(Expression e, Set<Node> in) {
            if (e instanceof BooleanLiteralExpr literal) {
                return literal.getValue() ? new Branches(in, null) : new Branches(null, in);
            }
            if (e instanceof EnclosedExpr enclosed) {
                return condition(enclosed.getInner(), in);
            }
            if (e instanceof UnaryExpr unary && unary.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) {
                Branches inner = condition(unary.getExpression(), in);
                return new Branches(inner.whenFalse(), inner.whenTrue());
            }
            if (e instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.AND) {
                Branches left = condition(binary.getLeft(), in);
                Branches right = condition(binary.getRight(), copy(left.whenTrue()));
                return new Branches(right.whenTrue(), intersect(left.whenFalse(), right.whenFalse()));
            }
            if (e instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.OR) {
                Branches left = condition(binary.getLeft(), in);
                Branches right = condition(binary.getRight(), copy(left.whenFalse()));
                return new Branches(intersect(left.whenTrue(), right.whenTrue()), right.whenFalse());
            }
            Set<Node> state = expression(e, in);
            return new Branches(state, copy(state));
        }

        private Set<Node> children(Node node, Set<Node> in) {
            Set<Node> state = in;
            for (Node child : node.getChildNodes()) {
                if (child instanceof Expression expression) {
                    state = expression(expression, state);
                } else if (child instanceof Statement statement) {
                    state = statement(statement, state);
                } else if (child instanceof BodyDeclaration<?>) {
                    captured(child, state);
                } else if (!(child instanceof Type || child instanceof SimpleName
                        || child instanceof Name || child instanceof Comment)) {
                    state = children(child, state);
                }
            }
            return state;
        }

        /**
         * Code that runs later (lambda and class bodies) only reads captured values.
         */
        private void captured(Node body, Set<Node> state) {
            for (NameExpr name : body.findAll(NameExpr.class)) {
                read(name, state);
            }
        }

        private void read(NameExpr name, Set<Node> state) {
            if (state == null) {
                return;
            }
            resolver.resolve(name).ifPresent(declaration -> {
                if (tracked.contains(declaration) && !state.contains(declaration)) {
                    reads.add(declaration);
                }
            });
        }

        private void assign(NameExpr target, Set<Node> state) {
            if (state != null) {
                resolver.resolve(target).ifPresent(state::add);
            }
        }

        private Set<Node> takeContinues(Node loop) {
            Set<Node> own = continues.remove(loop);
            Node parent = loop.getParentNode().orElse(null);
            if (parent instanceof LabeledStmt) {
                Set<Node> labeled = continues.remove(parent);
                if (labeled != null) {
                    return own == null ? labeled : intersect(own, labeled);
                }
            }
            return own;
        }

        private void checkHook(Node node, Set<Node> in) {
            if (node == hook && !hookReached) {
                hookReached = true;
                hookState = copy(in);
            }
        }
    }

    static boolean isIncrementOrDecrement(UnaryExpr unary) {
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }

    private static boolean isLogical(BinaryExpr binary) {
        return binary.getOperator() == BinaryExpr.Operator.AND || binary.getOperator() == BinaryExpr.Operator.OR;
    }
}
