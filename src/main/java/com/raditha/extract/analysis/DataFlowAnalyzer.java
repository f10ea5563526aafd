package com.raditha.extract.analysis;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.DataFlowSummary;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.model.VariableFlowFact;
import com.raditha.extract.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes how local variables flow into, through and out of a selection.
 *
 * Only locals and parameters take part; fields are instance or static state and
 * never become parameters. A variable's value flows in when it is read inside before
 * being definitely assigned inside, or when the selection only sometimes overwrites a
 * value that is read afterwards.
 */
public class DataFlowAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(DataFlowAnalyzer.class);

    private final LocalScopeResolver scopes;
    private final TypeResolver types;

    public DataFlowAnalyzer(LocalScopeResolver scopes, TypeResolver types) {
        this.scopes = scopes;
        this.types = types;
    }

    /**
     * Analyze a validated selection.
     *
     * @param selection the selection
     * @param flow      control flow facts for the same selection
     * @return one fact per variable, in order of first appearance
     * @throws ExtractionException INCOMPLETE_SELECTION when an expression writes a local that is read later
     */
    public DataFlowSummary analyze(NormalizedSelection selection, ControlFlowSummary flow) {
        Node body = callableBody(selection.callable());
        Map<Node, List<NameExpr>> inside = new IdentityHashMap<>();
        List<Node> order = new ArrayList<>();

        for (Node root : selection.nodes()) {
            root.walk(node -> {
                if (node instanceof NameExpr name) {
                    scopes.resolve(name)
                            .filter(LocalScopeResolver::isLocalDeclaration)
                            .ifPresent(decl -> record(decl, name, inside, order));
                } else if (node instanceof VariableDeclarator declarator
                        && LocalScopeResolver.isLocalDeclaration(declarator)) {
                    record(declarator, null, inside, order);
                }
            });
        }

        Set<Node> outside = ASTUtility.identitySet();
        for (Node decl : order) {
            if (!selection.contains(decl)) {
                outside.add(decl);
            }
        }

        DefiniteAssignmentAnalyzer assignment = new DefiniteAssignmentAnalyzer(scopes);
        DefiniteAssignmentAnalyzer.Result relative = selection.mode() == SelectionMode.EXPRESSION
                ? assignment.analyze(selection.expression(), outside)
                : assignment.analyze(selection.statements(), outside, null);
        DefiniteAssignmentAnalyzer.Result enclosing = body instanceof Statement statement
                ? assignment.analyze(List.of(statement), Set.of(), selection.first())
                : null;

        List<NameExpr> after = referencesAfter(selection, body);
        List<VariableFlowFact> facts = new ArrayList<>();
        for (Node decl : order) {
            VariableFlowFact fact = selection.contains(decl)
                    ? insideFact(decl, inside.get(decl), selection, after)
                    : outsideFact(decl, inside.get(decl), selection, flow, body, relative, enclosing, after);
            facts.add(fact);
        }

        if (selection.mode() == SelectionMode.EXPRESSION) {
            for (VariableFlowFact fact : facts) {
                if (fact.writtenInside() && fact.readAfter()) {
                    throw new ExtractionException(ErrorKind.INCOMPLETE_SELECTION,
                            "The expression assigns '" + fact.name() + "', which is used afterwards");
                }
            }
        }

        DataFlowSummary summary = new DataFlowSummary(facts);
        logger.debug("Data flow for {}: in={} written={} after={}", selection.range(),
                summary.dataFlowsIn(), summary.writtenInside(), summary.readAfter());
        return summary;
    }

    /**
     * Reads of a variable that happen after the selection: later in the body, or anywhere
     * in a loop that encloses both the selection and the variable's uses.
     */
    private List<NameExpr> referencesAfter(NormalizedSelection selection, Node body) {
        List<NameExpr> after = new ArrayList<>();
        if (body == null) {
            return after;
        }
        Position end = selection.last().getEnd().orElseThrow();
        for (NameExpr name : body.findAll(NameExpr.class)) {
            if (!selection.contains(name) && isRead(name)
                    && name.getBegin().map(p -> p.isAfter(end)).orElse(false)) {
                after.add(name);
            }
        }
        return after;
    }

    private VariableFlowFact insideFact(Node decl, List<NameExpr> references, NormalizedSelection selection,
            List<NameExpr> after) {
        boolean topLevel = isTopLevelDeclaration(decl, selection);
        boolean readAfter = topLevel && after.stream().anyMatch(n -> refersTo(n, decl));
        boolean captured = references.stream().anyMatch(n -> isCaptured(n, selection));
        return new VariableFlowFact(decl, name(decl), types.declaredType(decl).orElse(null),
                true, false, true, readAfter, false, captured, isFinal(decl));
    }

    private VariableFlowFact outsideFact(Node decl, List<NameExpr> references, NormalizedSelection selection,
            ControlFlowSummary flow, Node body, DefiniteAssignmentAnalyzer.Result relative,
            DefiniteAssignmentAnalyzer.Result enclosing, List<NameExpr> after) {
        boolean written = references.stream().anyMatch(DataFlowAnalyzer::isWrite);
        boolean readsEntryValue = relative.readBeforeAssignment().contains(decl);
        boolean readAfter = after.stream().anyMatch(n -> refersTo(n, decl))
                || readInEnclosingLoop(decl, selection, body, written && readsEntryValue);
        boolean daBefore = DefiniteAssignmentAnalyzer.isImplicitlyAssigned(decl)
                || body == null || !ASTUtility.isWithin(decl, body)
                || enclosing == null || enclosing.isAssignedAtHook(decl);
        boolean daAfter = relative.completesNormally() && flow.jumps().isEmpty() && relative.isAssignedAfter(decl);
        boolean flowsIn = readsEntryValue
                || (written && readAfter && !daAfter && daBefore);
        boolean captured = references.stream().anyMatch(n -> isCaptured(n, selection));
        return new VariableFlowFact(decl, name(decl), types.declaredType(decl).orElse(null),
                false, flowsIn, written, readAfter, daBefore, captured, isFinal(decl));
    }

    /**
     * A selection that writes a variable and reads its entry value feeds itself on the next
     * iteration of an enclosing loop.
     */
    private boolean readInEnclosingLoop(Node decl, NormalizedSelection selection, Node body, boolean feedsItself) {
        Node current = selection.first().getParentNode().orElse(null);
        while (current != null && current != body && !ASTUtility.isScopeBoundary(current)) {
            if (JumpTargets.isLoop(current) && !ASTUtility.isWithin(decl, current)) {
                if (feedsItself) {
                    return true;
                }
                for (NameExpr name : current.findAll(NameExpr.class)) {
                    if (!selection.contains(name) && isRead(name) && refersTo(name, decl)) {
                        return true;
                    }
                }
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private boolean refersTo(NameExpr name, Node decl) {
        return name.getNameAsString().equals(name(decl)) && scopes.resolve(name).orElse(null) == decl;
    }

    private static void record(Node decl, NameExpr name, Map<Node, List<NameExpr>> inside, List<Node> order) {
        List<NameExpr> references = inside.get(decl);
        if (references == null) {
            references = new ArrayList<>();
            inside.put(decl, references);
            order.add(decl);
        }
        if (name != null) {
            references.add(name);
        }
    }

    static boolean isWrite(NameExpr name) {
        Node parent = name.getParentNode().orElse(null);
        if (parent instanceof AssignExpr assign) {
            return assign.getTarget() == name;
        }
        return parent instanceof UnaryExpr unary && DefiniteAssignmentAnalyzer.isIncrementOrDecrement(unary);
    }

    /**
     * Any use except being the target of a plain assignment.
     */
    static boolean isRead(NameExpr name) {
        Node parent = name.getParentNode().orElse(null);
        return !(parent instanceof AssignExpr assign && assign.getTarget() == name
                && assign.getOperator() == AssignExpr.Operator.ASSIGN);
    }

    private static boolean isTopLevelDeclaration(Node decl, NormalizedSelection selection) {
        if (!(decl instanceof VariableDeclarator)) {
            return false;
        }
        Node expression = decl.getParentNode().orElse(null);
        if (!(expression instanceof VariableDeclarationExpr)) {
            return false;
        }
        Node statement = expression.getParentNode().orElse(null);
        return statement instanceof ExpressionStmt && ASTUtility.indexOf(selection.statements(), statement) >= 0;
    }

    /**
     * True when the reference sits in a lambda or class body that is part of the selection.
     */
    private static boolean isCaptured(NameExpr reference, NormalizedSelection selection) {
        Node current = reference.getParentNode().orElse(null);
        while (current != null && selection.contains(current)) {
            if (ASTUtility.isScopeBoundary(current)) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private static String name(Node decl) {
        if (decl instanceof VariableDeclarator declarator) {
            return declarator.getNameAsString();
        }
        if (decl instanceof Parameter parameter) {
            return parameter.getNameAsString();
        }
        if (decl instanceof PatternExpr pattern) {
            return pattern.getNameAsString();
        }
        return decl.toString();
    }

    private static boolean isFinal(Node decl) {
        if (decl instanceof VariableDeclarator declarator
                && declarator.getParentNode().orElse(null) instanceof VariableDeclarationExpr expression) {
            return expression.isFinal();
        }
        return decl instanceof Parameter parameter && parameter.isFinal();
    }

    static Node callableBody(Node callable) {
        if (callable instanceof MethodDeclaration method) {
            return method.getBody().orElse(null);
        }
        if (callable instanceof ConstructorDeclaration constructor) {
            return constructor.getBody();
        }
        if (callable instanceof LambdaExpr lambda) {
            return lambda.getBody();
        }
        return null;
    }
}
