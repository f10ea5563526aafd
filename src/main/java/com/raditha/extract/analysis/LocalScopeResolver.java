package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.extract.util.ASTUtility;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves simple names to the local declaration they refer to by walking outwards
 * through the enclosing scopes, the way javac's lexical scoping does.
 *
 * The declaring node (a {@link VariableDeclarator}, {@link Parameter} or {@link PatternExpr})
 * is the identity of the symbol. Names that resolve to nothing are fields, types or
 * inherited members.
 */
public class LocalScopeResolver {

    private final Map<NameExpr, Optional<Node>> cache = new IdentityHashMap<>();

    public Optional<Node> resolve(NameExpr name) {
        return cache.computeIfAbsent(name, n -> resolve(n, n.getNameAsString()));
    }

    /**
     * Find the local declaration of {@code name} visible at {@code reference}.
     */
    public Optional<Node> resolve(Node reference, String name) {
        Node child = reference;
        Node scope = reference.getParentNode().orElse(null);
        while (scope != null) {
            Optional<Node> found = declaredIn(scope, child, name);
            if (found.isPresent()) {
                return found;
            }
            if (scope instanceof TypeDeclaration<?> type && !isLocalType(type)) {
                return Optional.empty();
            }
            child = scope;
            scope = scope.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    /**
     * True for locals and parameters, false for fields of local or anonymous classes.
     */
    public static boolean isLocalDeclaration(Node declaration) {
        if (declaration instanceof VariableDeclarator declarator) {
            return !(declarator.getParentNode().orElse(null) instanceof FieldDeclaration);
        }
        return declaration instanceof Parameter || declaration instanceof PatternExpr;
    }

    private Optional<Node> declaredIn(Node scope, Node child, String name) {
        if (scope instanceof BlockStmt block) {
            return precedingDeclaration(block.getStatements(), child, name);
        }
        if (scope instanceof SwitchEntry entry) {
            Optional<Node> found = precedingDeclaration(entry.getStatements(), child, name);
            if (found.isPresent()) {
                return found;
            }
            return earlierCaseGroups(entry, name);
        }
        if (scope instanceof VariableDeclarationExpr declaration && child instanceof VariableDeclarator) {
            return earlierDeclarators(declaration.getVariables(), child, name);
        }
        if (scope instanceof ForStmt loop) {
            return forLoopDeclaration(loop, child, name);
        }
        if (scope instanceof ForEachStmt loop && child == loop.getBody()) {
            return declaratorNamed(loop.getVariable().getVariables(), name);
        }
        if (scope instanceof TryStmt tryStmt) {
            return resourceDeclaration(tryStmt, child, name);
        }
        if (scope instanceof CatchClause clause && child == clause.getBody()) {
            return parameterNamed(NodeList.nodeList(clause.getParameter()), name);
        }
        if (scope instanceof LambdaExpr lambda && child == lambda.getBody()) {
            return parameterNamed(lambda.getParameters(), name);
        }
        if (scope instanceof MethodDeclaration method) {
            return parameterNamed(method.getParameters(), name);
        }
        if (scope instanceof ConstructorDeclaration constructor) {
            return parameterNamed(constructor.getParameters(), name);
        }
        if (scope instanceof IfStmt ifStmt && child != ifStmt.getCondition()) {
            return patternIn(ifStmt.getCondition(), name);
        }
        if (scope instanceof WhileStmt loop && child == loop.getBody()) {
            return patternIn(loop.getCondition(), name);
        }
        if (scope instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.AND
                && child == binary.getRight()) {
            return patternIn(binary.getLeft(), name);
        }
        if (scope instanceof ConditionalExpr conditional && child != conditional.getCondition()) {
            return patternIn(conditional.getCondition(), name);
        }
        if (scope instanceof ObjectCreationExpr creation && child instanceof BodyDeclaration<?>) {
            return fieldNamed(ASTUtility.membersOf(creation), name);
        }
        if (scope instanceof TypeDeclaration<?> type) {
            return fieldNamed(type.getMembers(), name);
        }
        return Optional.empty();
    }

    private Optional<Node> precedingDeclaration(List<Statement> statements, Node child, String name) {
        int index = ASTUtility.indexOf(statements, child);
        int limit = index < 0 ? statements.size() : index;
        for (int i = limit - 1; i >= 0; i--) {
            Statement statement = statements.get(i);
            if (statement instanceof ExpressionStmt expressionStmt
                    && expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
                Optional<Node> found = declaratorNamed(declaration.getVariables(), name);
                if (found.isPresent()) {
                    return found;
                }
            } else if (statement instanceof IfStmt ifStmt) {
                // if (!(o instanceof Foo f)) return; introduces f into the enclosing block
                Optional<Node> found = patternIn(ifStmt.getCondition(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Node> forLoopDeclaration(ForStmt loop, Node child, String name) {
        int index = ASTUtility.indexOf(loop.getInitialization(), child);
        if (index >= 0) {
            return declarationsIn(loop.getInitialization().subList(0, index), name);
        }
        Optional<Node> found = declarationsIn(loop.getInitialization(), name);
        if (found.isEmpty() && child == loop.getBody() && loop.getCompare().isPresent()) {
            return patternIn(loop.getCompare().get(), name);
        }
        return found;
    }

    private Optional<Node> earlierCaseGroups(SwitchEntry entry, String name) {
        if (!(entry.getParentNode().orElse(null) instanceof SwitchStmt switchStmt)
                || entry.getType() != SwitchEntry.Type.STATEMENT_GROUP) {
            return Optional.empty();
        }
        int index = ASTUtility.indexOf(switchStmt.getEntries(), entry);
        for (int i = index - 1; i >= 0; i--) {
            Optional<Node> found = precedingDeclaration(switchStmt.getEntries().get(i).getStatements(), null, name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<Node> earlierDeclarators(List<VariableDeclarator> declarators, Node child, String name) {
        int index = ASTUtility.indexOf(declarators, child);
        for (int i = index - 1; i >= 0; i--) {
            if (declarators.get(i).getNameAsString().equals(name)) {
                return Optional.of(declarators.get(i));
            }
        }
        return Optional.empty();
    }

    private Optional<Node> declarationsIn(List<Expression> expressions, String name) {
        for (Expression expression : expressions) {
            if (expression instanceof VariableDeclarationExpr declaration) {
                Optional<Node> found = declaratorNamed(declaration.getVariables(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Node> resourceDeclaration(TryStmt tryStmt, Node child, String name) {
        NodeList<Expression> resources = tryStmt.getResources();
        int limit;
        if (child == tryStmt.getTryBlock()) {
            limit = resources.size();
        } else {
            limit = ASTUtility.indexOf(resources, child);
        }
        if (limit <= 0) {
            return Optional.empty();
        }
        return declarationsIn(resources.subList(0, limit), name);
    }

    private static Optional<Node> declaratorNamed(List<VariableDeclarator> declarators, String name) {
        for (VariableDeclarator declarator : declarators) {
            if (declarator.getNameAsString().equals(name)) {
                return Optional.of(declarator);
            }
        }
        return Optional.empty();
    }

    private static Optional<Node> parameterNamed(List<Parameter> parameters, String name) {
        for (Parameter parameter : parameters) {
            if (parameter.getNameAsString().equals(name)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }

    private static Optional<Node> patternIn(Expression condition, String name) {
        for (PatternExpr pattern : ASTUtility.findSameCallable(condition, PatternExpr.class)) {
            if (pattern.getNameAsString().equals(name)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    private static Optional<Node> fieldNamed(List<BodyDeclaration<?>> members, String name) {
        for (BodyDeclaration<?> member : members) {
            if (member instanceof FieldDeclaration field) {
                Optional<Node> found = declaratorNamed(field.getVariables(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isLocalType(TypeDeclaration<?> type) {
        return type instanceof ClassOrInterfaceDeclaration
                && type.getParentNode().orElse(null) instanceof LocalClassDeclarationStmt;
    }
}
