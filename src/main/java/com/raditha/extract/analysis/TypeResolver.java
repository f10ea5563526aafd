package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.resolution.types.ResolvedWildcard;
import com.raditha.extract.util.ASTUtility;
import com.raditha.extract.util.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Works out Java types for declarations and expressions.
 *
 * Declared types are taken from the source. Everything else goes through the
 * JavaParser symbol solver first and falls back to simple syntactic inference.
 */
public class TypeResolver {
    private static final Logger logger = LoggerFactory.getLogger(TypeResolver.class);

    private static final Pattern JAVA_LANG = Pattern.compile("\\bjava\\.lang\\.(?=[A-Z])");

    private static final Map<String, String> BOXES = Map.of(
            "int", "Integer",
            "long", "Long",
            "short", "Short",
            "byte", "Byte",
            "char", "Character",
            "boolean", "Boolean",
            "float", "Float",
            "double", "Double",
            "void", "Void");

    private final LocalScopeResolver scopes;
    private final SourceParser parser;
    private final Set<Expression> unresolved = ASTUtility.identitySet();

    public TypeResolver(LocalScopeResolver scopes, SourceParser parser) {
        this.scopes = scopes;
        this.parser = parser;
    }

    /**
     * Type of a local declaration as it would be written in a declaration.
     * Implicit lambda parameters and {@code var} locals are resolved.
     */
    public Optional<String> declaredType(Node declaration) {
        if (declaration instanceof VariableDeclarator declarator) {
            Type type = declarator.getType();
            if (type.isVarType()) {
                return declarator.getInitializer().flatMap(this::typeOf);
            }
            return Optional.of(type.asString());
        }
        if (declaration instanceof Parameter parameter) {
            Type type = parameter.getType();
            if (type.isUnknownType() || type.isVarType()) {
                return resolvedParameterType(parameter);
            }
            String text = type.asString();
            return Optional.of(parameter.isVarArgs() ? text + "[]" : text);
        }
        if (declaration instanceof PatternExpr pattern) {
            return Optional.of(pattern.getType().asString());
        }
        return Optional.empty();
    }

    /**
     * Static type of an expression, empty when it cannot be determined.
     */
    public Optional<String> typeOf(Expression expression) {
        try {
            ResolvedType resolved = expression.calculateResolvedType();
            return Optional.of(describe(resolved));
        } catch (RuntimeException e) {
            logger.debug("Symbol solver could not type '{}': {}", expression, e.getMessage());
        }
        unresolved.add(expression);
        return inferTypeFromExpression(expression);
    }

    /**
     * True when the type of the expression was guessed from its syntax because the symbol solver failed.
     */
    public boolean isGuessed(Expression expression) {
        return unresolved.contains(expression);
    }

    /**
     * Wrapper type for primitives, the type itself otherwise.
     */
    public static String box(String type) {
        return BOXES.getOrDefault(type, type);
    }

    public static boolean isPrimitive(String type) {
        return BOXES.containsKey(type) && !"void".equals(type);
    }

    /**
     * Initializer that satisfies definite assignment without changing behaviour.
     */
    public static String defaultValue(String type) {
        return switch (type) {
            case "int", "short", "byte" -> "0";
            case "long" -> "0L";
            case "float" -> "0f";
            case "double" -> "0.0";
            case "boolean" -> "false";
            case "char" -> "'\\0'";
            default -> "null";
        };
    }

    /**
     * Whether a type can be written in a method signature placed next to {@code context}'s member.
     * Rejects var, the null type, union types and local or anonymous classes.
     */
    public boolean isExpressible(String type, Node context) {
        if (type == null || type.isBlank() || "var".equals(type) || "null".equals(type)
                || type.contains("|") || type.contains("$") || type.contains("Anonymous")) {
            return false;
        }
        Optional<Type> parsed = parser.tryParseType(type);
        if (parsed.isEmpty()) {
            return false;
        }
        for (ClassOrInterfaceType part : parsed.get().findAll(ClassOrInterfaceType.class)) {
            if (isLocalTypeName(part.getNameAsString(), context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Declarable text of a resolved type. A wildcard, as inferred for the parameter of a lambda
     * passed to {@code forEach(Consumer<? super T>)}, stands for its bound or Object.
     */
    static String describe(ResolvedType type) {
        if (type.isWildcard()) {
            ResolvedWildcard wildcard = type.asWildcard();
            return wildcard.isBounded() ? describe(wildcard.getBoundedType()) : "Object";
        }
        return simplify(type.describe());
    }

    static String simplify(String described) {
        return JAVA_LANG.matcher(described).replaceAll("");
    }

    private Optional<String> resolvedParameterType(Parameter parameter) {
        try {
            return Optional.of(describe(parameter.resolve().getType()));
        } catch (RuntimeException e) {
            logger.debug("Could not resolve type of parameter {}: {}", parameter.getNameAsString(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> inferTypeFromExpression(Expression expr) {
        if (expr instanceof EnclosedExpr enclosed) {
            return typeOf(enclosed.getInner());
        }
        if (expr.isStringLiteralExpr() || expr.isTextBlockLiteralExpr()) return Optional.of("String");
        if (expr.isIntegerLiteralExpr()) return Optional.of("int");
        if (expr.isLongLiteralExpr()) return Optional.of("long");
        if (expr.isDoubleLiteralExpr()) {
            String text = expr.asDoubleLiteralExpr().getValue();
            return Optional.of(text.endsWith("f") || text.endsWith("F") ? "float" : "double");
        }
        if (expr.isBooleanLiteralExpr()) return Optional.of("boolean");
        if (expr.isCharLiteralExpr()) return Optional.of("char");
        if (expr instanceof CastExpr cast) {
            return Optional.of(cast.getType().asString());
        }
        if (expr instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isEmpty()) {
            ClassOrInterfaceType type = creation.getType();
            if (type.getTypeArguments().isPresent() && type.getTypeArguments().get().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(type.asString());
        }
        if (expr instanceof NameExpr name) {
            return scopes.resolve(name).flatMap(this::declaredType);
        }
        if (expr instanceof BinaryExpr binary) {
            return inferBinary(binary);
        }
        return Optional.empty();
    }

    private Optional<String> inferBinary(BinaryExpr binary) {
        switch (binary.getOperator()) {
            case AND, OR, EQUALS, NOT_EQUALS, LESS, GREATER, LESS_EQUALS, GREATER_EQUALS:
                return Optional.of("boolean");
            default:
                break;
        }
        Optional<String> left = typeOf(binary.getLeft());
        Optional<String> right = typeOf(binary.getRight());
        if (binary.getOperator() == BinaryExpr.Operator.PLUS
                && ("String".equals(left.orElse(null)) || "String".equals(right.orElse(null)))) {
            return Optional.of("String");
        }
        if (left.isPresent() && left.equals(right)) {
            return left;
        }
        return Optional.empty();
    }

    private static boolean isLocalTypeName(String name, Node context) {
        Node root = context;
        while (root.getParentNode().isPresent()) {
            root = root.getParentNode().get();
        }
        boolean localClass = root.findAll(LocalClassDeclarationStmt.class).stream()
                .anyMatch(s -> s.getClassDeclaration().getNameAsString().equals(name));
        boolean localRecord = root.findAll(LocalRecordDeclarationStmt.class).stream()
                .anyMatch(s -> s.getRecordDeclaration().getNameAsString().equals(name));
        return localClass || localRecord;
    }
}
