package com.raditha.extract.util;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.raditha.extract.source.LineIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Tree helpers shared by the analysis phases.
 *
 * JavaParser nodes implement structural equals and hashCode, so two separate
 * {@code i++;} statements compare equal. Everything here works on identity instead.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    public static <T> Set<T> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /**
     * Position of a node in a list by identity, -1 when absent.
     */
    public static int indexOf(List<? extends Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * True when {@code node} is {@code ancestor} or nested anywhere inside it.
     */
    public static boolean isWithin(Node node, Node ancestor) {
        Node current = node;
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    public static int beginOffset(Node node, LineIndex lines) {
        return lines.offset(node.getRange().orElseThrow().begin);
    }

    /**
     * Offset just past the last character of the node.
     */
    public static int endOffset(Node node, LineIndex lines) {
        return lines.offset(node.getRange().orElseThrow().end) + 1;
    }

    public static int line(Node node) {
        return node.getRange().map(r -> r.begin.line).orElse(0);
    }

    /**
     * Nodes that start a new method-like scope: lambdas and class bodies.
     */
    public static boolean isScopeBoundary(Node node) {
        return node instanceof LambdaExpr || node instanceof BodyDeclaration<?>;
    }

    /**
     * Pre-order walk that stays within the code executed by the current method,
     * skipping lambda bodies, anonymous class members and local class declarations.
     */
    public static void walkSameCallable(Node root, Consumer<Node> visitor) {
        visitor.accept(root);
        for (Node child : new ArrayList<>(root.getChildNodes())) {
            if (!isScopeBoundary(child)) {
                walkSameCallable(child, visitor);
            }
        }
    }

    public static <T extends Node> List<T> findSameCallable(Node root, Class<T> type) {
        List<T> found = new ArrayList<>();
        walkSameCallable(root, n -> {
            if (type.isInstance(n)) {
                found.add(type.cast(n));
            }
        });
        return found;
    }

    /**
     * Members of a type declaration or of an anonymous class body.
     */
    public static NodeList<BodyDeclaration<?>> membersOf(Node typeNode) {
        if (typeNode instanceof TypeDeclaration<?> type) {
            return type.getMembers();
        }
        if (typeNode instanceof ObjectCreationExpr creation) {
            return creation.getAnonymousClassBody().orElseGet(NodeList::new);
        }
        return new NodeList<>();
    }

    /**
     * Innermost type declaration or anonymous class creation enclosing a node.
     */
    public static Node enclosingType(Node node) {
        Node child = node;
        Node current = node.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof TypeDeclaration<?>) {
                return current;
            }
            if (current instanceof ObjectCreationExpr creation && child instanceof BodyDeclaration<?>
                    && creation.getAnonymousClassBody().isPresent()) {
                return current;
            }
            child = current;
            current = current.getParentNode().orElse(null);
        }
        return null;
    }

    /**
     * All type declarations enclosing a node, innermost first.
     */
    public static List<Node> enclosingTypes(Node node) {
        List<Node> types = new ArrayList<>();
        Node type = enclosingType(node);
        while (type != null) {
            types.add(type);
            type = enclosingType(type);
        }
        return types;
    }
}
