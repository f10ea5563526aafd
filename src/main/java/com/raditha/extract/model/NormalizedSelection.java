package com.raditha.extract.model;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

import java.util.List;

/**
 * A validated selection: either one expression or a contiguous run of sibling statements.
 *
 * @param mode                Statement or expression granularity
 * @param statements          Selected statements, empty in expression mode
 * @param expression          Selected expression, null in statement mode
 * @param callable            Method, constructor or lambda whose body holds the selection
 * @param member              Type member containing the callable
 * @param enclosingType       Type declaration or anonymous class creation that receives the new method
 * @param startOffset         Start character offset of the normalized selection
 * @param endOffset           End character offset, exclusive
 * @param range               Normalized range
 * @param singleStatementSlot The selection is the unbraced body of an if, loop or label
 * @param warnings            Warnings raised by normalization
 */
public record NormalizedSelection(
        SelectionMode mode,
        List<Statement> statements,
        Expression expression,
        Node callable,
        BodyDeclaration<?> member,
        Node enclosingType,
        int startOffset,
        int endOffset,
        Range range,
        boolean singleStatementSlot,
        List<Warning> warnings) {

    public NormalizedSelection {
        statements = List.copyOf(statements);
        warnings = List.copyOf(warnings);
    }

    /**
     * The selected nodes: the statements, or the single expression.
     */
    public List<Node> nodes() {
        if (mode == SelectionMode.EXPRESSION) {
            return List.of(expression);
        }
        return List.copyOf(statements);
    }

    public Node first() {
        return nodes().get(0);
    }

    public Node last() {
        List<Node> nodes = nodes();
        return nodes.get(nodes.size() - 1);
    }

    /**
     * True when the node is one of the selected nodes or nested inside one.
     */
    public boolean contains(Node node) {
        List<Node> roots = nodes();
        Node current = node;
        while (current != null) {
            for (Node root : roots) {
                if (root == current) {
                    return true;
                }
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }
}
