package com.raditha.extract.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.nodeTypes.modifiers.NodeWithStaticModifier;
import com.raditha.extract.util.ASTUtility;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Detects whether code depends on the enclosing instance, which decides if an
 * extracted method can be static.
 */
public class InstanceStateAnalyzer {

    private static final Set<String> PACKAGE_ROOTS = Set.of("java", "javax", "jdk", "com", "org", "net", "io", "sun");

    private final LocalScopeResolver scopes;

    public InstanceStateAnalyzer(LocalScopeResolver scopes) {
        this.scopes = scopes;
    }

    /**
     * True when any of the nodes uses this, super, an instance field, an instance
     * method or an inner class of the enclosing type.
     */
    public boolean referencesInstanceState(List<? extends Node> roots, Node enclosingType) {
        for (Node root : roots) {
            if (referencesInstanceState(root, roots, enclosingType)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Code in a static method, static initializer or static field initializer has no instance.
     */
    public static boolean isStaticContext(BodyDeclaration<?> member) {
        if (member instanceof NodeWithStaticModifier<?> modified && modified.isStatic()) {
            return true;
        }
        return member instanceof InitializerDeclaration initializer && initializer.isStatic();
    }

    private boolean referencesInstanceState(Node root, List<? extends Node> roots, Node enclosingType) {
        for (ThisExpr thisExpr : root.findAll(ThisExpr.class)) {
            if (thisExpr.getTypeName().isPresent() || ASTUtility.enclosingType(thisExpr) == enclosingType) {
                return true;
            }
        }
        for (SuperExpr superExpr : root.findAll(SuperExpr.class)) {
            if (superExpr.getTypeName().isPresent() || ASTUtility.enclosingType(superExpr) == enclosingType) {
                return true;
            }
        }
        for (NameExpr name : root.findAll(NameExpr.class)) {
            if (isInstanceName(name, roots, enclosingType)) {
                return true;
            }
        }
        for (MethodCallExpr call : root.findAll(MethodCallExpr.class)) {
            if (call.getScope().isEmpty() && isInstanceMethodCall(call, roots)) {
                return true;
            }
        }
        for (ObjectCreationExpr creation : root.findAll(ObjectCreationExpr.class)) {
            if (creation.getScope().isEmpty() && isInnerClass(creation.getType().getNameAsString(), enclosingType)) {
                return true;
            }
        }
        return false;
    }

    private boolean isInstanceName(NameExpr name, List<? extends Node> roots, Node enclosingType) {
        Optional<Node> declaration = scopes.resolve(name);
        if (declaration.isPresent()) {
            Node found = declaration.get();
            if (LocalScopeResolver.isLocalDeclaration(found)) {
                return false;
            }
            if (found instanceof VariableDeclarator declarator
                    && declarator.getParentNode().orElse(null) instanceof FieldDeclaration field) {
                return !field.isStatic() && !declaredWithin(field, roots);
            }
            return false;
        }
        String text = name.getNameAsString();
        if (Character.isUpperCase(text.charAt(0))) {
            return false;
        }
        if (name.getParentNode().orElse(null) instanceof FieldAccessExpr access
                && access.getScope() == name && PACKAGE_ROOTS.contains(text)) {
            return false;
        }
        if (isStaticallyImported(name, text)) {
            return false;
        }
        // inherited member of a class declared inside the selection
        Node innermost = ASTUtility.enclosingType(name);
        return innermost == enclosingType || !declaredWithin(innermost, roots);
    }

    private boolean isInstanceMethodCall(MethodCallExpr call, List<? extends Node> roots) {
        String name = call.getNameAsString();
        for (Node type : ASTUtility.enclosingTypes(call)) {
            List<MethodDeclaration> methods = ASTUtility.membersOf(type).stream()
                    .filter(m -> m instanceof MethodDeclaration md && md.getNameAsString().equals(name))
                    .map(MethodDeclaration.class::cast)
                    .toList();
            if (!methods.isEmpty()) {
                return !declaredWithin(type, roots) && methods.stream().anyMatch(m -> !m.isStatic());
            }
        }
        if (isStaticallyImported(call, name)) {
            return false;
        }
        Node innermost = ASTUtility.enclosingType(call);
        return innermost == null || !declaredWithin(innermost, roots);
    }

    private static boolean isInnerClass(String name, Node enclosingType) {
        if (enclosingType == null) {
            return false;
        }
        List<Node> types = new ArrayList<>();
        types.add(enclosingType);
        types.addAll(ASTUtility.enclosingTypes(enclosingType));
        for (Node type : types) {
            boolean inInterface = type instanceof ClassOrInterfaceDeclaration owner && owner.isInterface();
            for (BodyDeclaration<?> member : ASTUtility.membersOf(type)) {
                if (member instanceof ClassOrInterfaceDeclaration nested
                        && nested.getNameAsString().equals(name)) {
                    return !inInterface && !nested.isStatic() && !nested.isInterface();
                }
            }
        }
        return false;
    }

    private static boolean isStaticallyImported(Node node, String name) {
        Optional<CompilationUnit> cu = node.findCompilationUnit();
        if (cu.isEmpty()) {
            return false;
        }
        for (ImportDeclaration imported : cu.get().getImports()) {
            if (imported.isStatic() && (imported.isAsterisk()
                    || imported.getName().getIdentifier().equals(name))) {
                return true;
            }
        }
        return false;
    }

    private static boolean declaredWithin(Node node, List<? extends Node> roots) {
        if (node == null) {
            return false;
        }
        for (Node root : roots) {
            if (node != root && ASTUtility.isWithin(node, root)) {
                return true;
            }
        }
        return false;
    }
}
