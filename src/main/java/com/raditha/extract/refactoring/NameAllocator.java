package com.raditha.extract.refactoring;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.SimpleName;

import javax.lang.model.SourceVersion;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out identifiers that clash with nothing already written in a type.
 * Every identifier in the type counts as taken, which keeps generated locals,
 * labels, holders and records clear of fields, locals and labels alike.
 */
public class NameAllocator {

    private final Set<String> taken = new HashSet<>();

    public NameAllocator(Node enclosingType) {
        Node root = enclosingType;
        while (root.getParentNode().isPresent()) {
            root = root.getParentNode().get();
        }
        // type names are visible across the file, other names only inside the type
        for (SimpleName name : root.findAll(SimpleName.class)) {
            if (Character.isUpperCase(name.getIdentifier().charAt(0))) {
                taken.add(name.getIdentifier());
            }
        }
        for (SimpleName name : enclosingType.findAll(SimpleName.class)) {
            taken.add(name.getIdentifier());
        }
    }

    /**
     * Reserve and return {@code base}, or base1, base2 and so on when it is taken.
     */
    public String fresh(String base) {
        String candidate = base;
        int suffix = 1;
        while (taken.contains(candidate) || SourceVersion.isKeyword(candidate)) {
            candidate = base + suffix;
            suffix++;
        }
        taken.add(candidate);
        return candidate;
    }

    public void reserve(String name) {
        taken.add(name);
    }

    public boolean isTaken(String name) {
        return taken.contains(name);
    }
}
