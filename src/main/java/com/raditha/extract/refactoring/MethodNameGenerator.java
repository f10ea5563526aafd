package com.raditha.extract.refactoring;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.util.ASTUtility;

import javax.lang.model.SourceVersion;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the name of the extracted method when the request does not supply one.
 * Falls back through: semantic name, "get" plus the single returned variable,
 * the configured default name.
 */
public class MethodNameGenerator {

    private final SemanticNameAnalyzer semanticAnalyzer = new SemanticNameAnalyzer();
    private final ExtractionConfig config;

    public MethodNameGenerator(ExtractionConfig config) {
        this.config = config;
    }

    /**
     * Generate a name that no method of the enclosing type uses yet.
     *
     * @param nodes                  the selected code
     * @param enclosingType          type receiving the method
     * @param inferredReturnVariable the single carried variable, or null
     */
    public String generateName(List<? extends Node> nodes, Node enclosingType, String inferredReturnVariable) {
        if (config.generateNames()) {
            String name = semanticAnalyzer.generateName(nodes);
            if (name != null) {
                return ensureUnique(name, enclosingType);
            }
            if (inferredReturnVariable != null && !inferredReturnVariable.isEmpty()) {
                return ensureUnique("get" + SemanticNameAnalyzer.capitalize(inferredReturnVariable), enclosingType);
            }
        }
        return ensureUnique(config.defaultMethodName(), enclosingType);
    }

    /**
     * Append a number until the name is unique among the type's methods.
     */
    String ensureUnique(String baseName, Node enclosingType) {
        Set<String> existingNames = existingMethodNames(enclosingType);
        if (!existingNames.contains(baseName) && !SourceVersion.isKeyword(baseName)) {
            return baseName;
        }
        int suffix = 1;
        String uniqueName;
        do {
            uniqueName = baseName + suffix;
            suffix++;
        } while (existingNames.contains(uniqueName));
        return uniqueName;
    }

    static Set<String> existingMethodNames(Node enclosingType) {
        Set<String> names = new HashSet<>();
        if (enclosingType == null) {
            return names;
        }
        for (BodyDeclaration<?> member : ASTUtility.membersOf(enclosingType)) {
            if (member instanceof MethodDeclaration method) {
                names.add(method.getNameAsString());
            }
        }
        return names;
    }
}
