package com.raditha.extract.refactoring;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives a method name from the code being extracted.
 * Verbs come from the names of called methods, objects from called method
 * suffixes and from declared types and variables.
 */
public class SemanticNameAnalyzer {

    private static final List<String> COMMON_VERBS = List.of(
            "get", "set", "create", "update", "delete", "save", "load",
            "validate", "check", "process", "calculate", "compute",
            "build", "generate", "parse", "format", "convert",
            "find", "search", "filter", "sort", "add", "remove",
            "read", "write", "send", "print", "log", "init", "apply");

    private static final Set<String> NOISE_WORDS = Set.of(
            "the", "a", "an", "this", "that", "for", "to", "from", "with", "by", "all", "of");

    private static final Set<String> TOO_GENERIC = Set.of("get", "set", "process", "apply", "log");

    /**
     * Attempt to generate a semantic name from code analysis.
     * Returns null if unable to generate meaningful name.
     */
    public String generateName(List<? extends Node> nodes) {
        List<String> verbs = new ArrayList<>();
        List<String> objects = new ArrayList<>();

        for (Node node : nodes) {
            extractVerbsAndObjects(node, verbs, objects);
        }
        return buildMethodName(verbs, objects);
    }

    private void extractVerbsAndObjects(Node node, List<String> verbs, List<String> objects) {
        List<MethodCallExpr> calls = new ArrayList<>(node.findAll(MethodCallExpr.class));
        if (node instanceof MethodCallExpr call && !calls.contains(call)) {
            calls.add(0, call);
        }
        for (MethodCallExpr call : calls) {
            String methodName = call.getNameAsString();
            for (String verb : COMMON_VERBS) {
                if (!methodName.toLowerCase(Locale.ROOT).startsWith(verb)) {
                    continue;
                }
                if (!verbs.contains(verb)) {
                    verbs.add(verb);
                }
                // "setName" -> "Name"
                String remainder = methodName.substring(verb.length());
                if (!remainder.isEmpty() && Character.isUpperCase(remainder.charAt(0))) {
                    addObject(objects, remainder);
                }
                break;
            }
        }

        for (VariableDeclarationExpr declaration : node.findAll(VariableDeclarationExpr.class)) {
            declaration.getVariables().forEach(v -> {
                // prefer the type name over the variable name (User vs user)
                String type = v.getType().isClassOrInterfaceType()
                        ? v.getType().asClassOrInterfaceType().getNameAsString()
                        : null;
                if (!addObject(objects, type)) {
                    addObject(objects, v.getNameAsString());
                }
            });
        }
    }

    private boolean addObject(List<String> objects, String candidate) {
        String object = extractObjectName(candidate);
        if (object == null || objects.contains(object) || isNoiseWord(object)) {
            return false;
        }
        objects.add(object);
        return true;
    }

    private String extractObjectName(String str) {
        if (str == null || str.isEmpty()) {
            return null;
        }
        String stripped = str.replaceAll("(?i)(dto|entity|model|bean|vo|request|response)$", "");
        if (stripped.isEmpty() || !Character.isLetter(stripped.charAt(0))) {
            return null;
        }
        return capitalize(stripped);
    }

    private boolean isNoiseWord(String word) {
        return NOISE_WORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    private String buildMethodName(List<String> verbs, List<String> objects) {
        if (verbs.isEmpty()) {
            return null;
        }

        StringBuilder name = new StringBuilder(verbs.get(0));
        if (!objects.isEmpty()) {
            name.append(capitalize(objects.get(0)));
        }
        if (objects.size() > 1 && name.length() < 15) {
            name.append("And").append(capitalize(objects.get(1)));
        }

        String result = name.toString();
        if (!SourceVersion.isName(result) || result.length() > 40 || TOO_GENERIC.contains(result)) {
            return null;
        }
        return result;
    }

    static String capitalize(String str) {
        if (str == null || str.isEmpty()) {
            return str;
        }
        return Character.toUpperCase(str.charAt(0)) + str.substring(1);
    }
}
