package com.raditha.extract.refactoring;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.util.SourceParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks generated text before anything is applied: every fragment and the edited
 * file must parse, and the file must end up with exactly one method of the new name.
 */
public class GeneratedCodeVerifier {

    private final SourceParser parser;

    public GeneratedCodeVerifier(SourceParser parser) {
        this.parser = parser;
    }

    public VerificationResult verify(GeneratedCode code, String callSite, SelectionMode mode, String modifiedSource,
            String methodName) {
        List<ValidationIssue> issues = new ArrayList<>();

        if (!parses(() -> parser.parseBodyDeclaration(code.method()))) {
            issues.add(ValidationIssue.error("Generated method does not parse:\n" + code.method()));
        }
        if (code.hasAggregate() && !parses(() -> parser.parseBodyDeclaration(code.aggregate()))) {
            issues.add(ValidationIssue.error("Generated result record does not parse:\n" + code.aggregate()));
        }
        boolean callParses = mode == SelectionMode.EXPRESSION
                ? parses(() -> parser.parseExpression(callSite))
                : parses(() -> parser.parseBlock("{\n" + callSite + "\n}"));
        if (!callParses) {
            issues.add(ValidationIssue.error("Call site does not parse:\n" + callSite));
        }

        ParseResult<CompilationUnit> modified = parser.tryParseCompilationUnit(modifiedSource);
        if (!modified.isSuccessful() || modified.getResult().isEmpty()) {
            issues.add(ValidationIssue.error("Modified source does not parse:\n" + modifiedSource));
        } else {
            long declared = modified.getResult().get().findAll(MethodDeclaration.class).stream()
                    .filter(m -> m.getNameAsString().equals(methodName))
                    .count();
            if (declared == 0) {
                issues.add(ValidationIssue.error("Method '" + methodName + "' is missing from the modified source"));
            } else if (declared > 1) {
                issues.add(ValidationIssue.warning("'" + methodName + "' is declared " + declared
                        + " times in the file, in different types"));
            }
        }
        return new VerificationResult(issues);
    }

    private static boolean parses(Runnable parse) {
        try {
            parse.run();
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Result of verification.
     */
    public record VerificationResult(List<ValidationIssue> issues) {
        public boolean isValid() {
            return issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        }

        public List<String> getErrors() {
            return issues.stream()
                    .filter(i -> i.severity() == Severity.ERROR)
                    .map(ValidationIssue::message)
                    .toList();
        }

        public List<String> getWarnings() {
            return issues.stream()
                    .filter(i -> i.severity() == Severity.WARNING)
                    .map(ValidationIssue::message)
                    .toList();
        }
    }

    /**
     * A single verification issue.
     */
    public record ValidationIssue(Severity severity, String message) {
        public static ValidationIssue error(String message) {
            return new ValidationIssue(Severity.ERROR, message);
        }

        public static ValidationIssue warning(String message) {
            return new ValidationIssue(Severity.WARNING, message);
        }
    }

    /**
     * Severity of verification issue.
     */
    public enum Severity {
        ERROR, // Blocks the extraction
        WARNING // Reported, extraction proceeds
    }
}
