package com.raditha.extract.refactoring;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.extract.analysis.TypeResolver;
import com.raditha.extract.config.ExitNormalization;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.model.CarriedVariable;
import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.DataFlowSummary;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExitKind;
import com.raditha.extract.model.ExitOutcome;
import com.raditha.extract.model.ExitPoint;
import com.raditha.extract.model.ExtractedSignature;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.ResultComponent;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.model.VariableFlowFact;
import com.raditha.extract.model.VariableRole;
import com.raditha.extract.source.SourceSnapshot;
import com.raditha.extract.util.ASTUtility;
import com.raditha.extract.util.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rewrites the selected code into the body of the new method.
 *
 * Works on a private re-parse of the snapshot so that the analyzed tree is never mutated.
 * Nodes of the analyzed tree are matched to their copies by node class and source range.
 */
public class MethodBodyTransformer {
    private static final Logger logger = LoggerFactory.getLogger(MethodBodyTransformer.class);

    private final SourceParser parser;
    private final NameAllocator names;
    private final ExtractionConfig config;

    public MethodBodyTransformer(SourceParser parser, NameAllocator names, ExtractionConfig config) {
        this.parser = parser;
        this.names = names;
        this.config = config;
    }

    /**
     * Produce the method body for a signature.
     *
     * @throws ExtractionException UNSUPPORTED_COMBINATION when a variable captured by a lambda
     *                             would have to be assigned twice
     */
    public TransformedBody transform(SourceSnapshot snapshot, NormalizedSelection selection,
            ControlFlowSummary flow, DataFlowSummary data, ExtractedSignature signature) {
        CompilationUnit copy = parser.parseCompilationUnit(snapshot.text());
        TransformedBody body = selection.mode() == SelectionMode.EXPRESSION
                ? expressionBody(copy, selection, signature)
                : new Rewrite(copy, selection, flow, data, signature).run();
        logger.debug("Transformed body of {} into {} statement(s)", signature.name(), body.statements().size());
        return body;
    }

    private TransformedBody expressionBody(CompilationUnit copy, NormalizedSelection selection,
            ExtractedSignature signature) {
        Expression expression = locate(copy, selection.expression());
        return new TransformedBody(List.of(returnStatement(expression.toString(), signature)), false);
    }

    /**
     * A return of {@code value} (null for none), wrapped in a completed future for async methods.
     */
    static String returnStatement(String value, ExtractedSignature signature) {
        if (signature.async()) {
            return "return " + SignatureInferencer.FUTURE_TYPE + ".completedFuture("
                    + (value == null ? "null" : value) + ");";
        }
        return value == null ? "return;" : "return " + value + ";";
    }

    static <T extends Node> T locate(CompilationUnit copy, T original) {
        @SuppressWarnings("unchecked")
        Class<T> type = (Class<T>) original.getClass();
        return copy.findFirst(type, n -> n.getClass() == type && n.getRange().equals(original.getRange()))
                .orElseThrow(() -> new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                        "Lost track of '" + original + "' while rewriting the selection"));
    }

    /**
     * Statement mode rewrite of one selection.
     */
    private final class Rewrite {
        private final CompilationUnit copy;
        private final NormalizedSelection selection;
        private final ControlFlowSummary flow;
        private final DataFlowSummary data;
        private final ExtractedSignature signature;
        private final boolean labeledBlock;
        private final boolean rewriteExits;
        private final List<Statement> topLevel = new ArrayList<>();
        private final Set<VariableDeclarator> hoisted = ASTUtility.identitySet();

        Rewrite(CompilationUnit copy, NormalizedSelection selection, ControlFlowSummary flow, DataFlowSummary data,
                ExtractedSignature signature) {
            this.copy = copy;
            this.selection = selection;
            this.flow = flow;
            this.data = data;
            this.signature = signature;
            this.rewriteExits = signature.needsExitRewriting();
            this.labeledBlock = rewriteExits && config.exitNormalization() == ExitNormalization.LABELED_BLOCK;
        }

        TransformedBody run() {
            for (Statement statement : selection.statements()) {
                topLevel.add(locate(copy, statement));
            }
            List<String> prologue = prologue();
            String label = labeledBlock ? names.fresh("body") : null;
            String emitted = signature.generator() ? names.fresh("emitted") : null;
            if (emitted != null) {
                prologue.add("java.util.List<" + TypeResolver.box(signature.elementType()) + "> " + emitted
                        + " = new java.util.ArrayList<>();");
                collectEmits(emitted);
            }
            rewriteExits(label);

            List<String> statements = new ArrayList<>(prologue);
            List<String> selected = selectedStatements();
            if (label != null) {
                statements.add(label + ": {\n" + indent(String.join("\n", selected)) + "\n}");
            } else {
                statements.addAll(selected);
            }

            boolean tailReachable = label != null || flow.canCompleteNormally();
            if (tailReachable && !signature.nativeReturn()) {
                statements.addAll(holderWrites());
                if (emitted != null) {
                    statements.add("return " + emitted + ";");
                } else if (!signature.components().isEmpty() || signature.async()) {
                    statements.add(returnStatement(result(-1, null), signature));
                }
            }
            return new TransformedBody(statements, label != null);
        }

        /**
         * Declarations the body needs before the selected code runs.
         */
        private List<String> prologue() {
            List<String> lines = new ArrayList<>();
            Map<String, CarriedVariable> carried = signature.carried().stream()
                    .collect(Collectors.toMap(CarriedVariable::name, c -> c));

            for (CarriedVariable variable : signature.holders()) {
                if (variable.declaredInside()) {
                    continue;
                }
                if (variable.role() == VariableRole.BY_REFERENCE) {
                    lines.add(variable.type() + " " + variable.name() + " = " + variable.holderName() + ".get();");
                } else {
                    lines.add(declaration(data.fact(variable.name()), rewriteExits));
                }
            }
            for (VariableFlowFact fact : data.facts()) {
                if (fact.declaredInside() || fact.isParameter() || isHolder(carried.get(fact.name()))) {
                    continue;
                }
                lines.add(declaration(fact, rewriteExits && fact.isCarried()));
            }
            if (rewriteExits) {
                for (CarriedVariable variable : signature.carried()) {
                    if (variable.declaredInside()) {
                        VariableFlowFact fact = data.fact(variable.name());
                        hoisted.add((VariableDeclarator) locate(copy, fact.declaration()));
                        lines.add(declaration(fact, true));
                    }
                }
            }
            if (labeledBlock) {
                signature.selector().ifPresent(s -> lines.add(s.type() + " " + s.name() + " = "
                        + TypeResolver.defaultValue(s.type()) + ";"));
                signature.value().ifPresent(v -> lines.add(v.type() + " " + v.name() + " = "
                        + TypeResolver.defaultValue(v.type()) + ";"));
            }
            return lines;
        }

        private String declaration(VariableFlowFact fact, boolean initialized) {
            if (!initialized) {
                return fact.type() + " " + fact.name() + ";";
            }
            if (fact.capturedInside()) {
                throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                        "'" + fact.name() + "' is captured by a lambda and would be assigned twice after rewriting exits");
            }
            return fact.type() + " " + fact.name() + " = " + TypeResolver.defaultValue(fact.type()) + ";";
        }

        private boolean isHolder(CarriedVariable variable) {
            return variable != null && variable.viaHolder();
        }

        private void collectEmits(String emitted) {
            List<MethodCallExpr> calls = new ArrayList<>();
            for (MethodCallExpr emit : flow.generatorPoints()) {
                calls.add(locate(copy, emit));
            }
            for (MethodCallExpr call : calls) {
                call.setScope(new NameExpr(emitted));
                call.setName("add");
            }
        }

        private void rewriteExits(String label) {
            if (!rewriteExits && !(signature.async() && signature.nativeReturn())) {
                return;
            }
            Map<Statement, String> replacements = new IdentityHashMap<>();
            for (ExitPoint exit : flow.jumps()) {
                Statement target = locate(copy, exit.statement());
                String value = null;
                if (target instanceof ReturnStmt returnStmt) {
                    value = returnStmt.getExpression().map(Expression::toString).orElse(null);
                }
                if (signature.nativeReturn()) {
                    replacements.put(target, returnStatement(value, signature));
                } else {
                    ExitOutcome outcome = outcomeOf(exit);
                    replacements.put(target, label != null
                            ? breakOut(outcome, value, label)
                            : returnInPlace(outcome, value));
                }
            }
            replacements.forEach((original, text) -> {
                Statement replacement = parser.parseStatement(text);
                int index = ASTUtility.indexOf(topLevel, original);
                if (index < 0 && replacement instanceof BlockStmt block
                        && original.getParentNode().orElse(null) instanceof BlockStmt parent) {
                    splice(parent, original, block);
                    return;
                }
                original.replace(replacement);
                if (index >= 0) {
                    topLevel.set(index, replacement);
                }
            });
        }

        /**
         * Put the statements of a replacement block directly into the enclosing block.
         */
        private void splice(BlockStmt parent, Statement original, BlockStmt block) {
            NodeList<Statement> statements = parent.getStatements();
            int at = ASTUtility.indexOf(statements, original);
            statements.remove(at);
            for (Statement statement : block.getStatements()) {
                statements.add(at++, statement.clone());
            }
        }

        private ExitOutcome outcomeOf(ExitPoint exit) {
            for (ExitOutcome outcome : signature.outcomes()) {
                if (exit.kind() == ExitKind.EXPLICIT_RETURN && outcome.kind() == ExitOutcome.Kind.RETURN) {
                    return outcome;
                }
                if (exit.kind() == ExitKind.LOOP_EXIT && outcome.kind() == ExitOutcome.Kind.JUMP
                        && outcome.target() == exit.target()
                        && outcome.jumpStatement().equals(SignatureInferencer.jumpText(exit.statement()))) {
                    return outcome;
                }
            }
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    "No outcome for the exit at line " + exit.line());
        }

        private String breakOut(ExitOutcome outcome, String value, String label) {
            StringBuilder block = new StringBuilder("{ ");
            signature.selector().ifPresent(s -> block.append(s.name()).append(" = ")
                    .append(selectorLiteral(s, outcome.index())).append("; "));
            if (value != null) {
                block.append(signature.value().orElseThrow().name()).append(" = ").append(value).append("; ");
            }
            return block.append("break ").append(label).append("; }").toString();
        }

        private String returnInPlace(ExitOutcome outcome, String value) {
            List<String> statements = new ArrayList<>(holderWrites());
            statements.add(returnStatement(result(outcome.index(), value), signature));
            return "{ " + String.join(" ", statements) + " }";
        }

        /**
         * Result expression for an outcome. In labeled-block form (outcome -1) the selector
         * and value are read from their locals.
         */
        private String result(int outcome, String value) {
            List<String> parts = new ArrayList<>();
            for (ResultComponent component : signature.components()) {
                parts.add(switch (component.kind()) {
                    case SELECTOR -> outcome < 0 && labeledBlock
                            ? component.name()
                            : selectorLiteral(component, Math.max(outcome, 0));
                    case VALUE -> outcome < 0 && labeledBlock
                            ? component.name()
                            : value != null ? value : TypeResolver.defaultValue(component.type());
                    case VARIABLE -> component.variable();
                });
            }
            if (parts.isEmpty()) {
                return null;
            }
            if (!signature.hasAggregate()) {
                return parts.get(0);
            }
            String diamond = signature.aggregateTypeParameters().isEmpty() ? "" : "<>";
            return "new " + signature.aggregateName() + diamond + "(" + String.join(", ", parts) + ")";
        }

        private String selectorLiteral(ResultComponent selector, int index) {
            if ("boolean".equals(selector.type())) {
                return index == 1 ? "true" : "false";
            }
            return Integer.toString(index);
        }

        private List<String> holderWrites() {
            List<String> writes = new ArrayList<>();
            for (CarriedVariable variable : signature.holders()) {
                writes.add(variable.holderName() + ".set(" + variable.name() + ");");
            }
            return writes;
        }

        private List<String> selectedStatements() {
            List<String> texts = new ArrayList<>();
            for (Statement statement : topLevel) {
                if (statement instanceof ExpressionStmt expressionStmt
                        && expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration
                        && declaration.getVariables().stream().anyMatch(hoisted::contains)) {
                    texts.addAll(split(declaration));
                } else {
                    texts.add(statement.toString());
                }
            }
            return texts;
        }

        /**
         * Turn hoisted declarators into assignments, keeping the others as declarations.
         */
        private List<String> split(VariableDeclarationExpr declaration) {
            List<String> texts = new ArrayList<>();
            String modifiers = declaration.getModifiers().stream()
                    .map(m -> m.getKeyword().asString() + " ")
                    .collect(Collectors.joining());
            String annotations = declaration.getAnnotations().stream()
                    .map(a -> a + " ")
                    .collect(Collectors.joining());
            for (VariableDeclarator declarator : declaration.getVariables()) {
                if (!hoisted.contains(declarator)) {
                    String initializer = declarator.getInitializer().map(i -> " = " + i).orElse("");
                    texts.add(annotations + modifiers + declarator.getType() + " "
                            + declarator.getNameAsString() + initializer + ";");
                    continue;
                }
                declarator.getInitializer().ifPresent(initializer -> {
                    String value = initializer instanceof ArrayInitializerExpr
                            ? "new " + declarator.getType() + initializer
                            : initializer.toString();
                    texts.add(declarator.getNameAsString() + " = " + value + ";");
                });
            }
            return texts;
        }
    }

    static String indent(String text) {
        return text.lines().map(l -> l.isEmpty() ? l : "    " + l).collect(Collectors.joining("\n"));
    }
}
