package com.raditha.extract.refactoring;

import com.raditha.extract.analysis.TypeResolver;
import com.raditha.extract.model.CarriedVariable;
import com.raditha.extract.model.ExitOutcome;
import com.raditha.extract.model.ExtractedSignature;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.ResultComponent;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.model.VariableRole;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the code that replaces the selection: holder set-up, the call, binding of the
 * returned values and dispatch on the outcome selector.
 */
public class CallSiteGenerator {

    private final NameAllocator names;

    public CallSiteGenerator(NameAllocator names) {
        this.names = names;
    }

    /**
     * Replacement text for the selection, unindented.
     */
    public String generate(NormalizedSelection selection, ExtractedSignature signature) {
        String invocation = invocation(signature);
        if (selection.mode() == SelectionMode.EXPRESSION) {
            return invocation;
        }
        List<String> lines = statements(signature, invocation);
        if (selection.singleStatementSlot() && lines.size() > 1) {
            return "{\n" + MethodBodyTransformer.indent(String.join("\n", lines)) + "\n}";
        }
        return String.join("\n", lines);
    }

    static String invocation(ExtractedSignature signature) {
        String call = signature.name() + "(" + signature.parameters().stream()
                .map(ParameterSpec::name)
                .collect(Collectors.joining(", ")) + ")";
        return signature.async() ? signature.awaitCall() + "(" + call + ")" : call;
    }

    private List<String> statements(ExtractedSignature signature, String invocation) {
        List<String> lines = new ArrayList<>();
        for (CarriedVariable variable : signature.holders()) {
            String holderType = SignatureInferencer.HOLDER_TYPE + "<" + TypeResolver.box(variable.type()) + ">";
            String initial = variable.role() == VariableRole.BY_REFERENCE && !variable.declaredInside()
                    ? variable.name()
                    : "";
            lines.add(holderType + " " + variable.holderName() + " = new " + SignatureInferencer.HOLDER_TYPE
                    + "<>(" + initial + ");");
        }

        if (signature.generator()) {
            String item = names.fresh("item");
            lines.add("for (" + TypeResolver.box(signature.elementType()) + " " + item + " : " + invocation + ") {\n"
                    + "    " + signature.emitCall() + "(" + item + ");\n}");
            return lines;
        }
        if (signature.nativeReturn()) {
            if (signature.components().isEmpty()) {
                lines.add(invocation + ";");
                lines.add("return;");
            } else {
                lines.add("return " + invocation + ";");
            }
            return lines;
        }

        String selector = null;
        String value = null;
        List<ResultComponent> components = signature.components();
        if (components.isEmpty()) {
            lines.add(invocation + ";");
        } else if (signature.hasAggregate()) {
            String result = names.fresh("result");
            lines.add(signature.valueType() + " " + result + " = " + invocation + ";");
            for (ResultComponent component : components) {
                String access = result + "." + component.name() + "()";
                switch (component.kind()) {
                    case SELECTOR -> selector = access;
                    case VALUE -> value = access;
                    case VARIABLE -> lines.add(assignment(carried(signature, component.variable()), access));
                }
            }
        } else {
            ResultComponent component = components.get(0);
            if (component.kind() == ResultComponent.Kind.VARIABLE) {
                lines.add(assignment(carried(signature, component.variable()), invocation));
            } else if (component.kind() == ResultComponent.Kind.SELECTOR
                    && "boolean".equals(component.type()) && signature.holders().isEmpty()) {
                selector = invocation;
            } else {
                lines.add(component.type() + " " + component.name() + " = " + invocation + ";");
                selector = component.kind() == ResultComponent.Kind.SELECTOR ? component.name() : null;
                value = component.kind() == ResultComponent.Kind.VALUE ? component.name() : null;
            }
        }

        for (CarriedVariable variable : signature.holders()) {
            lines.add(assignment(variable, variable.holderName() + ".get()"));
        }

        List<ExitOutcome> outcomes = signature.outcomes();
        if (outcomes.isEmpty()) {
            // the selection always throws
            lines.add("throw new AssertionError();");
        } else if (selector != null) {
            lines.add(dispatch(signature, selector, value));
        } else if (!outcomes.get(0).isFallthrough()) {
            lines.add(outcomeStatement(signature, outcomes.get(0), value));
        }
        return lines;
    }

    private static CarriedVariable carried(ExtractedSignature signature, String name) {
        return signature.carried().stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    /**
     * Variables declared by the selection are declared again at the call site; others are reassigned.
     */
    private static String assignment(CarriedVariable variable, String source) {
        if (!variable.declaredInside()) {
            return variable.name() + " = " + source + ";";
        }
        return (variable.finalDeclaration() ? "final " : "") + variable.type() + " " + variable.name()
                + " = " + source + ";";
    }

    private static String dispatch(ExtractedSignature signature, String selector, String value) {
        List<ExitOutcome> outcomes = signature.outcomes();
        boolean fallthrough = outcomes.get(0).isFallthrough();
        if (outcomes.size() == 2) {
            String taken = "if (" + selector + ") " + braced(outcomeStatement(signature, outcomes.get(1), value));
            return fallthrough
                    ? taken
                    : taken + " else " + braced(outcomeStatement(signature, outcomes.get(0), value));
        }
        List<ExitOutcome> jumps = outcomes.stream().filter(o -> !o.isFallthrough()).toList();
        StringBuilder chain = new StringBuilder();
        for (int i = 0; i < jumps.size(); i++) {
            ExitOutcome outcome = jumps.get(i);
            String statement = braced(outcomeStatement(signature, outcome, value));
            boolean last = i == jumps.size() - 1;
            if (i > 0) {
                chain.append(" else ");
            }
            if (last && !fallthrough) {
                chain.append(statement);
            } else {
                chain.append("if (").append(selector).append(" == ").append(outcome.index()).append(") ")
                        .append(statement);
            }
        }
        return chain.toString();
    }

    private static String outcomeStatement(ExtractedSignature signature, ExitOutcome outcome, String value) {
        return switch (outcome.kind()) {
            case RETURN -> "void".equals(signature.enclosingReturnType()) || value == null
                    ? "return;"
                    : "return " + value + ";";
            case JUMP -> outcome.jumpStatement();
            case FALLTHROUGH -> "";
        };
    }

    private static String braced(String statement) {
        return "{\n    " + statement + "\n}";
    }
}
