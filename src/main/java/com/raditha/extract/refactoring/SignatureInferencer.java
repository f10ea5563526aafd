package com.raditha.extract.refactoring;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.ReferenceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import com.github.javaparser.ast.type.UnionType;
import com.raditha.extract.analysis.InstanceStateAnalyzer;
import com.raditha.extract.analysis.TypeResolver;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.config.MultiValueStrategy;
import com.raditha.extract.model.Accessibility;
import com.raditha.extract.model.CarriedVariable;
import com.raditha.extract.model.ControlFlowSummary;
import com.raditha.extract.model.DataFlowSummary;
import com.raditha.extract.model.ErrorKind;
import com.raditha.extract.model.ExitKind;
import com.raditha.extract.model.ExitOutcome;
import com.raditha.extract.model.ExitPoint;
import com.raditha.extract.model.ExtractedSignature;
import com.raditha.extract.model.ExtractionException;
import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.NormalizedSelection;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.ResultComponent;
import com.raditha.extract.model.ReturnStrategy;
import com.raditha.extract.model.SelectionMode;
import com.raditha.extract.model.VariableFlowFact;
import com.raditha.extract.model.Warning;
import com.raditha.extract.util.ASTUtility;
import com.raditha.extract.util.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides the shape of the extracted method: name, parameters, result components,
 * modifiers, type parameters and thrown exceptions.
 */
public class SignatureInferencer {
    private static final Logger logger = LoggerFactory.getLogger(SignatureInferencer.class);

    static final String HOLDER_TYPE = "java.util.concurrent.atomic.AtomicReference";
    static final String FUTURE_TYPE = "java.util.concurrent.CompletableFuture";
    static final String LIST_TYPE = "java.util.List";

    private final TypeResolver types;
    private final InstanceStateAnalyzer instanceState;
    private final SourceParser parser;
    private final NameAllocator names;
    private final ExtractionConfig config;

    public SignatureInferencer(TypeResolver types, InstanceStateAnalyzer instanceState, SourceParser parser,
            NameAllocator names, ExtractionConfig config) {
        this.types = types;
        this.instanceState = instanceState;
        this.parser = parser;
        this.names = names;
        this.config = config;
    }

    /**
     * Infer the signature for a validated and analyzed selection.
     *
     * @throws ExtractionException when the selection cannot be expressed as a method
     */
    public ExtractedSignature infer(NormalizedSelection selection, ControlFlowSummary flow, DataFlowSummary data,
            ExtractionRequest request) {
        List<Warning> warnings = new ArrayList<>();
        Node enclosingType = selection.enclosingType();

        boolean async = flow.containsSuspensionPoint();
        boolean generator = flow.containsGeneratorPoint();
        checkCombination(selection, flow, data, async, generator);

        String name = chooseName(selection, data, request);

        List<ExitOutcome> outcomes = outcomes(selection, flow);
        String enclosingReturnType = enclosingReturnType(selection, flow);
        boolean nativeReturn = selection.mode() == SelectionMode.STATEMENTS
                && outcomes.size() == 1 && outcomes.get(0).kind() == ExitOutcome.Kind.RETURN;

        List<VariableFlowFact> carriedFacts = nativeReturn ? List.of() : data.carried();
        if (nativeReturn && !data.carried().isEmpty()) {
            warnings.add(Warning.of(Warning.UNREACHABLE_OUTPUTS,
                    "Every path returns, so assignments to " + String.join(", ", data.readAfter())
                            + " are never observed after the selection", selection.range().startLine()));
        }
        checkDeclarableTypes(data, enclosingType);

        List<ResultComponent> components = new ArrayList<>();
        String valueType;
        if (selection.mode() == SelectionMode.EXPRESSION) {
            valueType = expressionType(selection.expression(), enclosingType, warnings);
            components.add(new ResultComponent(names.fresh("value"), valueType, ResultComponent.Kind.VALUE, null));
        } else {
            if (!nativeReturn && outcomes.size() > 1) {
                String selectorType = outcomes.size() == 2 ? "boolean" : "int";
                components.add(new ResultComponent(names.fresh("exit"), selectorType,
                        ResultComponent.Kind.SELECTOR, null));
            }
            if (outcomes.stream().anyMatch(o -> o.kind() == ExitOutcome.Kind.RETURN)
                    && !"void".equals(enclosingReturnType)) {
                components.add(new ResultComponent(names.fresh("value"), enclosingReturnType,
                        ResultComponent.Kind.VALUE, null));
            }
            valueType = null;
        }

        boolean holdersWanted = config.multiValueStrategy() == MultiValueStrategy.OUT_PARAMS
                && components.size() + carriedFacts.size() > 1;
        List<CarriedVariable> carried = new ArrayList<>();
        for (VariableFlowFact fact : carriedFacts) {
            boolean viaHolder = holdersWanted && (!components.isEmpty() || !carried.isEmpty());
            String holder = viaHolder ? names.fresh(fact.name() + "Ref") : null;
            carried.add(new CarriedVariable(fact.name(), fact.type(), fact.role(), fact.declaredInside(),
                    holder, fact.finalDeclaration()));
            if (!viaHolder) {
                components.add(new ResultComponent(fact.name(), fact.type(), ResultComponent.Kind.VARIABLE,
                        fact.name()));
            }
        }

        String aggregateName = null;
        List<String> aggregateTypeParameters = List.of();
        if (components.size() > 1) {
            aggregateName = names.fresh(SemanticNameAnalyzer.capitalize(name) + "Result");
        }

        if (valueType == null) {
            if (components.isEmpty()) {
                valueType = "void";
            } else if (components.size() == 1) {
                valueType = components.get(0).type();
            }
        }

        String elementType = generator ? elementType(flow, enclosingType) : null;
        if (generator) {
            warnings.add(Warning.of(Warning.GENERATOR_EAGER,
                    "Emitted values are collected into a list before the caller re-emits them",
                    selection.range().startLine()));
        }

        List<ParameterSpec> parameters = parameters(data, carried);

        ReturnStrategy strategy;
        if (carried.stream().anyMatch(CarriedVariable::viaHolder)) {
            strategy = ReturnStrategy.OUT_PARAMS;
        } else if (components.isEmpty()) {
            strategy = ReturnStrategy.NONE;
        } else if (components.size() == 1) {
            strategy = ReturnStrategy.SINGLE;
        } else {
            strategy = ReturnStrategy.AGGREGATE;
        }

        Set<String> usedTypeNames = new LinkedHashSet<>();
        parameters.forEach(p -> usedTypeNames.addAll(typeNames(p.type())));
        components.forEach(c -> usedTypeNames.addAll(typeNames(c.type())));
        if (elementType != null) {
            usedTypeNames.addAll(typeNames(elementType));
        }
        for (Node node : selection.nodes()) {
            node.findAll(ClassOrInterfaceType.class).forEach(t -> usedTypeNames.add(t.getNameAsString()));
        }

        List<TypeParameter> classTypeParameters = classTypeParameters(selection);
        boolean usesClassTypeVariables = classTypeParameters.stream()
                .anyMatch(tp -> usedTypeNames.contains(tp.getNameAsString()));
        boolean staticMethod = decideStatic(selection, request, usesClassTypeVariables);

        List<String> typeParameters = render(closure(methodTypeParameters(selection), usedTypeNames));
        if (aggregateName != null) {
            Set<String> componentTypeNames = new LinkedHashSet<>();
            components.forEach(c -> componentTypeNames.addAll(typeNames(c.type())));
            List<TypeParameter> visible = new ArrayList<>(methodTypeParameters(selection));
            visible.addAll(classTypeParameters);
            aggregateTypeParameters = render(closure(visible, componentTypeNames));
        }

        Accessibility accessibility = accessibility(request, enclosingType, warnings);
        List<String> thrownTypes = thrownTypes(selection);

        if (aggregateName != null) {
            valueType = parameterized(aggregateName, aggregateTypeParameters);
        }
        String resultType = valueType;
        String returnType;
        if (generator) {
            returnType = LIST_TYPE + "<" + TypeResolver.box(elementType) + ">";
        } else if (async) {
            returnType = FUTURE_TYPE + "<" + TypeResolver.box(resultType) + ">";
        } else {
            returnType = resultType;
        }

        if (parameters.size() > config.maxParametersWarning()) {
            warnings.add(Warning.of(Warning.MANY_PARAMETERS,
                    "The extracted method takes " + parameters.size() + " parameters; consider a parameter object",
                    selection.range().startLine()));
        }

        ExtractedSignature signature = new ExtractedSignature(name, accessibility, staticMethod, typeParameters,
                parameters, strategy, valueType, returnType, thrownTypes, async, generator, elementType, outcomes,
                components, carried, enclosingReturnType, nativeReturn, aggregateName, aggregateTypeParameters,
                callee(flow.suspensionPoints()), callee(flow.generatorPoints()), warnings);
        logger.debug("Inferred {} {}({}) with strategy {} and {} outcome(s)", returnType, name,
                parameters.stream().map(ParameterSpec::toParameterDeclaration).toList(), strategy, outcomes.size());
        return signature;
    }

    private void checkCombination(NormalizedSelection selection, ControlFlowSummary flow, DataFlowSummary data,
            boolean async, boolean generator) {
        if (!generator) {
            return;
        }
        if (async) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "The selection both awaits and emits values");
        }
        if (selection.mode() == SelectionMode.EXPRESSION) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "An expression that emits values cannot be extracted on its own");
        }
        if (!flow.jumps().isEmpty()) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "The selection emits values and also leaves early at line " + flow.jumps().get(0).line());
        }
        if (!data.carried().isEmpty()) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "The selection emits values and also assigns " + String.join(", ", data.readAfter()));
        }
        for (MethodCallExpr emit : flow.generatorPoints()) {
            if (!(emit.getParentNode().orElse(null) instanceof ExpressionStmt) || emit.getArguments().size() != 1) {
                throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                        "Only emit calls used as statements with one argument can be collected, line "
                                + ASTUtility.line(emit));
            }
        }
    }

    private String chooseName(NormalizedSelection selection, DataFlowSummary data, ExtractionRequest request) {
        String explicit = request.explicitName();
        Node enclosingType = selection.enclosingType();
        if (explicit != null) {
            if (!SourceVersion.isName(explicit) || explicit.contains(".")) {
                throw new ExtractionException(ErrorKind.INVALID_NAME,
                        "'" + explicit + "' is not a valid Java method name");
            }
            if (MethodNameGenerator.existingMethodNames(enclosingType).contains(explicit)) {
                throw new ExtractionException(ErrorKind.NAME_COLLISION,
                        "A method named '" + explicit + "' already exists in " + typeName(enclosingType));
            }
            names.reserve(explicit);
            return explicit;
        }
        List<VariableFlowFact> carried = data.carried();
        String returned = carried.size() == 1 ? carried.get(0).name() : null;
        String generated = new MethodNameGenerator(config).generateName(selection.nodes(), enclosingType, returned);
        names.reserve(generated);
        return generated;
    }

    /**
     * Distinct outcomes: fallthrough, then return, then jumps in source order.
     */
    private static List<ExitOutcome> outcomes(NormalizedSelection selection, ControlFlowSummary flow) {
        List<ExitOutcome> outcomes = new ArrayList<>();
        if (flow.canCompleteNormally()) {
            outcomes.add(new ExitOutcome(outcomes.size(), ExitOutcome.Kind.FALLTHROUGH, null, null));
        }
        if (!flow.exitsOf(ExitKind.EXPLICIT_RETURN).isEmpty()) {
            outcomes.add(new ExitOutcome(outcomes.size(), ExitOutcome.Kind.RETURN, null, null));
        }
        List<ExitPoint> jumps = new ArrayList<>();
        for (ExitPoint exit : flow.exitsOf(ExitKind.LOOP_EXIT)) {
            boolean seen = jumps.stream().anyMatch(j -> j.target() == exit.target()
                    && jumpText(j.statement()).equals(jumpText(exit.statement())));
            if (!seen) {
                jumps.add(exit);
            }
        }
        for (ExitPoint exit : jumps) {
            outcomes.add(new ExitOutcome(outcomes.size(), ExitOutcome.Kind.JUMP, jumpText(exit.statement()),
                    exit.target()));
        }
        return outcomes;
    }

    /**
     * The jump as the call site re-executes it, without attached comments.
     */
    static String jumpText(Statement jump) {
        if (jump instanceof BreakStmt breakStmt) {
            return breakStmt.getLabel().map(l -> "break " + l.asString() + ";").orElse("break;");
        }
        ContinueStmt continueStmt = (ContinueStmt) jump;
        return continueStmt.getLabel().map(l -> "continue " + l.asString() + ";").orElse("continue;");
    }

    /**
     * Type returned by returns inside the selection.
     */
    private String enclosingReturnType(NormalizedSelection selection, ControlFlowSummary flow) {
        Node callable = selection.callable();
        if (callable instanceof MethodDeclaration method) {
            return method.getType().asString();
        }
        if (!(callable instanceof LambdaExpr)) {
            return "void";
        }
        List<ExitPoint> returns = flow.exitsOf(ExitKind.EXPLICIT_RETURN).stream()
                .filter(ExitPoint::carriesValue)
                .toList();
        if (returns.isEmpty()) {
            return "void";
        }
        String agreed = null;
        for (ExitPoint exit : returns) {
            Expression value = ((ReturnStmt) exit.statement()).getExpression().orElseThrow();
            Optional<String> type = types.typeOf(value).filter(t -> !"null".equals(t));
            if (type.isEmpty()) {
                continue;
            }
            if (agreed == null) {
                agreed = type.get();
            } else if (!TypeResolver.box(agreed).equals(TypeResolver.box(type.get()))) {
                throw new ExtractionException(ErrorKind.TYPE_MISMATCH_ON_RETURN,
                        "The selection returns both " + agreed + " and " + type.get());
            }
        }
        if (agreed == null || !types.isExpressible(agreed, selection.enclosingType())) {
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    "Cannot determine the type returned from the lambda at line " + returns.get(0).line());
        }
        return agreed;
    }

    private String expressionType(Expression expression, Node enclosingType, List<Warning> warnings) {
        String type = types.typeOf(expression).orElse(null);
        if (type == null || "void".equals(type) || !types.isExpressible(type, enclosingType)) {
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    "Cannot express the type of '" + expression + "'" + (type == null ? "" : ": " + type));
        }
        if (types.isGuessed(expression)) {
            warnings.add(Warning.of(Warning.TYPE_UNRESOLVED,
                    "The type " + type + " of the selected expression was inferred from its syntax",
                    ASTUtility.line(expression)));
        }
        return type;
    }

    private String elementType(ControlFlowSummary flow, Node enclosingType) {
        String agreed = null;
        for (MethodCallExpr emit : flow.generatorPoints()) {
            String type = types.typeOf(emit.getArgument(0)).orElse(null);
            if (type == null || "null".equals(type)) {
                continue;
            }
            if (agreed == null) {
                agreed = type;
            } else if (!TypeResolver.box(agreed).equals(TypeResolver.box(type))) {
                throw new ExtractionException(ErrorKind.TYPE_MISMATCH_ON_RETURN,
                        "The selection emits both " + agreed + " and " + type);
            }
        }
        if (agreed == null || !types.isExpressible(agreed, enclosingType)) {
            throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                    "Cannot determine the type of the emitted values");
        }
        return agreed;
    }

    /**
     * Every variable the new method declares or receives needs a type that can be written down.
     */
    private void checkDeclarableTypes(DataFlowSummary data, Node enclosingType) {
        for (VariableFlowFact fact : data.facts()) {
            if (fact.declaredInside() && !fact.isCarried()) {
                continue;
            }
            if (fact.type() == null || !types.isExpressible(fact.type(), enclosingType)) {
                throw new ExtractionException(ErrorKind.INTERNAL_ANALYSIS_FAILURE,
                        "Cannot express the type of '" + fact.name() + "'"
                                + (fact.type() == null ? "" : ": " + fact.type()));
            }
        }
    }

    private static List<ParameterSpec> parameters(DataFlowSummary data, List<CarriedVariable> carried) {
        List<ParameterSpec> parameters = new ArrayList<>();
        Set<String> viaHolder = new LinkedHashSet<>();
        carried.stream().filter(CarriedVariable::viaHolder).forEach(c -> viaHolder.add(c.name()));
        for (VariableFlowFact fact : data.parameters()) {
            if (!viaHolder.contains(fact.name())) {
                parameters.add(ParameterSpec.of(fact.name(), fact.type(), fact.role()));
            }
        }
        for (CarriedVariable variable : carried) {
            if (variable.viaHolder()) {
                parameters.add(new ParameterSpec(variable.holderName(),
                        HOLDER_TYPE + "<" + TypeResolver.box(variable.type()) + ">",
                        variable.role(), variable.name(), true));
            }
        }
        return parameters;
    }

    private boolean decideStatic(NormalizedSelection selection, ExtractionRequest request,
            boolean usesClassTypeVariables) {
        boolean staticContext = InstanceStateAnalyzer.isStaticContext(selection.member());
        boolean usesInstance = !staticContext
                && instanceState.referencesInstanceState(selection.nodes(), selection.enclosingType());
        boolean needsInstance = usesInstance || usesClassTypeVariables && !staticContext;
        boolean mustBeStatic = staticContext || isConstructorArgument(selection);

        if (mustBeStatic && needsInstance) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "Arguments of this(...) or super(...) cannot use the instance being constructed");
        }
        Boolean requested = request.makeStatic();
        if (Boolean.TRUE.equals(requested) && needsInstance) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "The selection uses instance state, so the method cannot be static");
        }
        if (Boolean.FALSE.equals(requested) && mustBeStatic) {
            throw new ExtractionException(ErrorKind.UNSUPPORTED_COMBINATION,
                    "The selection runs without an instance, so the method must be static");
        }
        if (requested != null) {
            return requested;
        }
        return !needsInstance;
    }

    private static boolean isConstructorArgument(NormalizedSelection selection) {
        Node current = selection.first().getParentNode().orElse(null);
        while (current != null && current != selection.callable()) {
            if (current instanceof ExplicitConstructorInvocationStmt) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private static List<TypeParameter> methodTypeParameters(NormalizedSelection selection) {
        if (selection.member() instanceof CallableDeclaration<?> callable) {
            return callable.getTypeParameters();
        }
        return List.of();
    }

    /**
     * Type parameters of the enclosing types that are in scope for instance members.
     */
    private static List<TypeParameter> classTypeParameters(NormalizedSelection selection) {
        List<TypeParameter> result = new ArrayList<>();
        for (Node type : ASTUtility.enclosingTypes(selection.member())) {
            if (type instanceof NodeWithTypeParameters<?> generic) {
                result.addAll(generic.getTypeParameters());
            }
            if (type instanceof TypeDeclaration<?> declaration && isImplicitlyStatic(declaration)) {
                break;
            }
        }
        return result;
    }

    private static boolean isImplicitlyStatic(TypeDeclaration<?> declaration) {
        if (declaration.hasModifier(Modifier.Keyword.STATIC)) {
            return true;
        }
        return !(declaration instanceof ClassOrInterfaceDeclaration type) || type.isInterface();
    }

    /**
     * The used type parameters plus those their bounds mention, in declaration order.
     */
    private static List<TypeParameter> closure(List<TypeParameter> declared, Set<String> used) {
        Set<String> needed = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (TypeParameter parameter : declared) {
                String parameterName = parameter.getNameAsString();
                if ((used.contains(parameterName) || needed.contains(parameterName)) && needed.add(parameterName)) {
                    changed = true;
                }
                if (needed.contains(parameterName)) {
                    for (ClassOrInterfaceType bound : parameter.getTypeBound()) {
                        for (ClassOrInterfaceType part : bound.findAll(ClassOrInterfaceType.class)) {
                            if (needed.add(part.getNameAsString()) && isDeclared(declared, part.getNameAsString())) {
                                changed = true;
                            }
                        }
                    }
                }
            }
        }
        return declared.stream().filter(p -> needed.contains(p.getNameAsString())).toList();
    }

    private static boolean isDeclared(List<TypeParameter> declared, String name) {
        return declared.stream().anyMatch(p -> p.getNameAsString().equals(name));
    }

    private static List<String> render(List<TypeParameter> parameters) {
        return parameters.stream().map(TypeParameter::toString).toList();
    }

    private Set<String> typeNames(String type) {
        Set<String> result = new LinkedHashSet<>();
        if (type == null) {
            return result;
        }
        parser.tryParseType(type).ifPresent(parsed -> {
            if (parsed instanceof ClassOrInterfaceType root) {
                result.add(root.getNameAsString());
            }
            parsed.findAll(ClassOrInterfaceType.class).forEach(t -> result.add(t.getNameAsString()));
        });
        return result;
    }

    private Accessibility accessibility(ExtractionRequest request, Node enclosingType, List<Warning> warnings) {
        Accessibility requested = request.accessibility() != null
                ? request.accessibility()
                : config.defaultAccessibility();
        if (enclosingType instanceof ClassOrInterfaceDeclaration type && type.isInterface()
                && requested != Accessibility.PRIVATE) {
            warnings.add(Warning.of(Warning.ACCESSIBILITY_ADJUSTED,
                    "Helper methods in interface " + type.getNameAsString() + " are private"));
            return Accessibility.PRIVATE;
        }
        return requested;
    }

    /**
     * The enclosing callable's throws clause plus the types caught around the selection.
     */
    private static List<String> thrownTypes(NormalizedSelection selection) {
        Set<String> thrown = new LinkedHashSet<>();
        if (selection.callable() instanceof CallableDeclaration<?> callable) {
            for (ReferenceType type : callable.getThrownExceptions()) {
                thrown.add(type.asString());
            }
        }
        Node child = selection.first();
        Node current = child.getParentNode().orElse(null);
        while (current != null && current != selection.callable()) {
            if (current instanceof TryStmt tryStmt && child == tryStmt.getTryBlock()) {
                for (CatchClause clause : tryStmt.getCatchClauses()) {
                    Type caught = clause.getParameter().getType();
                    List<Type> alternatives = caught instanceof UnionType union
                            ? new ArrayList<>(union.getElements())
                            : List.of(caught);
                    alternatives.forEach(t -> thrown.add(t.asString()));
                }
            }
            child = current;
            current = current.getParentNode().orElse(null);
        }
        return new ArrayList<>(thrown);
    }

    private static String callee(List<MethodCallExpr> calls) {
        if (calls.isEmpty()) {
            return null;
        }
        MethodCallExpr call = calls.get(0);
        return call.getScope().map(s -> s + ".").orElse("") + call.getNameAsString();
    }

    /**
     * "PairResult" with parameters "T extends Number" becomes "PairResult<T>".
     */
    static String parameterized(String name, List<String> typeParameters) {
        if (typeParameters.isEmpty()) {
            return name;
        }
        List<String> parameterNames = typeParameters.stream()
                .map(p -> p.split("\\s+")[0])
                .toList();
        return name + "<" + String.join(", ", parameterNames) + ">";
    }

    private static String typeName(Node type) {
        if (type instanceof TypeDeclaration<?> declaration) {
            return declaration.getNameAsString();
        }
        return "the anonymous class";
    }
}
