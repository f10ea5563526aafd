package com.raditha.extract.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything needed to emit the new method and its call.
 *
 * @param name                    Method name
 * @param accessibility           Access modifier
 * @param staticMethod            Declared static
 * @param typeParameters          Type parameter declarations such as "T extends Number"
 * @param parameters              Parameters in declaration order, holders last
 * @param returnStrategy          How results reach the caller
 * @param valueType               Result type before async or generator wrapping
 * @param returnType              Declared return type
 * @param thrownTypes             Types for the throws clause
 * @param async                   Returns a CompletableFuture awaited by the caller
 * @param generator               Returns the emitted values as a list
 * @param elementType             Element type of emitted values, null unless generator
 * @param outcomes                Distinct outcomes in selector order
 * @param components              Values returned directly
 * @param carried                 Variables that flow back to the call site
 * @param enclosingReturnType     Type returned by returns inside the selection, "void" if none
 * @param nativeReturn            Every path returns, so the body keeps its own returns
 * @param aggregateName           Name of the generated result record, null when not needed
 * @param aggregateTypeParameters Type parameters the result record declares
 * @param awaitCall               Callee text wrapped around async invocations
 * @param emitCall                Callee text used to re-emit generated values
 * @param warnings                Warnings raised while inferring the signature
 */
public record ExtractedSignature(
        String name,
        Accessibility accessibility,
        boolean staticMethod,
        List<String> typeParameters,
        List<ParameterSpec> parameters,
        ReturnStrategy returnStrategy,
        String valueType,
        String returnType,
        List<String> thrownTypes,
        boolean async,
        boolean generator,
        String elementType,
        List<ExitOutcome> outcomes,
        List<ResultComponent> components,
        List<CarriedVariable> carried,
        String enclosingReturnType,
        boolean nativeReturn,
        String aggregateName,
        List<String> aggregateTypeParameters,
        String awaitCall,
        String emitCall,
        List<Warning> warnings) {

    public ExtractedSignature {
        typeParameters = List.copyOf(typeParameters);
        parameters = List.copyOf(parameters);
        thrownTypes = List.copyOf(thrownTypes);
        outcomes = List.copyOf(outcomes);
        components = List.copyOf(components);
        carried = List.copyOf(carried);
        aggregateTypeParameters = List.copyOf(aggregateTypeParameters);
        warnings = List.copyOf(warnings);
    }

    public Optional<ResultComponent> selector() {
        return component(ResultComponent.Kind.SELECTOR);
    }

    public Optional<ResultComponent> value() {
        return component(ResultComponent.Kind.VALUE);
    }

    public boolean hasAggregate() {
        return aggregateName != null;
    }

    public boolean isVoid() {
        return "void".equals(valueType);
    }

    /**
     * Exits inside the body must be rewritten when more than fallthrough is possible.
     */
    public boolean needsExitRewriting() {
        return !nativeReturn && outcomes.stream().anyMatch(o -> !o.isFallthrough());
    }

    public List<CarriedVariable> holders() {
        return carried.stream().filter(CarriedVariable::viaHolder).toList();
    }

    private Optional<ResultComponent> component(ResultComponent.Kind kind) {
        return components.stream().filter(c -> c.kind() == kind).findFirst();
    }
}
