package com.raditha.extract.model;

/**
 * Summary flags describing the generated method.
 */
public record MethodCharacteristics(
        boolean async,
        boolean staticMethod,
        boolean generator,
        boolean multipleExits,
        boolean earlyExit,
        boolean capturesVariables,
        boolean containsSuspensionPoint,
        boolean containsGeneratorPoint,
        int parameterCount) {

    public static MethodCharacteristics of(ExtractedSignature signature, ControlFlowSummary flow) {
        return new MethodCharacteristics(
                signature.async(),
                signature.staticMethod(),
                signature.generator(),
                flow.hasMultipleExits(),
                flow.hasEarlyExit(),
                !signature.parameters().isEmpty(),
                flow.containsSuspensionPoint(),
                flow.containsGeneratorPoint(),
                signature.parameters().size());
    }
}
