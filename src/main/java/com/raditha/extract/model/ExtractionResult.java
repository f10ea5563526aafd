package com.raditha.extract.model;

import java.util.List;

/**
 * Outcome of an extraction request. Failed results carry an error code and detail;
 * successful ones carry the generated text and any warnings.
 */
public record ExtractionResult(
        boolean success,
        String methodName,
        String generatedMethod,
        String callSiteReplacement,
        String returnType,
        List<ParameterSpec> parameters,
        MethodCharacteristics characteristics,
        ExtractionPreview preview,
        Long newVersion,
        List<Warning> warnings,
        ErrorKind errorCode,
        String errorDetail,
        List<String> suggestions) {

    public ExtractionResult {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ExtractionResult failure(ErrorKind kind, String detail) {
        return new ExtractionResult(false, null, null, null, null, List.of(), null, null, null,
                List.of(), kind, detail, List.of(kind.suggestion()));
    }

    public static ExtractionResult failure(ExtractionException e) {
        return failure(e.getKind(), e.getDetail());
    }
}
