package com.raditha.extract.model;

/**
 * Reasons an extraction request can fail.
 * Each kind carries a suggestion that is reported alongside the failure.
 */
public enum ErrorKind {
    EMPTY_SELECTION("Select one or more complete statements, or a single expression, inside a method body"),
    INCOMPLETE_SELECTION("Extend the selection so that it covers complete statements"),
    MULTIPLE_ENTRY_POINTS("Select statements that belong to a single case group"),
    UNSUPPORTED_JUMP_CONSTRUCT("Keep case labels and jump targets entirely inside or outside the selection"),
    TYPE_MISMATCH_ON_RETURN("Make every value leaving the selection share one type"),
    NAME_COLLISION("Choose a name that no other method of the enclosing type uses"),
    INVALID_NAME("Use a valid Java identifier for the method name"),
    UNSUPPORTED_COMBINATION("Split the selection so each part can be extracted on its own"),
    STALE_SNAPSHOT("The document changed while the extraction ran; run it again"),
    CANCELLED("The request was cancelled before it completed"),
    INTERNAL_ANALYSIS_FAILURE("Report the selection and source so the analysis can be fixed");

    private final String suggestion;

    ErrorKind(String suggestion) {
        this.suggestion = suggestion;
    }

    public String suggestion() {
        return suggestion;
    }

    /**
     * Only a stale snapshot can succeed when the same request is repeated.
     */
    public boolean isRetryable() {
        return this == STALE_SNAPSHOT;
    }
}
