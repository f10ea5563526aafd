package com.raditha.extract.model;

/**
 * A non-fatal finding attached to a successful extraction.
 *
 * @param code    Stable identifier such as BOUNDARY_EXPANDED
 * @param message Human readable description
 * @param line    Source line the warning refers to, 0 when not tied to a line
 */
public record Warning(String code, String message, int line) {

    public static final String BOUNDARY_EXPANDED = "BOUNDARY_EXPANDED";
    public static final String CASE_LABEL_EXCLUDED = "CASE_LABEL_EXCLUDED";
    public static final String MANY_PARAMETERS = "MANY_PARAMETERS";
    public static final String GENERATOR_EAGER = "GENERATOR_EAGER";
    public static final String UNREACHABLE_OUTPUTS = "UNREACHABLE_OUTPUTS";
    public static final String ACCESSIBILITY_ADJUSTED = "ACCESSIBILITY_ADJUSTED";
    public static final String TYPE_UNRESOLVED = "TYPE_UNRESOLVED";

    public static Warning of(String code, String message, int line) {
        return new Warning(code, message, line);
    }

    public static Warning of(String code, String message) {
        return new Warning(code, message, 0);
    }
}
