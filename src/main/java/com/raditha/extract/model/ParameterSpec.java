package com.raditha.extract.model;

/**
 * A parameter of the generated method.
 *
 * @param name     Parameter name
 * @param type     Java type for the parameter
 * @param role     Data flow role of the variable it carries
 * @param variable Local variable at the call site that supplies or receives the value
 * @param holder   True when the parameter is an AtomicReference holder
 */
public record ParameterSpec(
        String name,
        String type,
        VariableRole role,
        String variable,
        boolean holder) {

    public static ParameterSpec of(String name, String type, VariableRole role) {
        return new ParameterSpec(name, type, role, name, false);
    }

    /**
     * Format as method parameter declaration.
     * Example: "String userId"
     */
    public String toParameterDeclaration() {
        return type + " " + name;
    }
}
