package com.raditha.extract.model;

/**
 * A local whose value must come back to the call site.
 *
 * @param name             Variable name
 * @param type             Declared type
 * @param role             BY_REFERENCE or OUTPUT_ONLY
 * @param declaredInside   Declared by a top-level statement of the selection
 * @param holderName       Holder parameter name, null when returned directly
 * @param finalDeclaration Declared final in the original code
 */
public record CarriedVariable(
        String name,
        String type,
        VariableRole role,
        boolean declaredInside,
        String holderName,
        boolean finalDeclaration) {

    public boolean viaHolder() {
        return holderName != null;
    }
}
