package com.raditha.extract.model;

import com.github.javaparser.ast.Node;

/**
 * Data flow facts for one local variable referenced by a selection.
 *
 * @param declaration              Declaring node; identity of the symbol
 * @param name                     Variable name
 * @param type                     Declared or inferred type, null when it cannot be expressed
 * @param declaredInside           Declaration lies inside the selection
 * @param flowsIn                  Value at selection entry can be observed inside
 * @param writtenInside            Assigned somewhere inside the selection
 * @param readAfter                Value can be observed after the selection
 * @param definitelyAssignedBefore Definitely assigned when the selection starts
 * @param capturedInside           Referenced from a lambda or class body inside the selection
 * @param finalDeclaration         Declared with the final modifier
 */
public record VariableFlowFact(
        Node declaration,
        String name,
        String type,
        boolean declaredInside,
        boolean flowsIn,
        boolean writtenInside,
        boolean readAfter,
        boolean definitelyAssignedBefore,
        boolean capturedInside,
        boolean finalDeclaration) {

    public VariableRole role() {
        if (flowsIn && writtenInside && readAfter) {
            return VariableRole.BY_REFERENCE;
        }
        if (writtenInside && readAfter) {
            return VariableRole.OUTPUT_ONLY;
        }
        if (flowsIn) {
            return VariableRole.BY_VALUE;
        }
        return VariableRole.LOCAL;
    }

    /**
     * Carried values must come back to the call site.
     */
    public boolean isCarried() {
        VariableRole role = role();
        return role == VariableRole.BY_REFERENCE || role == VariableRole.OUTPUT_ONLY;
    }

    /**
     * Parameters are needed when the value at entry is observed.
     */
    public boolean isParameter() {
        VariableRole role = role();
        return role == VariableRole.BY_REFERENCE || role == VariableRole.BY_VALUE;
    }
}
