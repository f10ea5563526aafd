package com.raditha.extract.model;

/**
 * How control can leave a selection.
 */
public enum ExitKind {
    FALLTHROUGH,          // completes normally into the following code
    EXPLICIT_RETURN,      // return from the enclosing method or lambda
    LOOP_EXIT,            // break or continue whose target lies outside the selection
    PROPAGATED_EXCEPTION  // throw that nothing inside the selection catches
}
