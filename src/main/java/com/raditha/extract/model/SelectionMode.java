package com.raditha.extract.model;

/**
 * Granularity of a normalized selection.
 */
public enum SelectionMode {
    STATEMENTS, // contiguous sibling statements
    EXPRESSION  // exactly one expression
}
