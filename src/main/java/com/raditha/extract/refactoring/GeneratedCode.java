package com.raditha.extract.refactoring;

/**
 * Declarations to insert after the enclosing member, unindented.
 *
 * @param method    The extracted method
 * @param aggregate The result record, null when the method returns at most one value
 */
public record GeneratedCode(String method, String aggregate) {

    public boolean hasAggregate() {
        return aggregate != null;
    }
}
