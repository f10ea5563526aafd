package com.raditha.extract.model;

/**
 * One value the generated method returns directly.
 *
 * @param name     Component name, used for the record component and for the local in the body
 * @param type     Java type
 * @param kind     What the component carries
 * @param variable Local variable carried, null for selector and value components
 */
public record ResultComponent(String name, String type, Kind kind, String variable) {

    public enum Kind {
        SELECTOR, // which outcome was taken
        VALUE,    // value of a return from the enclosing method
        VARIABLE  // a carried local
    }

    /**
     * The local inside the generated method holding this component.
     */
    public String localName() {
        return kind == Kind.VARIABLE ? variable : name;
    }
}
