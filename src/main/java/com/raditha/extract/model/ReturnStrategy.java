package com.raditha.extract.model;

/**
 * How the generated method hands results back to its caller.
 */
public enum ReturnStrategy {
    NONE,       // void
    SINGLE,     // one value returned directly
    AGGREGATE,  // several values packed into a generated record
    OUT_PARAMS  // values written into holder parameters
}
