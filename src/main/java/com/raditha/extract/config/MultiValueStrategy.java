package com.raditha.extract.config;

/**
 * How several values leaving the selection are returned.
 */
public enum MultiValueStrategy {
    AGGREGATE,  // generated record
    OUT_PARAMS  // AtomicReference holder parameters for all variables but one
}
