package com.raditha.extract.config;

/**
 * How early exits inside the extracted body are rewritten.
 */
public enum ExitNormalization {
    LABELED_BLOCK,   // break out of a labeled block and return once at the end
    RETURN_IN_PLACE  // return the complete result at every exit
}
