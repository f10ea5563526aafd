package com.raditha.extract.model;

/**
 * How a local variable crosses the boundary of the extracted method.
 * Listed in precedence order.
 */
public enum VariableRole {
    BY_REFERENCE, // flows in, is written, and is read afterwards
    OUTPUT_ONLY,  // written and read afterwards without flowing in
    BY_VALUE,     // flows in only
    LOCAL         // lives entirely inside the selection
}
