package com.tracequery.descriptor;

/**
 * Kind of a resolvable function: a scalar UDF or an aggregate.
 */
public enum UdfExecType {
    SCALAR_UDF,
    UDA
}
