package com.tracequery.descriptor;

/**
 * Where a scalar UDF is allowed to run.
 *
 * <ul>
 *   <li>{@code UDF_ALL} - any node (default)</li>
 *   <li>{@code UDF_PEM} - only on the per-host collectors, close to the data</li>
 *   <li>{@code UDF_KELVIN} - only on the aggregating nodes</li>
 * </ul>
 */
public enum UdfSourceExecutor {
    UDF_ALL,
    UDF_PEM,
    UDF_KELVIN
}
