package com.tracequery.descriptor;

/**
 * Placement hint for a table function: which nodes produce its rows.
 */
public enum UdtfExecutor {
    UDTF_UNSPECIFIED,
    UDTF_ALL_AGENTS,
    UDTF_ALL_PEM,
    UDTF_ALL_KELVIN,
    UDTF_SUBSET_PEM,
    UDTF_SUBSET_KELVIN,
    UDTF_ONE_KELVIN
}
