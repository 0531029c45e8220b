package com.tracequery.types;

import java.util.Locale;

/**
 * Domain tag carried alongside a physical {@link DataType}.
 *
 * <p>A semantic type says what a value means (a process id, a pod name, a byte count)
 * rather than how it is stored. {@link #ST_UNSPECIFIED} is both the "unknown" value and
 * the wildcard used in semantic type rule patterns.
 */
public enum SemanticType {
    ST_UNSPECIFIED,
    ST_NONE,
    ST_TIME_NS,
    ST_AGENT_UID,
    ST_ASID,
    ST_UPID,
    ST_SERVICE_NAME,
    ST_POD_NAME,
    ST_POD_PHASE,
    ST_POD_STATUS,
    ST_NODE_NAME,
    ST_CONTAINER_NAME,
    ST_CONTAINER_STATE,
    ST_CONTAINER_STATUS,
    ST_NAMESPACE_NAME,
    ST_BYTES,
    ST_PERCENT,
    ST_DURATION_NS,
    ST_THROUGHPUT_PER_NS,
    ST_THROUGHPUT_BYTES_PER_NS,
    ST_QUANTILES,
    ST_DURATION_NS_QUANTILES,
    ST_IP_ADDRESS,
    ST_PORT,
    ST_HTTP_REQ_METHOD,
    ST_HTTP_RESP_STATUS,
    ST_HTTP_RESP_MESSAGE,
    ST_SCRIPT_REFERENCE;

    private static final String PREFIX = "ST_";

    /**
     * True for the wildcard value, which matches any semantic type in a rule pattern.
     */
    public boolean isWildcard() {
        return this == ST_UNSPECIFIED;
    }

    /**
     * Parses a semantic type name (case-insensitive, with or without the {@code ST_} prefix).
     *
     * @param value e.g. "ST_UPID", "upid" or "pod_name"
     * @return the parsed SemanticType
     * @throws IllegalArgumentException if value is not recognized
     */
    public static SemanticType fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Semantic type name must not be null or empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith(PREFIX)) {
            normalized = PREFIX + normalized;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown semantic type: '%s'".formatted(value), e);
        }
    }
}
