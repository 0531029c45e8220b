package com.tracequery.config;

import java.util.Locale;

/**
 * What the registry does when a descriptor set registers the same overload or the same
 * semantic rule pattern twice.
 *
 * <ul>
 *   <li>{@code REJECT} (default) - the descriptor set is invalid</li>
 *   <li>{@code REPLACE} - the later registration overwrites the earlier one</li>
 * </ul>
 */
public enum DuplicatePolicy {
    REJECT,
    REPLACE;

    /**
     * Parse a policy string (case-insensitive).
     *
     * @param value "reject" or "replace"; null means the default
     * @return the parsed policy
     * @throws IllegalArgumentException if value is not recognized
     */
    public static DuplicatePolicy parse(String value) {
        if (value == null) {
            return REJECT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "reject"  -> REJECT;
            case "replace" -> REPLACE;
            default -> throw new IllegalArgumentException(
                "Unknown duplicate policy: '%s'. Valid values: reject, replace".formatted(value));
        };
    }
}
