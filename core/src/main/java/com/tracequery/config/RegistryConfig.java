package com.tracequery.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for building a function registry.
 *
 * <p>Values come from system properties via {@link #fromSystemProperties()}, or are set
 * programmatically with the {@code with*} methods:
 * <ul>
 *   <li>{@value #PROP_DUPLICATE_POLICY}: {@code reject} (default) or {@code replace}</li>
 *   <li>{@value #PROP_DESCRIPTOR}: file path, or {@code classpath:} resource, of a JSON
 *       descriptor set</li>
 * </ul>
 *
 * <p>Instances are immutable.
 */
public final class RegistryConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegistryConfig.class);

    /** System property for the duplicate registration policy */
    public static final String PROP_DUPLICATE_POLICY = "tracequery.registry.duplicatePolicy";

    /** System property for the descriptor set location */
    public static final String PROP_DESCRIPTOR = "tracequery.registry.descriptor";

    /** Prefix marking a descriptor location as a classpath resource */
    public static final String CLASSPATH_PREFIX = "classpath:";

    private static final RegistryConfig DEFAULTS = new RegistryConfig(DuplicatePolicy.REJECT, null);

    private final DuplicatePolicy duplicatePolicy;
    private final String descriptorLocation;

    private RegistryConfig(DuplicatePolicy duplicatePolicy, String descriptorLocation) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        this.descriptorLocation = descriptorLocation;
    }

    public static RegistryConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads configuration from system properties.
     *
     * <p>An unparseable duplicate policy falls back to the default with a warning.
     *
     * @return the configuration
     */
    public static RegistryConfig fromSystemProperties() {
        return new RegistryConfig(getConfiguredDuplicatePolicy(), getConfiguredDescriptorLocation());
    }

    public DuplicatePolicy duplicatePolicy() {
        return duplicatePolicy;
    }

    /**
     * Returns where the descriptor set is loaded from, if configured.
     */
    public Optional<String> descriptorLocation() {
        return Optional.ofNullable(descriptorLocation);
    }

    public RegistryConfig withDuplicatePolicy(DuplicatePolicy policy) {
        return new RegistryConfig(policy, descriptorLocation);
    }

    public RegistryConfig withDescriptorLocation(String location) {
        return new RegistryConfig(duplicatePolicy, location);
    }

    @Override
    public String toString() {
        return "RegistryConfig(duplicatePolicy=" + duplicatePolicy
            + ", descriptorLocation=" + descriptorLocation + ")";
    }

    private static DuplicatePolicy getConfiguredDuplicatePolicy() {
        String value = System.getProperty(PROP_DUPLICATE_POLICY);
        if (value != null) {
            try {
                return DuplicatePolicy.parse(value);
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}={}: {}", PROP_DUPLICATE_POLICY, value, e.getMessage());
            }
        }
        return DuplicatePolicy.REJECT;
    }

    private static String getConfiguredDescriptorLocation() {
        String value = System.getProperty(PROP_DESCRIPTOR);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
