package com.tracequery.config;

import com.tracequery.descriptor.UdfInfo;
import com.tracequery.descriptor.UdfInfoParser;
import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.functions.RegistryInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds an initialized {@link RegistryInfo} from the descriptor set a
 * {@link RegistryConfig} points at.
 *
 * <p>A location starting with {@value RegistryConfig#CLASSPATH_PREFIX} is read from the
 * context class loader; anything else is a file path.
 */
public final class RegistryLoader {
    private static final Logger logger = LoggerFactory.getLogger(RegistryLoader.class);

    private RegistryLoader() {}

    /**
     * Loads the registry described by system properties.
     *
     * @return the initialized registry
     * @see RegistryConfig#fromSystemProperties()
     */
    public static RegistryInfo load() {
        return load(RegistryConfig.fromSystemProperties());
    }

    /**
     * Loads the configured descriptor set and initializes a registry from it.
     *
     * @param config the configuration; its descriptor location must be set
     * @return the initialized registry
     * @throws IllegalStateException if no descriptor location is configured
     * @throws InvalidDescriptorException if the descriptor cannot be read, parsed or validated
     */
    public static RegistryInfo load(RegistryConfig config) {
        Objects.requireNonNull(config, "config");
        String location = config.descriptorLocation().orElseThrow(() -> new IllegalStateException(
            "No descriptor set configured; set " + RegistryConfig.PROP_DESCRIPTOR));

        logger.info("Loading UDF descriptor set from {}", location);
        return RegistryInfo.create(readDescriptor(location), config);
    }

    /**
     * Reads and parses a descriptor set from a file path or classpath resource.
     *
     * @param location the descriptor location
     * @return the parsed descriptor set
     * @throws InvalidDescriptorException if the descriptor cannot be read or parsed
     */
    public static UdfInfo readDescriptor(String location) {
        try {
            if (location.startsWith(RegistryConfig.CLASSPATH_PREFIX)) {
                String resource = location.substring(RegistryConfig.CLASSPATH_PREFIX.length());
                try (InputStream in = openResource(resource)) {
                    return UdfInfoParser.parse(in);
                }
            }
            return UdfInfoParser.parse(Path.of(location));
        } catch (IOException e) {
            throw new InvalidDescriptorException("Failed to read descriptor set from " + location, e);
        }
    }

    private static InputStream openResource(String resource) throws IOException {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RegistryLoader.class.getClassLoader();
        }
        InputStream in = loader.getResourceAsStream(name);
        if (in == null) {
            throw new IOException("Classpath resource not found: " + resource);
        }
        return in;
    }
}
