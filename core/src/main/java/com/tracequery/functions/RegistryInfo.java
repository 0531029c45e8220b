package com.tracequery.functions;

import com.tracequery.config.RegistryConfig;
import com.tracequery.descriptor.ScalarUdfSpec;
import com.tracequery.descriptor.SemanticTypeRule;
import com.tracequery.descriptor.UdaSpec;
import com.tracequery.descriptor.UdfExecType;
import com.tracequery.descriptor.UdfInfo;
import com.tracequery.descriptor.UdfInfoValidator;
import com.tracequery.descriptor.UdfSourceExecutor;
import com.tracequery.descriptor.UdtfSpec;
import com.tracequery.exception.FunctionNotFoundException;
import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.exception.SignatureMismatchException;
import com.tracequery.types.DataType;
import com.tracequery.types.SemanticType;
import com.tracequery.types.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Function registry consulted by the planner while type-checking call sites.
 *
 * <p>Holds one {@link OverloadTable} for scalar UDFs, one for UDAs, a
 * {@link SemanticRuleRegistry} and the table functions, all built from a
 * {@link UdfInfo} descriptor set by {@link #init(UdfInfo)}.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #init(UdfInfo)} is called exactly once; a second call fails</li>
 *   <li>every query before {@code init} fails with {@link IllegalStateException}</li>
 *   <li>after {@code init} the registry is read-only and safe to query from any number
 *       of threads without locking</li>
 * </ul>
 *
 * <p>Each compiler instance owns its registry; there is no shared global instance.
 *
 * <p>Example usage:
 * <pre>
 *   RegistryInfo registry = RegistryInfo.create(UdfInfoParser.parse(json));
 *   ValueType type = registry.resolveUdfType("add",
 *       List.of(ValueType.create(Float64Type.get(), SemanticType.ST_BYTES),
 *               ValueType.create(Float64Type.get(), SemanticType.ST_BYTES)));
 * </pre>
 */
public final class RegistryInfo {
    private static final Logger logger = LoggerFactory.getLogger(RegistryInfo.class);

    private final RegistryConfig config;

    /** Published once by init; null until then */
    private volatile State state;

    public RegistryInfo() {
        this(RegistryConfig.defaults());
    }

    public RegistryInfo(RegistryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Creates a registry with default configuration and initializes it.
     *
     * @param info the descriptor set
     * @return the initialized registry
     * @throws InvalidDescriptorException if the descriptor set is invalid
     */
    public static RegistryInfo create(UdfInfo info) {
        return create(info, RegistryConfig.defaults());
    }

    public static RegistryInfo create(UdfInfo info, RegistryConfig config) {
        RegistryInfo registry = new RegistryInfo(config);
        registry.init(info);
        return registry;
    }

    /**
     * Loads a descriptor set into this registry.
     *
     * @param info the descriptor set
     * @throws InvalidDescriptorException if the descriptor set fails validation
     * @throws IllegalStateException if the registry is already initialized
     */
    public synchronized void init(UdfInfo info) {
        Objects.requireNonNull(info, "info");
        if (state != null) {
            throw new IllegalStateException("RegistryInfo is already initialized");
        }

        List<String> errors = UdfInfoValidator.validate(info, config.duplicatePolicy());
        if (!errors.isEmpty()) {
            throw new InvalidDescriptorException("Descriptor set failed validation", errors);
        }

        OverloadTable<ScalarUdfSpec> udfs = new OverloadTable<>("scalar UDF", config.duplicatePolicy());
        info.scalarUdfs().forEach(udfs::register);

        OverloadTable<UdaSpec> udas = new OverloadTable<>("UDA", config.duplicatePolicy());
        info.udas().forEach(udas::register);

        SemanticRuleRegistry semanticRules = new SemanticRuleRegistry(config.duplicatePolicy());
        for (SemanticTypeRule rule : info.semanticTypeRules()) {
            semanticRules.insert(rule.name(), rule.argTypes(), rule.outputType());
        }

        udfs.freeze();
        udas.freeze();
        semanticRules.freeze();

        Set<String> names = new LinkedHashSet<>(udfs.names());
        names.addAll(udas.names());

        state = new State(info, udfs, udas, semanticRules, Collections.unmodifiableSet(names));
        logger.info("Function registry initialized: {} scalar UDF overloads, {} UDA overloads, "
                + "{} UDTFs, {} semantic type rules",
            udfs.size(), udas.size(), info.udtfs().size(), semanticRules.size());
    }

    public boolean isInitialized() {
        return state != null;
    }

    /**
     * Returns whether a name is a scalar UDF or a UDA.
     *
     * @param name the function name
     * @return the function kind
     * @throws FunctionNotFoundException if the name is in neither table
     */
    public UdfExecType getUdfExecType(String name) {
        State s = requireState();
        if (s.udfs.contains(name)) {
            return UdfExecType.SCALAR_UDF;
        }
        if (s.udas.contains(name)) {
            return UdfExecType.UDA;
        }
        throw new FunctionNotFoundException(name);
    }

    /**
     * Resolves the return type of a scalar UDF call.
     *
     * @param name the function name
     * @param argTypes the argument types of the call
     * @return the return type of the exactly matching overload
     * @throws FunctionNotFoundException if no scalar UDF has the name
     * @throws SignatureMismatchException if no overload matches exactly
     */
    public DataType getUdfDataType(String name, List<DataType> argTypes) {
        return requireState().udfs.resolve(name, argTypes);
    }

    /**
     * Resolves the finalize type of a UDA call.
     *
     * @param name the aggregate name
     * @param updateArgTypes the argument types of the call
     * @return the finalize type of the exactly matching overload
     * @throws FunctionNotFoundException if no UDA has the name
     * @throws SignatureMismatchException if no overload matches exactly
     */
    public DataType getUdaDataType(String name, List<DataType> updateArgTypes) {
        return requireState().udas.resolve(name, updateArgTypes);
    }

    /**
     * Resolves the full value type of a call: physical type from the overload tables,
     * semantic type from the semantic rules.
     *
     * <p>The name is looked up among scalar UDFs first, then UDAs. If the physical types
     * do not resolve the call fails and no semantic inference happens. If no semantic rule
     * matches, the result's semantic type is {@link SemanticType#ST_UNSPECIFIED}.
     *
     * @param name the function name
     * @param args the value types of the call's arguments
     * @return the resolved value type
     * @throws FunctionNotFoundException if the name is neither a scalar UDF nor a UDA
     * @throws SignatureMismatchException if no overload matches exactly
     */
    public ValueType resolveUdfType(String name, List<ValueType> args) {
        State s = requireState();
        List<DataType> dataTypes = args.stream().map(ValueType::dataType).toList();

        DataType dataType;
        if (s.udfs.contains(name)) {
            dataType = s.udfs.resolve(name, dataTypes);
        } else if (s.udas.contains(name)) {
            dataType = s.udas.resolve(name, dataTypes);
        } else {
            throw new FunctionNotFoundException(name);
        }

        List<SemanticType> semanticTypes = args.stream().map(ValueType::semanticType).toList();
        SemanticType semanticType = s.semanticRules.find(name, semanticTypes)
            .orElse(SemanticType.ST_UNSPECIFIED);

        ValueType result = ValueType.create(dataType, semanticType);
        logger.debug("Resolved {}{} to {}", name, args, result);
        return result;
    }

    /**
     * Returns where a scalar UDF overload may run.
     *
     * @throws FunctionNotFoundException if no scalar UDF has the name
     * @throws SignatureMismatchException if no overload matches exactly
     */
    public UdfSourceExecutor getUdfSourceExecutor(String name, List<DataType> argTypes) {
        return requireState().udfs.resolveSignature(name, argTypes).executor();
    }

    /**
     * Returns whether a UDA overload supports partial aggregation.
     *
     * @throws FunctionNotFoundException if no UDA has the name
     * @throws SignatureMismatchException if no overload matches exactly
     */
    public boolean doesUdaSupportPartial(String name, List<DataType> updateArgTypes) {
        return requireState().udas.resolveSignature(name, updateArgTypes).supportsPartial();
    }

    /**
     * Returns the names of every scalar UDF and UDA. Table functions are not included.
     *
     * @return an unmodifiable set of names
     */
    public Set<String> funcNames() {
        return requireState().funcNames;
    }

    /**
     * Returns the table functions in registration order.
     */
    public List<UdtfSpec> udtfs() {
        return requireState().info.udtfs();
    }

    /**
     * Looks up a table function by name.
     *
     * @param name the table function name
     * @return the table function, or empty if not registered
     */
    public Optional<UdtfSpec> getUdtf(String name) {
        return requireState().info.udtfs().stream()
            .filter(udtf -> udtf.name().equals(name))
            .findFirst();
    }

    /**
     * Returns the descriptor set this registry was built from.
     */
    public UdfInfo descriptor() {
        return requireState().info;
    }

    /**
     * Returns the semantic rule registry, which rejects further inserts.
     */
    public SemanticRuleRegistry semanticRules() {
        return requireState().semanticRules;
    }

    public RegistryConfig config() {
        return config;
    }

    private State requireState() {
        State s = state;
        if (s == null) {
            throw new IllegalStateException("RegistryInfo has not been initialized");
        }
        return s;
    }

    private record State(
        UdfInfo info,
        OverloadTable<ScalarUdfSpec> udfs,
        OverloadTable<UdaSpec> udas,
        SemanticRuleRegistry semanticRules,
        Set<String> funcNames) {}
}
