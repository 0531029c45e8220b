package com.tracequery.types;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The type of a value flowing through a call: a physical {@link DataType} plus a
 * {@link SemanticType}.
 *
 * <p>Instances are only built through {@link #create(DataType, SemanticType)}, which
 * interns them in a process-wide concurrent cache. Interning is an allocation
 * optimization only: callers must compare with {@link #equals(Object)}.
 */
public final class ValueType {

    private static final ConcurrentMap<Key, ValueType> CACHE = new ConcurrentHashMap<>();

    private final DataType dataType;
    private final SemanticType semanticType;

    private ValueType(DataType dataType, SemanticType semanticType) {
        this.dataType = dataType;
        this.semanticType = semanticType;
    }

    /**
     * Returns the canonical value type for the given pair.
     *
     * @param dataType the physical type
     * @param semanticType the semantic type
     * @return the value type
     * @throws NullPointerException if either argument is null
     */
    public static ValueType create(DataType dataType, SemanticType semanticType) {
        Objects.requireNonNull(dataType, "dataType must not be null");
        Objects.requireNonNull(semanticType, "semanticType must not be null");
        return CACHE.computeIfAbsent(new Key(dataType, semanticType),
            key -> new ValueType(key.dataType(), key.semanticType()));
    }

    /**
     * Returns the value type for a physical type with no semantic information.
     *
     * @param dataType the physical type
     * @return the value type with {@link SemanticType#ST_UNSPECIFIED}
     */
    public static ValueType of(DataType dataType) {
        return create(dataType, SemanticType.ST_UNSPECIFIED);
    }

    public DataType dataType() {
        return dataType;
    }

    public SemanticType semanticType() {
        return semanticType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueType)) return false;
        ValueType that = (ValueType) o;
        return dataType.equals(that.dataType) && semanticType == that.semanticType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, semanticType);
    }

    @Override
    public String toString() {
        return "ValueType(" + dataType + ", " + semanticType + ")";
    }

    private record Key(DataType dataType, SemanticType semanticType) {}
}
