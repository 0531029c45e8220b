package com.tracequery.descriptor;

import com.tracequery.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * A UDA overload: reduces the values of a group to one finalized value.
 *
 * <p>{@code supportsPartial} marks aggregates whose state can be computed on the data
 * nodes and merged later.
 */
public record UdaSpec(
    String name,
    List<DataType> updateArgTypes,
    DataType finalizeType,
    boolean supportsPartial)
    implements FunctionSignature {

    public UdaSpec {
        name = Objects.requireNonNull(name, "name");
        updateArgTypes = List.copyOf(updateArgTypes == null ? List.of() : updateArgTypes);
        finalizeType = Objects.requireNonNull(finalizeType, "finalizeType");
    }

    public UdaSpec(String name, List<DataType> updateArgTypes, DataType finalizeType) {
        this(name, updateArgTypes, finalizeType, false);
    }

    @Override
    public List<DataType> argTypes() {
        return updateArgTypes;
    }

    @Override
    public DataType resultType() {
        return finalizeType;
    }
}
