package com.tracequery.descriptor;

import com.tracequery.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * A scalar UDF overload: one output value per input row.
 */
public record ScalarUdfSpec(
    String name,
    List<DataType> execArgTypes,
    DataType returnType,
    UdfSourceExecutor executor)
    implements FunctionSignature {

    public ScalarUdfSpec {
        name = Objects.requireNonNull(name, "name");
        execArgTypes = List.copyOf(execArgTypes == null ? List.of() : execArgTypes);
        returnType = Objects.requireNonNull(returnType, "returnType");
        executor = executor == null ? UdfSourceExecutor.UDF_ALL : executor;
    }

    public ScalarUdfSpec(String name, List<DataType> execArgTypes, DataType returnType) {
        this(name, execArgTypes, returnType, UdfSourceExecutor.UDF_ALL);
    }

    @Override
    public List<DataType> argTypes() {
        return execArgTypes;
    }

    @Override
    public DataType resultType() {
        return returnType;
    }
}
