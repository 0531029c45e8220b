package com.tracequery.descriptor;

import com.tracequery.types.DataType;

import java.util.List;

/**
 * One concrete overload of a function: a name, exact argument types and a result type.
 *
 * @see ScalarUdfSpec
 * @see UdaSpec
 */
public interface FunctionSignature {

    String name();

    /**
     * Argument types, in call order.
     */
    List<DataType> argTypes();

    DataType resultType();

    /**
     * Whether this signature takes exactly the given argument types.
     *
     * @param queryTypes the argument types of a call
     * @return true on an element-wise match of equal arity
     */
    default boolean matches(List<DataType> queryTypes) {
        return argTypes().equals(queryTypes);
    }
}
