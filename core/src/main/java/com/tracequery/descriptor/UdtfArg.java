package com.tracequery.descriptor;

import com.tracequery.types.DataType;
import com.tracequery.types.SemanticType;

import java.util.Objects;

/**
 * A named argument of a table function.
 */
public record UdtfArg(String name, DataType argType, SemanticType semanticType) {

    public UdtfArg {
        name = Objects.requireNonNull(name, "name");
        argType = Objects.requireNonNull(argType, "argType");
        semanticType = semanticType == null ? SemanticType.ST_UNSPECIFIED : semanticType;
    }
}
