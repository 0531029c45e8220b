package com.tracequery.descriptor;

import com.tracequery.types.SemanticType;

import java.util.List;
import java.util.Objects;

/**
 * Semantic type inference rule for one function.
 *
 * <p>{@code argTypes} is the pattern matched against a call's argument semantic types;
 * {@link SemanticType#ST_UNSPECIFIED} at a position matches anything there.
 * {@code udfExecType} says which kind of function the rule is written for.
 */
public record SemanticTypeRule(
    String name,
    UdfExecType udfExecType,
    List<SemanticType> argTypes,
    SemanticType outputType) {

    public SemanticTypeRule {
        name = Objects.requireNonNull(name, "name");
        udfExecType = Objects.requireNonNull(udfExecType, "udfExecType");
        argTypes = List.copyOf(argTypes == null ? List.of() : argTypes);
        outputType = Objects.requireNonNull(outputType, "outputType");
    }
}
