package com.tracequery.descriptor;

import com.tracequery.types.Relation;

import java.util.List;
import java.util.Objects;

/**
 * A table function: named arguments, a placement hint and the relation it produces.
 *
 * <p>Stored as registered; argument checking for table functions happens elsewhere.
 */
public record UdtfSpec(
    String name,
    List<UdtfArg> args,
    UdtfExecutor executor,
    Relation relation) {

    public UdtfSpec {
        name = Objects.requireNonNull(name, "name");
        args = List.copyOf(args == null ? List.of() : args);
        executor = executor == null ? UdtfExecutor.UDTF_UNSPECIFIED : executor;
        relation = relation == null ? Relation.EMPTY : relation;
    }
}
