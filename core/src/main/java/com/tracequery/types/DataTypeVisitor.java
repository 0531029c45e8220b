package com.tracequery.types;

/**
 * Exhaustive dispatch over {@link DataType}, one method per physical type.
 *
 * @param <R> the result type
 */
public interface DataTypeVisitor<R> {

    R visitBoolean(BooleanType type);

    R visitInt64(Int64Type type);

    R visitUInt128(UInt128Type type);

    R visitFloat64(Float64Type type);

    R visitString(StringType type);

    R visitTime64Ns(Time64NsType type);

    R visitDuration64Ns(Duration64NsType type);
}
