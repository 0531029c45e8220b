package com.tracequery.types;

/**
 * Data type representing a 64-bit signed integer.
 */
public final class Int64Type implements DataType {

    private static final Int64Type INSTANCE = new Int64Type();

    private Int64Type() {}

    public static Int64Type get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int64";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visitInt64(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Int64Type;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
