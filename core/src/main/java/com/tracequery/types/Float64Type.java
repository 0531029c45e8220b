package com.tracequery.types;

/**
 * Data type representing a 64-bit IEEE 754 floating point number.
 */
public final class Float64Type implements DataType {

    private static final Float64Type INSTANCE = new Float64Type();

    private Float64Type() {}

    public static Float64Type get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float64";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visitFloat64(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Float64Type;
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
