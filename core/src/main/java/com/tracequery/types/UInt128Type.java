package com.tracequery.types;

/**
 * Data type representing an unsigned 128-bit integer.
 * Used for identifiers such as process unique ids (UPIDs).
 */
public final class UInt128Type implements DataType {

    private static final UInt128Type INSTANCE = new UInt128Type();

    private UInt128Type() {}

    public static UInt128Type get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "uint128";
    }

    @Override
    public int defaultSize() {
        return 16;
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visitUInt128(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UInt128Type;
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
