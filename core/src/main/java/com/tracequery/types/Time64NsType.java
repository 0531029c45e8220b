package com.tracequery.types;

/**
 * Data type representing a point in time as nanoseconds since the Unix epoch.
 */
public final class Time64NsType implements DataType {

    private static final Time64NsType INSTANCE = new Time64NsType();

    private Time64NsType() {}

    public static Time64NsType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "time64ns";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visitTime64Ns(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Time64NsType;
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
