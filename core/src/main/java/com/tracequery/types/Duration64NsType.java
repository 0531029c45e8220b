package com.tracequery.types;

/**
 * Data type representing a time span in nanoseconds.
 */
public final class Duration64NsType implements DataType {

    private static final Duration64NsType INSTANCE = new Duration64NsType();

    private Duration64NsType() {}

    public static Duration64NsType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "duration64ns";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public <R> R accept(DataTypeVisitor<R> visitor) {
        return visitor.visitDuration64Ns(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Duration64NsType;
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
