package com.tracequery.types;

/**
 * Sealed interface for the physical data types a function signature can name.
 *
 * <p>The set is closed: every type is a singleton obtained through its {@code get()}
 * method, and code that needs per-type behavior dispatches through
 * {@link DataTypeVisitor}, so adding a type fails compilation wherever a visitor
 * does not handle it.
 *
 * <p>Physical types:
 * <ul>
 *   <li>Primitive types: BooleanType, Int64Type, UInt128Type, Float64Type, StringType</li>
 *   <li>Temporal types: Time64NsType, Duration64NsType</li>
 * </ul>
 *
 * @see DataTypes
 * @see SemanticType
 */
public sealed interface DataType
    permits BooleanType, Int64Type, UInt128Type, Float64Type, StringType,
            Time64NsType, Duration64NsType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the size in bytes of a value of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String).
     *
     * @return the size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }

    /**
     * Dispatches to the visitor method for this type.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor result
     */
    <R> R accept(DataTypeVisitor<R> visitor);
}
