package com.tracequery.types;

import java.util.List;
import java.util.Locale;

/**
 * Lookup helpers between {@link DataType} singletons and their descriptor names.
 *
 * <p>Descriptor names are the upper-case wire names used in UDF descriptor sets
 * ({@code BOOLEAN}, {@code INT64}, {@code UINT128}, {@code FLOAT64}, {@code STRING},
 * {@code TIME64NS}, {@code DURATION64NS}).
 */
public final class DataTypes {

    private static final List<DataType> ALL = List.of(
        BooleanType.get(),
        Int64Type.get(),
        UInt128Type.get(),
        Float64Type.get(),
        StringType.get(),
        Time64NsType.get(),
        Duration64NsType.get()
    );

    private static final DataTypeVisitor<String> DESCRIPTOR_NAMES = new DataTypeVisitor<>() {
        @Override
        public String visitBoolean(BooleanType type) {
            return "BOOLEAN";
        }

        @Override
        public String visitInt64(Int64Type type) {
            return "INT64";
        }

        @Override
        public String visitUInt128(UInt128Type type) {
            return "UINT128";
        }

        @Override
        public String visitFloat64(Float64Type type) {
            return "FLOAT64";
        }

        @Override
        public String visitString(StringType type) {
            return "STRING";
        }

        @Override
        public String visitTime64Ns(Time64NsType type) {
            return "TIME64NS";
        }

        @Override
        public String visitDuration64Ns(Duration64NsType type) {
            return "DURATION64NS";
        }
    };

    private DataTypes() {}

    /**
     * Returns every physical data type.
     *
     * @return an immutable list of all data types
     */
    public static List<DataType> all() {
        return ALL;
    }

    /**
     * Returns the descriptor name of a data type.
     *
     * @param type the data type
     * @return the upper-case descriptor name
     */
    public static String descriptorName(DataType type) {
        return type.accept(DESCRIPTOR_NAMES);
    }

    /**
     * Parses a descriptor name (case-insensitive) into a data type.
     *
     * @param name the type name, e.g. {@code "INT64"}
     * @return the data type singleton
     * @throws IllegalArgumentException if the name is not a known data type
     */
    public static DataType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Data type name must not be null or empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (DataType type : ALL) {
            if (descriptorName(type).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: '" + name + "'");
    }
}
