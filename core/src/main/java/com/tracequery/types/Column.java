package com.tracequery.types;

import java.util.Objects;

/**
 * Represents a column in a {@link Relation}.
 *
 * <p>Each column has a name, a physical type, a semantic type and an optional description.
 */
public record Column(String name, DataType dataType, SemanticType semanticType, String description) {

    /**
     * Creates a column.
     *
     * @param name the column name
     * @param dataType the column data type
     * @param semanticType the column semantic type
     * @param description free-form description, empty if absent
     */
    public Column {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        semanticType = semanticType == null ? SemanticType.ST_UNSPECIFIED : semanticType;
        description = description == null ? "" : description;
    }

    /**
     * Creates a column with no semantic type or description.
     *
     * @param name the column name
     * @param dataType the column data type
     */
    public Column(String name, DataType dataType) {
        this(name, dataType, SemanticType.ST_UNSPECIFIED, "");
    }

    public ValueType valueType() {
        return ValueType.create(dataType, semanticType);
    }

    @Override
    public String toString() {
        return name + ": " + dataType
            + (semanticType == SemanticType.ST_UNSPECIFIED ? "" : " [" + semanticType + "]");
    }
}
