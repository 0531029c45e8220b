package com.tracequery.types;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An ordered row schema, used as the output of a table function.
 */
public final class Relation {

    /** Relation with no columns. */
    public static final Relation EMPTY = new Relation(List.of());

    private final List<Column> columns;

    /**
     * Creates a Relation with the given columns.
     *
     * @param columns the columns, in output order
     */
    public Relation(List<Column> columns) {
        this.columns = List.copyOf(columns);
    }

    public Relation(Column... columns) {
        this(Arrays.asList(columns));
    }

    /**
     * Returns the columns in this relation.
     *
     * @return an unmodifiable list of columns
     */
    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    /**
     * Returns the column at the given index.
     *
     * @param index the column index
     * @return the column
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public Column columnAt(int index) {
        return columns.get(index);
    }

    /**
     * Returns the column with the given name, or null if not found.
     *
     * @param name the column name
     * @return the column, or null if not found
     */
    public Column columnByName(String name) {
        return columns.stream()
            .filter(c -> c.name().equals(name))
            .findFirst()
            .orElse(null);
    }

    /**
     * Returns the index of the column with the given name, or -1 if not found.
     */
    public int columnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relation that = (Relation) o;
        return Objects.equals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns);
    }

    @Override
    public String toString() {
        return "Relation(" + columns + ")";
    }
}
