package com.relalg.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The ordered list of columns a relation or an operator produces.
 *
 * <p>Schemas are immutable; every transformation returns a new instance. Because
 * of that, relation copies may share a schema without aliasing each other.
 */
public final class Schema {

    /** Schema with no columns. */
    public static final Schema EMPTY = new Schema(Collections.emptyList());

    private final List<SchemaColumn> columns;

    /**
     * Creates a schema with the given columns.
     *
     * @param columns the columns in order
     */
    public Schema(List<SchemaColumn> columns) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
    }

    /**
     * Creates a schema with the given columns.
     *
     * @param columns the columns in order
     */
    public Schema(SchemaColumn... columns) {
        this(Arrays.asList(columns));
    }

    /**
     * Returns the columns of this schema.
     *
     * @return an unmodifiable list of columns
     */
    public List<SchemaColumn> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public SchemaColumn column(int index) {
        return columns.get(index);
    }

    /**
     * Returns the indexes of all columns answering to a reference.
     *
     * <p>An empty result means the column does not exist, more than one index
     * means the reference is ambiguous.
     *
     * @param name the column name
     * @param relAlias the relation alias (may be null)
     * @return the matching indexes in schema order
     */
    public List<Integer> find(String name, String relAlias) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).matches(name, relAlias)) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Returns whether a column with that name exists, regardless of its alias.
     *
     * @param name the column name
     * @return true if at least one column has the name
     */
    public boolean hasColumn(String name) {
        return columns.stream().anyMatch(c -> c.name().equals(name));
    }

    /**
     * Returns the columns of the given relation alias.
     *
     * @param relAlias the relation alias
     * @return the columns qualified by the alias
     */
    public List<SchemaColumn> columnsOf(String relAlias) {
        List<SchemaColumn> result = new ArrayList<>();
        for (SchemaColumn column : columns) {
            if (relAlias.equals(column.relAlias())) {
                result.add(column);
            }
        }
        return result;
    }

    /**
     * Returns this schema with every column qualified by a new relation alias.
     *
     * @param relAlias the new alias
     * @return the requalified schema
     */
    public Schema withRelAlias(String relAlias) {
        List<SchemaColumn> renamed = new ArrayList<>(columns.size());
        for (SchemaColumn column : columns) {
            renamed.add(column.withRelAlias(relAlias));
        }
        return new Schema(renamed);
    }

    /**
     * Returns whether both schemas have the same number of columns with pairwise
     * compatible types, ignoring names.
     *
     * @param other the other schema
     * @return true if rows of both schemas may be combined by set operators
     */
    public boolean isUnifiableWith(Schema other) {
        if (columns.size() != other.columns.size()) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            DataType left = columns.get(i).type();
            DataType right = other.columns.get(i).type();
            // NULL-typed columns unify with anything
            if (!left.equals(right) && !(left instanceof NullType) && !(right instanceof NullType)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema that = (Schema) o;
        return Objects.equals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns);
    }

    @Override
    public String toString() {
        return "Schema(" + columns + ")";
    }
}
