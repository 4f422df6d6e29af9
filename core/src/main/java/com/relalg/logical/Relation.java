package com.relalg.logical;

import com.relalg.types.DataType;
import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A base relation: a named schema together with its rows.
 *
 * <p>Catalog relations are never embedded in a tree directly. Every reference is
 * resolved to a {@link #copy()}, so two references to the same relation own
 * independent rows and metadata.
 */
public final class Relation extends LogicalPlan {

    private final String name;
    private final Schema relationSchema;
    private final List<List<Object>> rows;

    /**
     * Creates a relation.
     *
     * @param name the relation name
     * @param schema the schema
     * @param rows the rows, each holding one value per column
     */
    public Relation(String name, Schema schema, List<? extends List<?>> rows) {
        super(); // No children
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.relationSchema = Objects.requireNonNull(schema, "schema must not be null");
        this.rows = new ArrayList<>();
        for (List<?> row : Objects.requireNonNull(rows, "rows must not be null")) {
            addRow(row);
        }
    }

    /**
     * Creates an empty relation.
     *
     * @param name the relation name
     * @param schema the schema
     */
    public Relation(String name, Schema schema) {
        this(name, schema, Collections.emptyList());
    }

    public String name() {
        return name;
    }

    /**
     * Returns the rows of this relation.
     *
     * @return an unmodifiable view of the rows
     */
    public List<List<Object>> rows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Appends a row.
     *
     * @param row the values, one per column
     * @throws IllegalArgumentException if the row does not match the schema width
     */
    public void addRow(List<?> row) {
        if (row.size() != relationSchema.size()) {
            throw new IllegalArgumentException(String.format(
                "row has %d values but relation %s has %d columns", row.size(), name, relationSchema.size()));
        }
        // values may be null
        rows.add(new ArrayList<>(row));
    }

    /**
     * Returns an independent duplicate of this relation.
     *
     * <p>Rows are copied value by value and the header (metadata, warnings,
     * position) is copied, so changing the copy never affects this relation.
     *
     * @return the copy
     */
    public Relation copy() {
        Relation copy = new Relation(name, relationSchema, rows);
        copy.header().copyFrom(header());
        return copy;
    }

    @Override
    protected Schema inferSchema() {
        return relationSchema;
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitRelation(this);
    }

    @Override
    public String toString() {
        return String.format("Relation[%s]", name);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an empty relation whose columns are qualified by the relation name.
     *
     * <p>Columns are declared the way inline relations declare them:
     * <pre>
     *   Relation.of("R", "a:number", "b:string")
     * </pre>
     *
     * @param name the relation name
     * @param columns the declarations {@code name:type}, in order
     * @return the relation
     */
    public static Relation of(String name, String... columns) {
        List<SchemaColumn> schemaColumns = new ArrayList<>();
        for (String column : columns) {
            int colon = column.indexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("column declaration must be name:type, got: " + column);
            }
            schemaColumns.add(new SchemaColumn(
                column.substring(0, colon).trim(), name, DataType.forName(column.substring(colon + 1).trim())));
        }
        return new Relation(name, new Schema(schemaColumns));
    }
}
