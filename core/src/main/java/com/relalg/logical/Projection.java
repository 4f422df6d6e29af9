package com.relalg.logical;

import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Projection (π): selects and computes the output columns of its child.
 *
 * <p>Examples:
 * <pre>
 *   π a, b (R)
 *   π R.*, a + 1 → c (R)
 * </pre>
 *
 * <p>A wildcard column qualified by a relation alias expands to all columns of
 * that relation; the unqualified wildcard expands to all input columns.
 */
public final class Projection extends LogicalPlan {

    private final List<ProjectionColumn> columns;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param columns the output columns
     */
    public Projection(LogicalPlan child, List<? extends ProjectionColumn> columns) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.columns = new ArrayList<>(Objects.requireNonNull(columns, "columns must not be null"));

        if (this.columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
    }

    /**
     * Returns the output columns.
     *
     * @return an unmodifiable list of projection columns
     */
    public List<ProjectionColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected Schema inferSchema() {
        Schema input = child().schema();
        List<SchemaColumn> output = new ArrayList<>();

        for (ProjectionColumn column : columns) {
            if (column instanceof ProjectionColumn.Named named) {
                output.add(new SchemaColumn(named.name(), named.relAlias(), named.child().dataType()));
                continue;
            }
            Column ref = (Column) column;
            if (ref.isWildcard() && ref.relAlias() == null) {
                output.addAll(input.columns());
            } else if (ref.isWildcard()) {
                List<SchemaColumn> ofRelation = input.columnsOf(ref.relAlias());
                if (ofRelation.isEmpty()) {
                    throw error("db.messages.exec.error-column-not-found", "column", ref);
                }
                output.addAll(ofRelation);
            } else {
                output.add(input.column(resolve(input, ref)));
            }
        }
        return uniqueSchema(output);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitProjection(this);
    }

    @Override
    public String toString() {
        return String.format("Projection(%s)", columns);
    }
}
