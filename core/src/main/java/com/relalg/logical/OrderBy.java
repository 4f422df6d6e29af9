package com.relalg.logical;

import com.relalg.types.Schema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Order-by (τ): sorts the rows of its child.
 *
 * <p>Sort keys are kept as two parallel lists: the columns and, for each, whether
 * it sorts ascending.
 */
public final class OrderBy extends LogicalPlan {

    private final List<Column> orderColumns;
    private final List<Boolean> ascending;

    /**
     * Creates an order-by node.
     *
     * @param child the child node
     * @param orderColumns the sort columns, most significant first
     * @param ascending for each column, true for ascending order
     */
    public OrderBy(LogicalPlan child, List<Column> orderColumns, List<Boolean> ascending) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.orderColumns = new ArrayList<>(Objects.requireNonNull(orderColumns, "orderColumns must not be null"));
        this.ascending = new ArrayList<>(Objects.requireNonNull(ascending, "ascending must not be null"));

        if (this.orderColumns.isEmpty()) {
            throw new IllegalArgumentException("orderColumns must not be empty");
        }
        if (this.orderColumns.size() != this.ascending.size()) {
            throw new IllegalArgumentException("orderColumns and ascending must have the same size");
        }
    }

    public List<Column> orderColumns() {
        return Collections.unmodifiableList(orderColumns);
    }

    public List<Boolean> ascending() {
        return Collections.unmodifiableList(ascending);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected Schema inferSchema() {
        Schema input = child().schema();
        for (Column column : orderColumns) {
            resolve(input, column);
        }
        return input;
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitOrderBy(this);
    }

    @Override
    public String toString() {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < orderColumns.size(); i++) {
            keys.add(orderColumns.get(i) + (ascending.get(i) ? " asc" : " desc"));
        }
        return String.format("OrderBy(%s)", keys);
    }
}
