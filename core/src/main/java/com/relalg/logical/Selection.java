package com.relalg.logical;

import com.relalg.expression.ValueExpr;
import com.relalg.types.Schema;
import java.util.Objects;

/**
 * Selection (σ): keeps the rows of its child that satisfy a boolean condition.
 *
 * <p>Used for WHERE, HAVING, RA selections and the row-number window that
 * LIMIT/OFFSET is lowered to.
 */
public final class Selection extends LogicalPlan {

    private final ValueExpr condition;

    /**
     * Creates a selection node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Selection(LogicalPlan child, ValueExpr condition) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public ValueExpr condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected Schema inferSchema() {
        // Selection doesn't change the schema
        return child().schema();
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitSelection(this);
    }

    @Override
    public String toString() {
        return String.format("Selection(%s)", condition.format());
    }
}
