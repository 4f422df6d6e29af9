package com.relalg.logical;

import com.relalg.types.Schema;
import java.util.Objects;

/**
 * Base class of the set operators. Both inputs must have unifiable schemas
 * (same width, compatible types); the output uses the left schema.
 *
 * <p>Only set semantics is implemented: duplicates are always removed.
 */
public abstract sealed class SetOperation extends LogicalPlan permits Union, Intersect, Difference {

    protected SetOperation(LogicalPlan left, LogicalPlan right) {
        super(Objects.requireNonNull(left, "left must not be null"),
              Objects.requireNonNull(right, "right must not be null"));
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    /**
     * Returns the algebra symbol of the operator.
     *
     * @return the symbol, such as "∪"
     */
    public abstract String symbol();

    @Override
    protected Schema inferSchema() {
        Schema leftSchema = left().schema();
        if (!leftSchema.isUnifiableWith(right().schema())) {
            throw error("db.messages.exec.error-schemas-not-unifiable", "operator", symbol());
        }
        return leftSchema;
    }
}
