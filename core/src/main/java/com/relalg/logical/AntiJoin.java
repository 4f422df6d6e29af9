package com.relalg.logical;

import com.relalg.types.Schema;

/**
 * Anti join (▷): the rows of the left side without a natural join partner on the
 * right side.
 */
public final class AntiJoin extends Join {

    public AntiJoin(LogicalPlan left, LogicalPlan right) {
        super(left, right);
    }

    @Override
    protected Schema inferSchema() {
        // the right side is only needed for its schema to be valid
        right().schema();
        return left().schema();
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitAntiJoin(this);
    }

    @Override
    public String toString() {
        return "AntiJoin";
    }
}
