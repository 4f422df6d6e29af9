package com.relalg.logical;

import com.relalg.types.Schema;

/**
 * Cross join (×): the Cartesian product of both inputs.
 *
 * <p>Both sides must not share a qualified column; {@code R × R} without
 * renaming one side is rejected when the schema is checked.
 */
public final class CrossJoin extends Join {

    public CrossJoin(LogicalPlan left, LogicalPlan right) {
        super(left, right);
    }

    @Override
    protected Schema inferSchema() {
        return joinSchema(null);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitCrossJoin(this);
    }

    @Override
    public String toString() {
        return "CrossJoin";
    }
}
