package com.relalg.logical;

import com.relalg.types.Schema;

/**
 * Semi join (⋉ / ⋊): the rows of one side that have a natural join partner on
 * the other side. The output has the schema of that side.
 */
public final class SemiJoin extends Join {

    private final boolean leftSemi;

    /**
     * Creates a semi join.
     *
     * @param left the left relation
     * @param right the right relation
     * @param leftSemi true to keep left rows (⋉), false to keep right rows (⋊)
     */
    public SemiJoin(LogicalPlan left, LogicalPlan right, boolean leftSemi) {
        super(left, right);
        this.leftSemi = leftSemi;
    }

    public boolean isLeftSemi() {
        return leftSemi;
    }

    @Override
    protected Schema inferSchema() {
        return leftSemi ? left().schema() : right().schema();
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitSemiJoin(this);
    }

    @Override
    public String toString() {
        return leftSemi ? "SemiJoin[left]" : "SemiJoin[right]";
    }
}
