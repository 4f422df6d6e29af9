package com.relalg.logical;

/**
 * Intersection (∩): the rows that appear in both inputs.
 */
public final class Intersect extends SetOperation {

    public Intersect(LogicalPlan left, LogicalPlan right) {
        super(left, right);
    }

    @Override
    public String symbol() {
        return "∩";
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitIntersect(this);
    }

    @Override
    public String toString() {
        return "Intersect";
    }
}
