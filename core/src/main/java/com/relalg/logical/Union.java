package com.relalg.logical;

/**
 * Union (∪): the rows that appear in either input.
 */
public final class Union extends SetOperation {

    public Union(LogicalPlan left, LogicalPlan right) {
        super(left, right);
    }

    @Override
    public String symbol() {
        return "∪";
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public String toString() {
        return "Union";
    }
}
