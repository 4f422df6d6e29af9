package com.relalg.logical;

/**
 * Difference (-): the rows of the left input that do not appear in the right input.
 */
public final class Difference extends SetOperation {

    public Difference(LogicalPlan left, LogicalPlan right) {
        super(left, right);
    }

    @Override
    public String symbol() {
        return "-";
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitDifference(this);
    }

    @Override
    public String toString() {
        return "Difference";
    }
}
