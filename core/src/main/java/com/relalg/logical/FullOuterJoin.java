package com.relalg.logical;

import com.relalg.types.Schema;
import java.util.Objects;

/**
 * Full outer join (⟗): like an inner join, plus the unmatched rows of both sides padded with nulls.
 */
public final class FullOuterJoin extends Join {

    private final JoinCondition condition;

    /**
     * Creates the join.
     *
     * @param left the left relation
     * @param right the right relation
     * @param condition the natural or theta condition
     */
    public FullOuterJoin(LogicalPlan left, LogicalPlan right, JoinCondition condition) {
        super(left, right);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public JoinCondition condition() {
        return condition;
    }

    @Override
    protected Schema inferSchema() {
        return joinSchema(condition);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitFullOuterJoin(this);
    }

    @Override
    public String toString() {
        return String.format("FullOuterJoin(%s)", condition);
    }
}
