package com.relalg.logical;

import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of the join operators.
 *
 * <p>Supported joins:
 * <ul>
 *   <li>{@link CrossJoin} - Cartesian product (no condition)</li>
 *   <li>{@link InnerJoin} - natural or theta join</li>
 *   <li>{@link LeftOuterJoin}, {@link RightOuterJoin}, {@link FullOuterJoin} - outer
 *       joins, natural or theta</li>
 *   <li>{@link SemiJoin} - rows of one side with a natural join partner</li>
 *   <li>{@link AntiJoin} - rows of the left side without a natural join partner</li>
 * </ul>
 */
public abstract sealed class Join extends LogicalPlan
    permits CrossJoin, InnerJoin, LeftOuterJoin, RightOuterJoin, FullOuterJoin, SemiJoin, AntiJoin {

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     */
    protected Join(LogicalPlan left, LogicalPlan right) {
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
     * Derives the output schema of a join with the given condition.
     *
     * <p>Theta joins keep all columns of both sides. Natural joins keep the
     * join columns once, taken from the left side.
     *
     * @param condition the join condition, or null for a Cartesian product
     * @return the joined schema
     */
    protected Schema joinSchema(JoinCondition condition) {
        Schema leftSchema = left().schema();
        Schema rightSchema = right().schema();

        if (!(condition instanceof JoinCondition.Natural natural)) {
            return uniqueSchema(concatenatedChildColumns());
        }

        Set<String> joinColumns = new LinkedHashSet<>();
        if (natural.isRestricted()) {
            for (String column : natural.restrictToColumns()) {
                if (!leftSchema.hasColumn(column) || !rightSchema.hasColumn(column)) {
                    throw error("db.messages.exec.error-join-column-missing", "column", column);
                }
                joinColumns.add(column);
            }
        } else {
            for (SchemaColumn column : leftSchema.columns()) {
                if (rightSchema.hasColumn(column.name())) {
                    joinColumns.add(column.name());
                }
            }
        }

        List<SchemaColumn> output = new ArrayList<>(leftSchema.columns());
        for (SchemaColumn column : rightSchema.columns()) {
            if (!joinColumns.contains(column.name())) {
                output.add(column);
            }
        }
        return uniqueSchema(output);
    }
}
