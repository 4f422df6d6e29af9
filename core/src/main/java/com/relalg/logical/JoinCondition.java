package com.relalg.logical;

import com.relalg.expression.ValueExpr;
import java.util.List;
import java.util.Objects;

/**
 * Qualifier of a join: either a natural join on shared columns or a theta join
 * on an arbitrary boolean expression.
 */
public sealed interface JoinCondition permits JoinCondition.Natural, JoinCondition.Theta {

    /**
     * Equality on shared columns.
     *
     * @param restrictToColumns the columns to join on, or null for all shared columns
     */
    record Natural(List<String> restrictToColumns) implements JoinCondition {
        public Natural {
            restrictToColumns = restrictToColumns == null ? null : List.copyOf(restrictToColumns);
        }

        public boolean isRestricted() {
            return restrictToColumns != null;
        }

        @Override
        public String toString() {
            return restrictToColumns == null ? "natural" : "natural" + restrictToColumns;
        }
    }

    /**
     * Join on a boolean predicate over both inputs.
     *
     * @param joinExpression the predicate
     */
    record Theta(ValueExpr joinExpression) implements JoinCondition {
        public Theta {
            Objects.requireNonNull(joinExpression, "joinExpression must not be null");
        }

        @Override
        public String toString() {
            return joinExpression.format();
        }
    }

    /**
     * Natural join over all shared columns.
     *
     * @return the condition
     */
    static JoinCondition natural() {
        return new Natural(null);
    }
}
