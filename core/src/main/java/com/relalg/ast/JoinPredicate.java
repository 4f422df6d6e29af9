package com.relalg.ast;

import java.util.List;
import java.util.Objects;

/**
 * The raw qualifier of a join as written in the query.
 *
 * <p>A join without any qualifier is represented by {@code null}.
 */
public sealed interface JoinPredicate permits JoinPredicate.Using, JoinPredicate.On {

    /**
     * {@code USING (a, b)}: a natural join restricted to the listed columns.
     *
     * @param columns the column names in order
     */
    record Using(List<String> columns) implements JoinPredicate {
        public Using {
            columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        }
    }

    /**
     * {@code ON condition}: a theta join.
     *
     * @param condition the boolean join expression
     */
    record On(ValueExprNode condition) implements JoinPredicate {
        public On {
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }
}
