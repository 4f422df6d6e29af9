package com.relalg.translate;

import com.relalg.ast.JoinPredicate;
import com.relalg.logical.JoinCondition;

/**
 * Normalizes the raw qualifier of a join into a {@link JoinCondition}.
 *
 * <ul>
 *   <li>no qualifier ({@code null}) - natural join over all shared columns</li>
 *   <li>{@code USING (a, b)} - natural join restricted to the listed columns</li>
 *   <li>{@code ON expr} - theta join on the translated expression</li>
 * </ul>
 */
public final class JoinConditions {

    private JoinConditions() {} // Utility class

    /**
     * Normalizes a join qualifier.
     *
     * @param predicate the qualifier, or null if the join has none
     * @return the join condition
     */
    public static JoinCondition normalize(JoinPredicate predicate) {
        if (predicate == null) {
            return JoinCondition.natural();
        }
        if (predicate instanceof JoinPredicate.Using using) {
            return new JoinCondition.Natural(using.columns());
        }
        JoinPredicate.On on = (JoinPredicate.On) predicate;
        return new JoinCondition.Theta(ValueExprTranslator.translate(on.condition()));
    }
}
