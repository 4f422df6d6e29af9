package com.relalg.expression;

import com.relalg.ast.CodeInfo;
import com.relalg.types.DataType;

/**
 * An evaluable value expression of the operator tree.
 *
 * <p>Expressions appear as selection conditions, theta-join conditions and
 * computed projection columns. There are exactly two kinds:
 * <ul>
 *   <li>{@link ColumnValue} - a reference to a column of the input row</li>
 *   <li>{@link GenericValueExpr} - an operator or function applied to constants
 *       or nested expressions</li>
 * </ul>
 *
 * <p>Each node carries its own source position and parenthesization flag,
 * independent of its parent. Both are kept for error reporting and
 * pretty-printing only and never influence evaluation.
 */
public sealed interface ValueExpr permits ColumnValue, GenericValueExpr {

    /**
     * Returns the data type of the value this expression produces.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns the source position of this expression.
     *
     * @return the code info, or null for expressions the translator synthesized
     */
    CodeInfo codeInfo();

    /**
     * Returns whether the expression was written inside parentheses.
     *
     * @return true if parenthesized
     */
    boolean wrappedInParentheses();

    /**
     * Renders this expression in relational-algebra notation.
     *
     * @return the formatted expression
     */
    String format();
}
