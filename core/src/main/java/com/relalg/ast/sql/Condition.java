package com.relalg.ast.sql;

import com.relalg.ast.AstInfo;
import com.relalg.ast.ValueExprNode;
import java.util.Objects;

/**
 * A WHERE or HAVING clause. The clause has its own source position, distinct
 * from the position of the boolean expression it wraps.
 *
 * @param arg the boolean expression
 * @param info the clause's AST annotations
 */
public record Condition(ValueExprNode arg, AstInfo info) {

    public Condition {
        Objects.requireNonNull(arg, "arg must not be null");
    }
}
