package com.relalg.ast;

import java.util.Objects;

/**
 * An aggregate function call as written in a SELECT list or a RA group-by.
 *
 * @param function the aggregate function name: COUNT_ALL, COUNT, SUM, AVG, MIN or MAX
 * @param col the aggregated column (null for COUNT_ALL)
 * @param name the name of the output column
 * @param info the AST annotations
 */
public record AggregateCall(String function, ColumnName col, String name, AstInfo info) {

    public AggregateCall {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
