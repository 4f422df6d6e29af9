package com.relalg.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A value expression as produced by the parser for both grammars.
 *
 * <p>Every node is tagged by a datatype and a function name. The arguments are
 * either nested {@code ValueExprNode}s or, when {@code func} is {@code constant},
 * literal values. A column reference is tagged {@code datatype = "null"},
 * {@code func = "columnValue"} with the arguments (column name, relation alias).
 *
 * @param datatype the datatype tag ("string", "number", "boolean", "date" or "null")
 * @param func the function or operator name
 * @param args the arguments
 * @param info the AST annotations
 */
public record ValueExprNode(String datatype, String func, List<Object> args, AstInfo info) {

    public ValueExprNode {
        Objects.requireNonNull(datatype, "datatype must not be null");
        Objects.requireNonNull(func, "func must not be null");
        // literal args may be null, so List.copyOf is not an option
        args = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(args, "args must not be null")));
    }

    /**
     * Creates a column reference node.
     *
     * @param column the column name
     * @param relAlias the relation alias (may be null)
     * @param info the AST annotations
     * @return the node
     */
    public static ValueExprNode columnValue(String column, String relAlias, AstInfo info) {
        return new ValueExprNode("null", "columnValue", Arrays.asList(column, relAlias), info);
    }

    /**
     * Creates a constant node.
     *
     * @param datatype the datatype tag
     * @param value the literal value
     * @param info the AST annotations
     * @return the node
     */
    public static ValueExprNode constant(String datatype, Object value, AstInfo info) {
        return new ValueExprNode(datatype, "constant", Collections.singletonList(value), info);
    }

    /**
     * Creates an operator or function application.
     *
     * @param datatype the result datatype tag
     * @param func the operator or function name
     * @param info the AST annotations
     * @param args the argument nodes
     * @return the node
     */
    public static ValueExprNode call(String datatype, String func, AstInfo info, ValueExprNode... args) {
        return new ValueExprNode(datatype, func, List.of((Object[]) args), info);
    }
}
