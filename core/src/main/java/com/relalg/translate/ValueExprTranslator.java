package com.relalg.translate;

import com.relalg.ast.CodeInfo;
import com.relalg.ast.ValueExprNode;
import com.relalg.exception.InternalTranslationException;
import com.relalg.expression.ColumnValue;
import com.relalg.expression.GenericValueExpr;
import com.relalg.expression.ValueExpr;
import com.relalg.types.DataType;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates value-expression ASTs of both grammars into evaluable expression
 * trees.
 *
 * <p>A node tagged {@code datatype = null, func = columnValue} becomes a
 * {@link ColumnValue}. Every other node becomes a {@link GenericValueExpr}: the
 * arguments of a {@code constant} are kept verbatim, all other arguments are
 * translated recursively. Source position and parenthesization of each AST node
 * are mirrored onto the expression built for it.
 */
public final class ValueExprTranslator {

    private ValueExprTranslator() {} // Utility class

    /**
     * Translates an expression AST.
     *
     * @param node the expression AST
     * @return the expression tree
     * @throws InternalTranslationException if the datatype is not implemented, a
     *         node has no source position, or an argument is malformed
     */
    public static ValueExpr translate(ValueExprNode node) {
        CodeInfo codeInfo = Annotations.requireCodeInfo(node.info(), node.func());
        boolean parenthesized = node.info().wrappedInParentheses();

        if ("null".equals(node.datatype()) && TranslatorConfig.COLUMN_VALUE_FUNCTION.equals(node.func())) {
            return columnValue(node, codeInfo, parenthesized);
        }

        DataType dataType = DataType.forName(node.datatype());
        List<Object> args = new ArrayList<>(node.args().size());
        for (Object arg : node.args()) {
            if (GenericValueExpr.CONSTANT.equals(node.func())) {
                args.add(arg);
            } else if (arg instanceof ValueExprNode nested) {
                args.add(translate(nested));
            } else {
                throw new InternalTranslationException(
                    "argument of '" + node.func() + "' is not an expression: " + arg);
            }
        }
        return new GenericValueExpr(dataType, node.func(), args, codeInfo, parenthesized);
    }

    private static ColumnValue columnValue(ValueExprNode node, CodeInfo codeInfo, boolean parenthesized) {
        if (node.args().size() != 2 || node.args().get(0) == null) {
            throw new InternalTranslationException("columnValue expects (column, relAlias), got: " + node.args());
        }
        Object relAlias = node.args().get(1);
        return new ColumnValue(
            String.valueOf(node.args().get(0)),
            relAlias == null ? null : String.valueOf(relAlias),
            codeInfo,
            parenthesized);
    }
}
