package com.relalg.ast.sql;

import com.relalg.ast.AggregateCall;
import com.relalg.ast.ValueExprNode;
import java.util.Objects;

/**
 * An entry of a SELECT list.
 */
public sealed interface SelectItem {

    <R> R accept(Visitor<R> visitor);

    /**
     * A plain column, possibly a (qualified) wildcard, optionally aliased.
     *
     * @param name the column name
     * @param relAlias the relation alias (may be null)
     * @param alias the output alias from {@code AS} (null if not aliased)
     */
    record Column(String name, String relAlias, String alias) implements SelectItem {
        public Column {
            Objects.requireNonNull(name, "name must not be null");
        }

        public boolean isAliased() {
            return alias != null && !alias.isEmpty();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitColumn(this);
        }
    }

    /** An aggregate function call such as {@code COUNT(*) AS n}. */
    record Aggregate(AggregateCall call) implements SelectItem {
        public Aggregate {
            Objects.requireNonNull(call, "call must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAggregate(this);
        }
    }

    /**
     * A computed expression with an output name, such as {@code a + 1 AS b}.
     *
     * @param name the output column name
     * @param relAlias the relation alias of the output column (may be null)
     * @param child the expression
     */
    record NamedExpression(String name, String relAlias, ValueExprNode child) implements SelectItem {
        public NamedExpression {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamedExpression(this);
        }
    }

    /**
     * Visitor over the select item kinds.
     *
     * @param <R> the result type
     */
    interface Visitor<R> {
        R visitColumn(Column item);

        R visitAggregate(Aggregate item);

        R visitNamedExpression(NamedExpression item);
    }
}
