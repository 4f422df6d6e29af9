package com.relalg.ast.relalg;

import com.relalg.ast.ValueExprNode;
import java.util.Objects;

/**
 * An entry of a RA projection list.
 */
public sealed interface ProjectionItem {

    <R> R accept(Visitor<R> visitor);

    /** A plain column reference. */
    record Column(String name, String relAlias) implements ProjectionItem {
        public Column {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitColumn(this);
        }
    }

    /** A computed column: {@code a + b → c}. */
    record NamedExpression(String name, String relAlias, ValueExprNode child) implements ProjectionItem {
        public NamedExpression {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamedExpression(this);
        }
    }

    interface Visitor<R> {
        R visitColumn(Column item);

        R visitNamedExpression(NamedExpression item);
    }
}
