package com.relalg.logical;

import com.relalg.expression.ValueExpr;
import java.util.Objects;

/**
 * An output column of a {@link Projection}: either an input column or a named
 * computed expression.
 */
public sealed interface ProjectionColumn permits Column, ProjectionColumn.Named {

    /**
     * A computed column.
     *
     * @param name the output column name
     * @param relAlias the relation alias of the output column (may be null)
     * @param child the expression computing the value
     */
    record Named(String name, String relAlias, ValueExpr child) implements ProjectionColumn {

        public Named {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public String toString() {
            return child.format() + "→" + (relAlias != null ? relAlias + "." + name : name);
        }
    }
}
