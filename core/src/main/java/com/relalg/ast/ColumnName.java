package com.relalg.ast;

import java.util.Objects;

/**
 * A column reference as written in the query: a name and an optional relation alias.
 *
 * @param name the column name ({@code *} for a wildcard)
 * @param relAlias the qualifying relation alias (may be null)
 */
public record ColumnName(String name, String relAlias) {

    public ColumnName {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static ColumnName of(String name) {
        return new ColumnName(name, null);
    }
}
