package com.relalg.logical;

import java.util.Objects;

/**
 * A reference to an input column by name and optional relation alias.
 *
 * <p>Used for projections, grouping, sorting and renaming. The name {@code *}
 * stands for all columns of the qualifying relation.
 *
 * @param name the column name
 * @param relAlias the relation alias (may be null)
 */
public record Column(String name, String relAlias) implements ProjectionColumn {

    public Column {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Column of(String name) {
        return new Column(name, null);
    }

    public boolean isWildcard() {
        return "*".equals(name);
    }

    @Override
    public String toString() {
        return relAlias != null ? relAlias + "." + name : name;
    }
}
