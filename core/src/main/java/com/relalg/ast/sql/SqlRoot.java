package com.relalg.ast.sql;

import java.util.Objects;

/**
 * Root of a parsed SQL query.
 *
 * @param child the top-level node
 */
public record SqlRoot(SqlNode child) {

    public SqlRoot {
        Objects.requireNonNull(child, "child must not be null");
    }
}
