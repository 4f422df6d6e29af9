package com.relalg.ast.relalg;

import java.util.Objects;

/**
 * Root of a parsed relational-algebra query.
 *
 * @param child the top-level operation
 */
public record RelalgRoot(RelalgNode child) {

    public RelalgRoot {
        Objects.requireNonNull(child, "child must not be null");
    }
}
