package com.relalg.ast.sql;

import com.relalg.ast.AstInfo;
import java.util.List;

/**
 * The SELECT clause of a statement.
 *
 * @param distinct whether DISTINCT was written
 * @param arg the select list
 * @param info the clause's AST annotations
 */
public record SelectClause(boolean distinct, List<SelectItem> arg, AstInfo info) {

    public SelectClause {
        arg = List.copyOf(arg);
        if (arg.isEmpty()) {
            throw new IllegalArgumentException("select list must not be empty");
        }
    }

    /**
     * Returns whether the select list is exactly the unqualified wildcard {@code *}.
     *
     * @return true for {@code SELECT *}
     */
    public boolean isUnqualifiedWildcard() {
        return arg.size() == 1
            && arg.get(0) instanceof SelectItem.Column col
            && "*".equals(col.name())
            && col.relAlias() == null;
    }
}
