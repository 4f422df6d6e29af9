package com.relalg.logical;

import com.relalg.types.Schema;
import java.util.Objects;

/**
 * Relation renaming (ρ): qualifies all columns of its child by a new relation
 * alias.
 *
 * <p>This is what {@code FROM R AS x} and {@code (SELECT ...) AS x} compile to, and
 * what makes self-joins possible:
 * <pre>
 *   ρ a (R) ⨝ a.id = b.id ρ b (R)
 * </pre>
 */
public final class RenameRelation extends LogicalPlan {

    private final String newRelAlias;

    /**
     * Creates a relation rename.
     *
     * @param child the renamed relation
     * @param newRelAlias the new relation alias
     */
    public RenameRelation(LogicalPlan child, String newRelAlias) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.newRelAlias = Objects.requireNonNull(newRelAlias, "newRelAlias must not be null");
        if (newRelAlias.isEmpty()) {
            throw new IllegalArgumentException("newRelAlias must not be empty");
        }
    }

    public String newRelAlias() {
        return newRelAlias;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected Schema inferSchema() {
        return child().schema().withRelAlias(newRelAlias);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitRenameRelation(this);
    }

    @Override
    public String toString() {
        return String.format("RenameRelation[%s]", newRelAlias);
    }
}
