package com.relalg.logical;

import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Column renaming (ρ): gives columns of its child new names.
 *
 * <p>Renamings are registered one by one after construction, in the order they
 * were written:
 * <pre>
 *   RenameColumns rename = new RenameColumns(child);
 *   rename.addRenaming("x", "a", "R");   // x ← R.a
 * </pre>
 * The renamed columns keep their relation alias.
 */
public final class RenameColumns extends LogicalPlan {

    private final List<Renaming> renamings = new ArrayList<>();

    /**
     * Creates a rename node without renamings.
     *
     * @param child the child node
     */
    public RenameColumns(LogicalPlan child) {
        super(Objects.requireNonNull(child, "child must not be null"));
    }

    /**
     * Registers a renaming.
     *
     * @param newName the new column name
     * @param oldName the current column name
     * @param relAlias the relation alias of the current column (may be null)
     */
    public void addRenaming(String newName, String oldName, String relAlias) {
        renamings.add(new Renaming(newName, new Column(oldName, relAlias)));
    }

    public List<Renaming> renamings() {
        return Collections.unmodifiableList(renamings);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected Schema inferSchema() {
        Schema input = child().schema();
        List<SchemaColumn> output = new ArrayList<>(input.columns());
        for (Renaming renaming : renamings) {
            int index = resolve(input, renaming.source());
            output.set(index, output.get(index).withName(renaming.newName()));
        }
        return uniqueSchema(output);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitRenameColumns(this);
    }

    @Override
    public String toString() {
        return String.format("RenameColumns(%s)", renamings);
    }

    /**
     * One renaming: {@code newName ← source}.
     *
     * @param newName the new name
     * @param source the renamed column
     */
    public record Renaming(String newName, Column source) {

        public Renaming {
            Objects.requireNonNull(newName, "newName must not be null");
            Objects.requireNonNull(source, "source must not be null");
        }

        @Override
        public String toString() {
            return newName + "←" + source;
        }
    }
}
