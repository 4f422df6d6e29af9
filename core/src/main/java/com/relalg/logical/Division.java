package com.relalg.logical;

import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Division (÷): the combinations of the left-only columns that appear in the
 * left input together with every row of the right input.
 *
 * <p>The columns of the right input must be a subset of the columns of the left
 * input; the output consists of the remaining left columns.
 */
public final class Division extends LogicalPlan {

    public Division(LogicalPlan left, LogicalPlan right) {
        super(Objects.requireNonNull(left, "left must not be null"),
              Objects.requireNonNull(right, "right must not be null"));
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    @Override
    protected Schema inferSchema() {
        Schema dividend = left().schema();
        Schema divisor = right().schema();

        for (SchemaColumn column : divisor.columns()) {
            if (!dividend.hasColumn(column.name())) {
                throw error("db.messages.exec.error-division-schema", "column", column.qualifiedName());
            }
        }

        List<SchemaColumn> output = new ArrayList<>();
        for (SchemaColumn column : dividend.columns()) {
            if (!divisor.hasColumn(column.name())) {
                output.add(column);
            }
        }
        return new Schema(output);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitDivision(this);
    }

    @Override
    public String toString() {
        return "Division";
    }
}
