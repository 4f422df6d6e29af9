package com.relalg.logical;

import com.relalg.types.NumberType;
import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Grouping with aggregation (γ).
 *
 * <p>Groups the rows of its child by the grouping columns and computes one
 * output column per aggregate function. Without grouping columns the whole
 * input forms a single group.
 *
 * <p>Output schema: the grouping columns, followed by one unqualified column per
 * aggregate, named by the aggregate's output name.
 */
public final class GroupBy extends LogicalPlan {

    private final List<Column> groupColumns;
    private final List<AggregateFunction> aggregateFunctions;

    /**
     * Creates a group-by node.
     *
     * @param child the child node
     * @param groupColumns the grouping columns (empty for global aggregation)
     * @param aggregateFunctions the aggregates to compute
     */
    public GroupBy(LogicalPlan child, List<Column> groupColumns, List<AggregateFunction> aggregateFunctions) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.groupColumns = new ArrayList<>(
            Objects.requireNonNull(groupColumns, "groupColumns must not be null"));
        this.aggregateFunctions = new ArrayList<>(
            Objects.requireNonNull(aggregateFunctions, "aggregateFunctions must not be null"));
    }

    public List<Column> groupColumns() {
        return Collections.unmodifiableList(groupColumns);
    }

    public List<AggregateFunction> aggregateFunctions() {
        return Collections.unmodifiableList(aggregateFunctions);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected Schema inferSchema() {
        Schema input = child().schema();
        List<SchemaColumn> output = new ArrayList<>();

        for (Column column : groupColumns) {
            output.add(input.column(resolve(input, column)));
        }

        for (AggregateFunction aggregate : aggregateFunctions) {
            switch (aggregate.function()) {
                case COUNT_ALL:
                    output.add(new SchemaColumn(aggregate.name(), null, NumberType.get()));
                    break;
                case COUNT:
                case SUM:
                case AVG:
                    resolve(input, aggregate.column());
                    output.add(new SchemaColumn(aggregate.name(), null, NumberType.get()));
                    break;
                case MIN:
                case MAX:
                    // MIN/MAX keep the type of the aggregated column
                    SchemaColumn source = input.column(resolve(input, aggregate.column()));
                    output.add(new SchemaColumn(aggregate.name(), null, source.type()));
                    break;
                default:
                    throw new IllegalStateException("Unsupported aggregate function: " + aggregate.function());
            }
        }
        return uniqueSchema(output);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitGroupBy(this);
    }

    @Override
    public String toString() {
        return String.format("GroupBy(%s; %s)", groupColumns, aggregateFunctions);
    }
}
