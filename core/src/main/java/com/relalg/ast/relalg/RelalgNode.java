package com.relalg.ast.relalg;

import com.relalg.ast.AggregateCall;
import com.relalg.ast.AstInfo;
import com.relalg.ast.ColumnName;
import com.relalg.ast.JoinPredicate;
import com.relalg.ast.OrderByItem;
import com.relalg.ast.ValueExprNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the native relational-algebra AST.
 *
 * <p>Nodes already express primitive algebra operators. The family is closed and
 * {@link RelalgAstVisitor} has one method per kind.
 */
public sealed interface RelalgNode {

    AstInfo info();

    <R> R accept(RelalgAstVisitor<R> visitor);

    /** A reference to a catalog relation by name. */
    record Relation(String name, AstInfo info) implements RelalgNode {
        public Relation {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitRelation(this);
        }
    }

    /**
     * An inline relation literal: {@code {a:number, b:string; 1, 'x'; 2, 'y'}}.
     *
     * @param name the relation name
     * @param columns the declared columns
     * @param rows the rows, each holding one value per column
     * @param info the AST annotations; its code info text is kept as the definition
     */
    record Table(String name, List<TableColumn> columns, List<List<Object>> rows, AstInfo info)
            implements RelalgNode {

        public Table {
            Objects.requireNonNull(name, "name must not be null");
            columns = List.copyOf(columns);
            List<List<Object>> copied = new ArrayList<>(rows.size());
            for (List<Object> row : rows) {
                // row values may be null
                copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
            rows = Collections.unmodifiableList(copied);
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitTable(this);
        }
    }

    /** {@code σ arg (child)}. */
    record Selection(RelalgNode child, ValueExprNode arg, AstInfo info) implements RelalgNode {
        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitSelection(this);
        }
    }

    /** {@code π arg (child)}. */
    record Projection(RelalgNode child, List<ProjectionItem> arg, AstInfo info) implements RelalgNode {
        public Projection {
            arg = List.copyOf(arg);
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitProjection(this);
        }
    }

    /** {@code τ arg (child)}. */
    record OrderBy(RelalgNode child, List<OrderByItem> arg, AstInfo info) implements RelalgNode {
        public OrderBy {
            arg = List.copyOf(arg);
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitOrderBy(this);
        }
    }

    /** {@code γ group; aggregate (child)}. */
    record GroupBy(RelalgNode child, List<ColumnName> group, List<AggregateCall> aggregate, AstInfo info)
            implements RelalgNode {

        public GroupBy {
            group = List.copyOf(group);
            aggregate = List.copyOf(aggregate);
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitGroupBy(this);
        }
    }

    /** {@code ρ dst←src, ... (child)}. */
    record RenameColumns(RelalgNode child, List<Renaming> arg, AstInfo info) implements RelalgNode {
        public RenameColumns {
            arg = List.copyOf(arg);
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitRenameColumns(this);
        }
    }

    /** {@code ρ newRelAlias (child)}. */
    record RenameRelation(RelalgNode child, String newRelAlias, AstInfo info) implements RelalgNode {
        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitRenameRelation(this);
        }
    }

    /** {@code child ⨝ arg child2}. */
    record ThetaJoin(RelalgNode child, RelalgNode child2, ValueExprNode arg, AstInfo info) implements RelalgNode {
        public ThetaJoin {
            Objects.requireNonNull(arg, "arg must not be null");
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitThetaJoin(this);
        }
    }

    /**
     * A left, right or full outer join. Outer joins may be natural, restricted to
     * columns, or theta joins.
     *
     * @param kind the outer join kind
     * @param child the left input
     * @param child2 the right input
     * @param arg the qualifier (null for a natural join)
     * @param info the AST annotations
     */
    record OuterJoin(OuterJoinKind kind, RelalgNode child, RelalgNode child2, JoinPredicate arg, AstInfo info)
            implements RelalgNode {

        public OuterJoin {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitOuterJoin(this);
        }
    }

    /** An operator over two inputs that takes no argument. */
    record BinaryOperation(BinaryOperator operator, RelalgNode child, RelalgNode child2, AstInfo info)
            implements RelalgNode {

        public BinaryOperation {
            Objects.requireNonNull(operator, "operator must not be null");
        }

        @Override
        public <R> R accept(RelalgAstVisitor<R> visitor) {
            return visitor.visitBinaryOperation(this);
        }
    }

    /**
     * A column declaration of an inline relation.
     *
     * @param name the column name
     * @param relAlias the relation alias (may be null)
     * @param type the datatype name
     */
    record TableColumn(String name, String relAlias, String type) {
    }

    /**
     * One column renaming.
     *
     * @param dst the new column name
     * @param src the renamed column
     */
    record Renaming(String dst, ColumnName src) {
    }

    enum OuterJoinKind {
        LEFT,
        RIGHT,
        FULL
    }

    enum BinaryOperator {
        UNION,
        INTERSECT,
        DIFFERENCE,
        DIVISION,
        CROSS_JOIN,
        NATURAL_JOIN,
        LEFT_SEMI_JOIN,
        RIGHT_SEMI_JOIN,
        ANTI_JOIN
    }
}
