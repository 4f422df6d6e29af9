package com.relalg.ast.sql;

import com.relalg.ast.AstInfo;
import com.relalg.ast.ColumnName;
import com.relalg.ast.JoinPredicate;
import com.relalg.ast.OrderByItem;
import com.relalg.exception.InternalTranslationException;
import java.util.List;
import java.util.Objects;

/**
 * A node of the SQL abstract syntax tree.
 *
 * <p>The node kinds form a closed family; {@link SqlAstVisitor} has one method per
 * kind, so adding a kind is a compile-time obligation for every consumer.
 */
public sealed interface SqlNode {

    /**
     * Returns the annotations the parser attached to this node.
     *
     * @return the AST info
     */
    AstInfo info();

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor the visitor
     * @param <R> the result type
     * @return the visitor's result
     */
    <R> R accept(SqlAstVisitor<R> visitor);

    /** A reference to a catalog relation, optionally aliased ({@code FROM R AS x}). */
    record Relation(String name, String relAlias, AstInfo info) implements SqlNode {
        public Relation {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitRelation(this);
        }
    }

    /**
     * A complete SELECT statement.
     *
     * @param select the SELECT clause
     * @param from the FROM clause
     * @param where the WHERE clause (may be null)
     * @param groupBy the GROUP BY columns (null if there is no GROUP BY clause)
     * @param having the HAVING clause (may be null)
     * @param numAggregationColumns number of aggregate calls in the SELECT list
     * @param info the AST annotations
     * @throws InternalTranslationException if numAggregationColumns does not match
     *         the aggregate calls of the SELECT list
     */
    record Statement(
            SelectClause select,
            SqlNode from,
            Condition where,
            List<ColumnName> groupBy,
            Condition having,
            int numAggregationColumns,
            AstInfo info) implements SqlNode {

        public Statement {
            Objects.requireNonNull(select, "select must not be null");
            Objects.requireNonNull(from, "from must not be null");
            groupBy = groupBy == null ? null : List.copyOf(groupBy);
            int aggregates = countAggregates(select);
            if (numAggregationColumns != aggregates) {
                throw new InternalTranslationException("statement declares " + numAggregationColumns
                    + " aggregation columns but its SELECT list has " + aggregates);
            }
        }

        /**
         * Creates a statement whose aggregation count is taken from the SELECT list.
         */
        public Statement(SelectClause select, SqlNode from, Condition where, List<ColumnName> groupBy,
                         Condition having, AstInfo info) {
            this(select, from, where, groupBy, having, countAggregates(select), info);
        }

        private static int countAggregates(SelectClause select) {
            return (int) select.arg().stream().filter(SelectItem.Aggregate.class::isInstance).count();
        }

        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitStatement(this);
        }
    }

    /** {@code child AS newRelAlias} around an arbitrary from-item. */
    record RenameRelation(SqlNode child, String newRelAlias, AstInfo info) implements SqlNode {
        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitRenameRelation(this);
        }
    }

    /** {@code (SELECT ...) AS relAlias} used as a from-item. */
    record RelationFromSubstatement(SqlNode statement, String relAlias, AstInfo info) implements SqlNode {
        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitRelationFromSubstatement(this);
        }
    }

    /**
     * An inner or outer join with an optional qualifier.
     *
     * @param kind the join kind
     * @param child the left input
     * @param child2 the right input
     * @param cond the qualifier: null (natural), USING columns or ON condition
     * @param info the AST annotations
     */
    record Join(JoinKind kind, SqlNode child, SqlNode child2, JoinPredicate cond, AstInfo info)
            implements SqlNode {

        public Join {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitJoin(this);
        }
    }

    /** {@code child CROSS JOIN child2}, or a comma in the FROM list. */
    record CrossJoin(SqlNode child, SqlNode child2, AstInfo info) implements SqlNode {
        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitCrossJoin(this);
        }
    }

    /** {@code child NATURAL JOIN child2}. */
    record NaturalJoin(SqlNode child, SqlNode child2, AstInfo info) implements SqlNode {
        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitNaturalJoin(this);
        }
    }

    /**
     * UNION, INTERSECT or EXCEPT of two queries.
     *
     * @param operator the set operator
     * @param child the left query
     * @param child2 the right query
     * @param all whether ALL was written (bag semantics was requested)
     * @param info the AST annotations
     */
    record SetOperation(SetOperator operator, SqlNode child, SqlNode child2, boolean all, AstInfo info)
            implements SqlNode {

        public SetOperation {
            Objects.requireNonNull(operator, "operator must not be null");
        }

        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitSetOperation(this);
        }
    }

    /** {@code child ORDER BY ...}. */
    record OrderBy(SqlNode child, List<OrderByItem> arg, AstInfo info) implements SqlNode {
        public OrderBy {
            arg = List.copyOf(arg);
        }

        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitOrderBy(this);
        }
    }

    /**
     * {@code child LIMIT limit OFFSET offset}.
     *
     * @param child the limited query
     * @param limit the row limit, or {@link #LIMIT_ALL} for {@code LIMIT ALL}
     * @param offset the number of rows to skip (0 when absent)
     * @param info the AST annotations
     */
    record Limit(SqlNode child, long limit, long offset, AstInfo info) implements SqlNode {

        /** Marker for {@code LIMIT ALL}. */
        public static final long LIMIT_ALL = -1;

        @Override
        public <R> R accept(SqlAstVisitor<R> visitor) {
            return visitor.visitLimit(this);
        }
    }

    /** The kinds of qualified joins. */
    enum JoinKind {
        INNER,
        LEFT_OUTER,
        RIGHT_OUTER,
        FULL_OUTER
    }

    /** The SQL set operators. */
    enum SetOperator {
        UNION,
        INTERSECT,
        EXCEPT
    }
}
