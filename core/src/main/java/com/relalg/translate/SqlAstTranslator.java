package com.relalg.translate;

import com.relalg.ast.CodeInfo;
import com.relalg.ast.ColumnName;
import com.relalg.ast.OrderByItem;
import com.relalg.ast.sql.Condition;
import com.relalg.ast.sql.SelectClause;
import com.relalg.ast.sql.SelectItem;
import com.relalg.ast.sql.SqlAstVisitor;
import com.relalg.ast.sql.SqlNode;
import com.relalg.ast.sql.SqlRoot;
import com.relalg.exception.InternalTranslationException;
import com.relalg.exception.TranslationException;
import com.relalg.expression.GenericValueExpr;
import com.relalg.expression.ValueExpr;
import com.relalg.logical.AggregateFunction;
import com.relalg.logical.Column;
import com.relalg.logical.CrossJoin;
import com.relalg.logical.Difference;
import com.relalg.logical.FullOuterJoin;
import com.relalg.logical.GroupBy;
import com.relalg.logical.InnerJoin;
import com.relalg.logical.Intersect;
import com.relalg.logical.JoinCondition;
import com.relalg.logical.LeftOuterJoin;
import com.relalg.logical.LogicalPlan;
import com.relalg.logical.OrderBy;
import com.relalg.logical.Projection;
import com.relalg.logical.ProjectionColumn;
import com.relalg.logical.Relation;
import com.relalg.logical.RenameColumns;
import com.relalg.logical.RenameRelation;
import com.relalg.logical.RightOuterJoin;
import com.relalg.logical.Selection;
import com.relalg.logical.Union;
import com.relalg.types.BooleanType;
import com.relalg.types.NumberType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates SQL ASTs into operator trees.
 *
 * <p>A SELECT statement is composed bottom-up in a fixed order:
 * <ol>
 *   <li>FROM: the translated from-item, schema-checked</li>
 *   <li>WHERE: a {@link Selection}</li>
 *   <li>GROUP BY / aggregates: a {@link GroupBy}, or a {@link Projection} over
 *       the grouping columns when the statement has no aggregate call</li>
 *   <li>HAVING: a {@link Selection}</li>
 *   <li>SELECT list: a {@link Projection}, omitted for a bare {@code SELECT *}</li>
 *   <li>aliases: a {@link RenameColumns} directly above the projection</li>
 * </ol>
 *
 * <p>{@code LIMIT n OFFSET m} is lowered to a selection on the synthetic row
 * number. The resulting selection assumes the executor numbers the rows of its
 * input in their current order, starting at 1.
 *
 * <p>A translator only reads its catalog and may be reused for any number of
 * queries.
 */
public class SqlAstTranslator {
    private static final Logger logger = LoggerFactory.getLogger(SqlAstTranslator.class);

    private final RelationCatalog catalog;
    private final NodeTranslator nodeTranslator = new NodeTranslator();

    /**
     * Creates a translator resolving relation names in the given catalog.
     *
     * @param catalog the relations queries may reference
     */
    public SqlAstTranslator(RelationCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Translates a complete SQL query.
     *
     * @param root the AST root
     * @return the operator tree
     * @throws TranslationException if the query references an unknown relation or
     *         its FROM clause has conflicting columns
     * @throws InternalTranslationException if the AST is malformed
     */
    public LogicalPlan translate(SqlRoot root) {
        return rec(root.child());
    }

    private LogicalPlan rec(SqlNode node) {
        LogicalPlan plan = node.accept(nodeTranslator);
        if (plan == null) {
            throw new InternalTranslationException("no node built for " + node.getClass().getSimpleName());
        }
        return Annotations.annotate(plan, node.info());
    }

    // ==================== Statement pipeline ====================

    private LogicalPlan translateStatement(SqlNode.Statement statement) {
        SelectClause select = statement.select();

        LogicalPlan root = rec(statement.from());
        root.check();

        if (statement.where() != null) {
            root = selection(root, statement.where());
        }

        if (statement.groupBy() != null || statement.numAggregationColumns() > 0) {
            root = grouping(root, statement);
        }

        if (statement.having() != null) {
            root = selection(root, statement.having());
        }

        boolean columnsRenamed = false;
        if (!select.isUnqualifiedWildcard()) {
            List<ProjectionColumn> projections = new ArrayList<>();
            for (SelectItem item : select.arg()) {
                projections.add(item.accept(PROJECTION_ENTRY));
                if (item instanceof SelectItem.Column column && column.isAliased()) {
                    columnsRenamed = true;
                }
            }
            logger.debug("Creating Projection with {} columns", projections.size());
            root = Annotations.position(new Projection(root, projections), select.info());
        }

        if (columnsRenamed) {
            RenameColumns rename = new RenameColumns(root);
            for (SelectItem item : select.arg()) {
                if (item instanceof SelectItem.Column column && column.isAliased()) {
                    rename.addRenaming(column.alias(), column.name(), column.relAlias());
                }
            }
            logger.debug("Creating RenameColumns with {} renamings", rename.renamings().size());
            root = Annotations.position(rename, select.info());
        }

        if (!select.distinct()) {
            root.header().addWarning(TranslatorConfig.WARNING_DISTINCT_MISSING,
                Annotations.requireCodeInfo(statement.info(), "statement"));
            logger.warn("SELECT without DISTINCT at {}", statement.info().codeInfo());
        }
        return root;
    }

    private LogicalPlan selection(LogicalPlan root, Condition condition) {
        root.check();
        ValueExpr predicate = ValueExprTranslator.translate(condition.arg());
        logger.debug("Creating Selection with condition: {}", predicate);
        return Annotations.position(new Selection(root, predicate), condition.info());
    }

    private LogicalPlan grouping(LogicalPlan root, SqlNode.Statement statement) {
        List<ColumnName> groupBy = statement.groupBy() == null ? List.of() : statement.groupBy();
        List<Column> groupColumns = new ArrayList<>(groupBy.size());
        for (ColumnName name : groupBy) {
            groupColumns.add(new Column(name.name(), name.relAlias()));
        }

        List<AggregateFunction> aggregates = new ArrayList<>();
        for (SelectItem item : statement.select().arg()) {
            if (item instanceof SelectItem.Aggregate aggregate) {
                aggregates.add(RelalgAstTranslator.aggregateFunction(aggregate.call()));
            }
        }

        LogicalPlan grouped;
        if (!aggregates.isEmpty()) {
            logger.debug("Creating GroupBy with {} grouping columns and {} aggregates",
                groupColumns.size(), aggregates.size());
            grouped = new GroupBy(root, groupColumns, aggregates);
        } else {
            logger.debug("GROUP BY without aggregates, projecting on {} grouping columns", groupColumns.size());
            grouped = new Projection(root, groupColumns);
        }
        return Annotations.position(grouped, statement.info());
    }

    private static final SelectItem.Visitor<ProjectionColumn> PROJECTION_ENTRY =
        new SelectItem.Visitor<ProjectionColumn>() {
            @Override
            public ProjectionColumn visitColumn(SelectItem.Column item) {
                return new Column(item.name(), item.relAlias());
            }

            @Override
            public ProjectionColumn visitAggregate(SelectItem.Aggregate item) {
                // already named by the group-by
                return new Column(item.call().name(), null);
            }

            @Override
            public ProjectionColumn visitNamedExpression(SelectItem.NamedExpression item) {
                return new ProjectionColumn.Named(
                    item.name(), item.relAlias(), ValueExprTranslator.translate(item.child()));
            }
        };

    // ==================== LIMIT lowering ====================

    private static ValueExpr limitCondition(SqlNode.Limit limit) {
        CodeInfo codeInfo = Annotations.requireCodeInfo(limit.info(), "limit");

        ValueExpr afterOffset = comparison(">", limit.offset(), codeInfo);
        if (limit.limit() == SqlNode.Limit.LIMIT_ALL) {
            return afterOffset;
        }
        ValueExpr withinLimit = comparison("<=", limit.limit() + limit.offset(), codeInfo);
        return new GenericValueExpr(BooleanType.get(), "and", List.of(afterOffset, withinLimit), codeInfo, false);
    }

    private static ValueExpr comparison(String operator, long bound, CodeInfo codeInfo) {
        return new GenericValueExpr(BooleanType.get(), operator, List.of(
            new GenericValueExpr(NumberType.get(), TranslatorConfig.ROWNUM_FUNCTION, List.of(), codeInfo, false),
            new GenericValueExpr(NumberType.get(), GenericValueExpr.CONSTANT, List.of(bound), codeInfo, false)),
            codeInfo, false);
    }

    /**
     * One method per SQL node kind. Annotation is left to {@link #rec}.
     */
    private final class NodeTranslator implements SqlAstVisitor<LogicalPlan> {

        @Override
        public LogicalPlan visitRelation(SqlNode.Relation node) {
            logger.debug("Resolving relation: {}", node.name());
            Relation relation = catalog.lookup(node.name(), Annotations.requireCodeInfo(node.info(), node.name()));
            if (node.relAlias() == null) {
                return relation;
            }
            logger.debug("Aliasing relation {} as {}", node.name(), node.relAlias());
            return new RenameRelation(Annotations.position(relation, node.info()), node.relAlias());
        }

        @Override
        public LogicalPlan visitStatement(SqlNode.Statement node) {
            return translateStatement(node);
        }

        @Override
        public LogicalPlan visitRenameRelation(SqlNode.RenameRelation node) {
            return new RenameRelation(rec(node.child()), node.newRelAlias());
        }

        @Override
        public LogicalPlan visitRelationFromSubstatement(SqlNode.RelationFromSubstatement node) {
            LogicalPlan statement = rec(node.statement());
            return new RenameRelation(statement, node.relAlias());
        }

        @Override
        public LogicalPlan visitJoin(SqlNode.Join node) {
            JoinCondition condition = JoinConditions.normalize(node.cond());
            LogicalPlan left = rec(node.child());
            LogicalPlan right = rec(node.child2());
            logger.debug("Creating {} join with condition: {}", node.kind(), condition);
            return switch (node.kind()) {
                case INNER       -> new InnerJoin(left, right, condition);
                case LEFT_OUTER  -> new LeftOuterJoin(left, right, condition);
                case RIGHT_OUTER -> new RightOuterJoin(left, right, condition);
                case FULL_OUTER  -> new FullOuterJoin(left, right, condition);
            };
        }

        @Override
        public LogicalPlan visitCrossJoin(SqlNode.CrossJoin node) {
            return new CrossJoin(rec(node.child()), rec(node.child2()));
        }

        @Override
        public LogicalPlan visitNaturalJoin(SqlNode.NaturalJoin node) {
            return new InnerJoin(rec(node.child()), rec(node.child2()), JoinCondition.natural());
        }

        @Override
        public LogicalPlan visitSetOperation(SqlNode.SetOperation node) {
            LogicalPlan left = rec(node.child());
            LogicalPlan right = rec(node.child2());
            LogicalPlan result = switch (node.operator()) {
                case UNION     -> new Union(left, right);
                case INTERSECT -> new Intersect(left, right);
                case EXCEPT    -> new Difference(left, right);
            };

            if (node.all()) {
                CodeInfo codeInfo = Annotations.requireCodeInfo(node.info(), node.operator());
                result.header().addWarning(TranslatorConfig.WARNING_IGNORED_ALL_ON_SET_OPERATORS, codeInfo);
                logger.warn("{} ALL at {}: ALL is ignored", node.operator(), codeInfo);
            }
            return result;
        }

        @Override
        public LogicalPlan visitOrderBy(SqlNode.OrderBy node) {
            List<Column> orderColumns = new ArrayList<>();
            List<Boolean> ascending = new ArrayList<>();
            for (OrderByItem item : node.arg()) {
                orderColumns.add(new Column(item.col().name(), item.col().relAlias()));
                ascending.add(item.asc());
            }
            return new OrderBy(rec(node.child()), orderColumns, ascending);
        }

        @Override
        public LogicalPlan visitLimit(SqlNode.Limit node) {
            ValueExpr condition = limitCondition(node);
            logger.debug("Lowering LIMIT {} OFFSET {} to selection: {}", node.limit(), node.offset(), condition);
            return new Selection(rec(node.child()), condition);
        }
    }
}
