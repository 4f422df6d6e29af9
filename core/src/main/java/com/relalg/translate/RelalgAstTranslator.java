package com.relalg.translate;

import com.relalg.ast.AggregateCall;
import com.relalg.ast.ColumnName;
import com.relalg.ast.OrderByItem;
import com.relalg.ast.relalg.ProjectionItem;
import com.relalg.ast.relalg.RelalgAstVisitor;
import com.relalg.ast.relalg.RelalgNode;
import com.relalg.ast.relalg.RelalgRoot;
import com.relalg.exception.InternalTranslationException;
import com.relalg.exception.TranslationException;
import com.relalg.expression.ValueExpr;
import com.relalg.logical.AggregateFunction;
import com.relalg.logical.AntiJoin;
import com.relalg.logical.Column;
import com.relalg.logical.CrossJoin;
import com.relalg.logical.Difference;
import com.relalg.logical.Division;
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
import com.relalg.logical.SemiJoin;
import com.relalg.logical.Union;
import com.relalg.types.DataType;
import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates relational-algebra ASTs into operator trees.
 *
 * <p>The RA grammar already consists of primitive operators, so every AST node
 * kind maps to exactly one tree node kind. Each produced node receives the
 * source position, metadata and parenthesization of its AST node.
 *
 * <p>Usage:
 * <pre>
 *   RelalgAstTranslator translator = new RelalgAstTranslator(catalog);
 *   LogicalPlan plan = translator.translate(root);
 * </pre>
 *
 * <p>A translator only reads its catalog and may be reused for any number of
 * queries.
 */
public class RelalgAstTranslator {
    private static final Logger logger = LoggerFactory.getLogger(RelalgAstTranslator.class);

    private final RelationCatalog catalog;
    private final NodeTranslator nodeTranslator = new NodeTranslator();

    /**
     * Creates a translator resolving relation names in the given catalog.
     *
     * @param catalog the relations queries may reference
     */
    public RelalgAstTranslator(RelationCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Translates a complete RA query.
     *
     * @param root the AST root
     * @return the operator tree
     * @throws TranslationException if the query references an unknown relation
     * @throws InternalTranslationException if the AST is malformed
     */
    public LogicalPlan translate(RelalgRoot root) {
        return translateNode(root.child());
    }

    /**
     * Translates a single RA AST node and its subtree.
     *
     * @param node the AST node
     * @return the operator tree
     * @throws TranslationException if the subtree references an unknown relation
     * @throws InternalTranslationException if the AST is malformed
     */
    public LogicalPlan translateNode(RelalgNode node) {
        LogicalPlan plan = node.accept(nodeTranslator);
        if (plan == null) {
            throw new InternalTranslationException("no node built for " + node.getClass().getSimpleName());
        }
        return Annotations.annotate(plan, node.info());
    }

    private static Column column(ColumnName name) {
        return new Column(name.name(), name.relAlias());
    }

    /**
     * Converts an aggregate call of either grammar into an aggregate function.
     *
     * @param call the AST call
     * @return the aggregate function
     */
    static AggregateFunction aggregateFunction(AggregateCall call) {
        AggregateFunction.Function function = AggregateFunction.Function.forName(call.function());
        Column argument = call.col() == null ? null : column(call.col());
        return new AggregateFunction(function, argument, call.name());
    }

    /**
     * One method per RA node kind. Annotation is left to {@link #translateNode}.
     */
    private final class NodeTranslator implements RelalgAstVisitor<LogicalPlan> {

        @Override
        public LogicalPlan visitRelation(RelalgNode.Relation node) {
            logger.debug("Resolving relation: {}", node.name());
            return catalog.lookup(node.name(), Annotations.requireCodeInfo(node.info(), node.name()));
        }

        @Override
        public LogicalPlan visitTable(RelalgNode.Table node) {
            List<SchemaColumn> columns = new ArrayList<>();
            for (RelalgNode.TableColumn column : node.columns()) {
                columns.add(new SchemaColumn(column.name(), column.relAlias(), DataType.forName(column.type())));
            }

            Relation relation = new Relation(node.name(), new Schema(columns), node.rows());
            relation.header().setMetaData(TranslatorConfig.META_INLINE_RELATION, true);
            relation.header().setMetaData(TranslatorConfig.META_INLINE_DEFINITION,
                Annotations.requireCodeInfo(node.info(), node.name()).text());

            logger.debug("Creating inline relation {} with {} columns and {} rows",
                node.name(), columns.size(), node.rows().size());
            return relation;
        }

        @Override
        public LogicalPlan visitSelection(RelalgNode.Selection node) {
            LogicalPlan child = translateNode(node.child());
            ValueExpr condition = ValueExprTranslator.translate(node.arg());
            logger.debug("Creating Selection with condition: {}", condition);
            return new Selection(child, condition);
        }

        @Override
        public LogicalPlan visitProjection(RelalgNode.Projection node) {
            LogicalPlan child = translateNode(node.child());
            List<ProjectionColumn> projections = new ArrayList<>();
            for (ProjectionItem item : node.arg()) {
                projections.add(item.accept(new ProjectionItem.Visitor<ProjectionColumn>() {
                    @Override
                    public ProjectionColumn visitColumn(ProjectionItem.Column column) {
                        return new Column(column.name(), column.relAlias());
                    }

                    @Override
                    public ProjectionColumn visitNamedExpression(ProjectionItem.NamedExpression named) {
                        return new ProjectionColumn.Named(
                            named.name(), named.relAlias(), ValueExprTranslator.translate(named.child()));
                    }
                }));
            }
            logger.debug("Creating Projection with {} columns", projections.size());
            return new Projection(child, projections);
        }

        @Override
        public LogicalPlan visitOrderBy(RelalgNode.OrderBy node) {
            LogicalPlan child = translateNode(node.child());
            List<Column> orderColumns = new ArrayList<>();
            List<Boolean> ascending = new ArrayList<>();
            for (OrderByItem item : node.arg()) {
                orderColumns.add(column(item.col()));
                ascending.add(item.asc());
            }
            return new OrderBy(child, orderColumns, ascending);
        }

        @Override
        public LogicalPlan visitGroupBy(RelalgNode.GroupBy node) {
            LogicalPlan child = translateNode(node.child());
            List<Column> groupColumns = new ArrayList<>();
            for (ColumnName name : node.group()) {
                groupColumns.add(column(name));
            }
            List<AggregateFunction> aggregates = new ArrayList<>();
            for (AggregateCall call : node.aggregate()) {
                aggregates.add(aggregateFunction(call));
            }
            logger.debug("Creating GroupBy with {} grouping columns and {} aggregates",
                groupColumns.size(), aggregates.size());
            return new GroupBy(child, groupColumns, aggregates);
        }

        @Override
        public LogicalPlan visitRenameColumns(RelalgNode.RenameColumns node) {
            RenameColumns rename = new RenameColumns(translateNode(node.child()));
            for (RelalgNode.Renaming renaming : node.arg()) {
                rename.addRenaming(renaming.dst(), renaming.src().name(), renaming.src().relAlias());
            }
            return rename;
        }

        @Override
        public LogicalPlan visitRenameRelation(RelalgNode.RenameRelation node) {
            return new RenameRelation(translateNode(node.child()), node.newRelAlias());
        }

        @Override
        public LogicalPlan visitThetaJoin(RelalgNode.ThetaJoin node) {
            JoinCondition condition = new JoinCondition.Theta(ValueExprTranslator.translate(node.arg()));
            LogicalPlan left = translateNode(node.child());
            LogicalPlan right = translateNode(node.child2());
            return new InnerJoin(left, right, condition);
        }

        @Override
        public LogicalPlan visitOuterJoin(RelalgNode.OuterJoin node) {
            LogicalPlan left = translateNode(node.child());
            LogicalPlan right = translateNode(node.child2());
            JoinCondition condition = JoinConditions.normalize(node.arg());
            logger.debug("Creating {} outer join with condition: {}", node.kind(), condition);
            return switch (node.kind()) {
                case LEFT  -> new LeftOuterJoin(left, right, condition);
                case RIGHT -> new RightOuterJoin(left, right, condition);
                case FULL  -> new FullOuterJoin(left, right, condition);
            };
        }

        @Override
        public LogicalPlan visitBinaryOperation(RelalgNode.BinaryOperation node) {
            LogicalPlan left = translateNode(node.child());
            LogicalPlan right = translateNode(node.child2());
            logger.debug("Creating binary operation: {}", node.operator());
            return switch (node.operator()) {
                case UNION           -> new Union(left, right);
                case INTERSECT       -> new Intersect(left, right);
                case DIFFERENCE      -> new Difference(left, right);
                case DIVISION        -> new Division(left, right);
                case CROSS_JOIN      -> new CrossJoin(left, right);
                case NATURAL_JOIN    -> new InnerJoin(left, right, JoinCondition.natural());
                case LEFT_SEMI_JOIN  -> new SemiJoin(left, right, true);
                case RIGHT_SEMI_JOIN -> new SemiJoin(left, right, false);
                case ANTI_JOIN       -> new AntiJoin(left, right);
            };
        }
    }
}
