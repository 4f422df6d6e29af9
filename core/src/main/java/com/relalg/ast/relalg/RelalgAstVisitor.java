package com.relalg.ast.relalg;

/**
 * Visitor over the relational-algebra AST node kinds.
 *
 * @param <R> the result type
 */
public interface RelalgAstVisitor<R> {

    R visitRelation(RelalgNode.Relation node);

    R visitTable(RelalgNode.Table node);

    R visitSelection(RelalgNode.Selection node);

    R visitProjection(RelalgNode.Projection node);

    R visitOrderBy(RelalgNode.OrderBy node);

    R visitGroupBy(RelalgNode.GroupBy node);

    R visitRenameColumns(RelalgNode.RenameColumns node);

    R visitRenameRelation(RelalgNode.RenameRelation node);

    R visitThetaJoin(RelalgNode.ThetaJoin node);

    R visitOuterJoin(RelalgNode.OuterJoin node);

    R visitBinaryOperation(RelalgNode.BinaryOperation node);
}
