package com.relalg.logical;

/**
 * Visitor over the operator-tree node kinds.
 *
 * @param <R> the result type
 */
public interface PlanVisitor<R> {

    R visitRelation(Relation node);

    R visitSelection(Selection node);

    R visitProjection(Projection node);

    R visitOrderBy(OrderBy node);

    R visitGroupBy(GroupBy node);

    R visitRenameColumns(RenameColumns node);

    R visitRenameRelation(RenameRelation node);

    R visitCrossJoin(CrossJoin node);

    R visitInnerJoin(InnerJoin node);

    R visitLeftOuterJoin(LeftOuterJoin node);

    R visitRightOuterJoin(RightOuterJoin node);

    R visitFullOuterJoin(FullOuterJoin node);

    R visitSemiJoin(SemiJoin node);

    R visitAntiJoin(AntiJoin node);

    R visitUnion(Union node);

    R visitIntersect(Intersect node);

    R visitDifference(Difference node);

    R visitDivision(Division node);
}
