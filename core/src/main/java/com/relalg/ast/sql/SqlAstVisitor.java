package com.relalg.ast.sql;

/**
 * Visitor over the SQL AST node kinds.
 *
 * @param <R> the result type
 */
public interface SqlAstVisitor<R> {

    R visitRelation(SqlNode.Relation node);

    R visitStatement(SqlNode.Statement node);

    R visitRenameRelation(SqlNode.RenameRelation node);

    R visitRelationFromSubstatement(SqlNode.RelationFromSubstatement node);

    R visitJoin(SqlNode.Join node);

    R visitCrossJoin(SqlNode.CrossJoin node);

    R visitNaturalJoin(SqlNode.NaturalJoin node);

    R visitSetOperation(SqlNode.SetOperation node);

    R visitOrderBy(SqlNode.OrderBy node);

    R visitLimit(SqlNode.Limit node);
}
