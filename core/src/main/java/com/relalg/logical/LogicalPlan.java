package com.relalg.logical;

import com.relalg.ast.CodeInfo;
import com.relalg.exception.TranslationException;
import com.relalg.types.Schema;
import com.relalg.types.SchemaColumn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Base class for all nodes of the relational-algebra operator tree.
 *
 * <p>Each node has zero, one or two children and derives an output schema from
 * them. Nodes own their children exclusively: a tree never shares a node between
 * two parents and never contains cycles.
 *
 * <p>The node kinds form a closed hierarchy. Consumers dispatch through
 * {@link #accept(PlanVisitor)}, which makes every new kind a compile-time
 * obligation for each visitor.
 *
 * <p>The annotations shared by all kinds (source position, metadata, warnings,
 * parenthesization) live in one {@link NodeHeader} embedded in every node.
 */
public abstract sealed class LogicalPlan
    permits Relation, Selection, Projection, OrderBy, GroupBy, RenameColumns, RenameRelation,
            Join, SetOperation, Division {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Annotations of this node */
    private final NodeHeader header = new NodeHeader();

    /** Output schema of this node, derived on first use */
    private Schema schema;

    /**
     * Creates a leaf node.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a node with two children.
     *
     * @param left the left child
     * @param right the right child
     */
    protected LogicalPlan(LogicalPlan left, LogicalPlan right) {
        this.children = List.of(left, right);
    }

    /**
     * Derives the output schema of this node from its children's schemas.
     *
     * @return the output schema
     * @throws TranslationException if the children's schemas conflict
     */
    protected abstract Schema inferSchema();

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor the visitor
     * @param <R> the result type
     * @return the visitor's result
     */
    public abstract <R> R accept(PlanVisitor<R> visitor);

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the annotations of this node.
     *
     * @return the node header
     */
    public NodeHeader header() {
        return header;
    }

    /**
     * Returns the output schema of this node.
     *
     * <p>The schema is derived on first access and cached.
     *
     * @return the output schema
     * @throws TranslationException if the subtree's schemas conflict
     */
    public Schema schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Validates the schema of the whole subtree, children first, so that the
     * innermost conflict is the one reported.
     *
     * @throws TranslationException if a node's schema cannot be derived
     */
    public void check() {
        for (LogicalPlan child : children) {
            child.check();
        }
        schema();
    }

    // ==================== Schema helpers ====================

    /**
     * Resolves a column reference against a schema.
     *
     * @param input the schema to search
     * @param column the referenced column
     * @return the index of the column in the schema
     * @throws TranslationException if the column is missing or ambiguous
     */
    protected int resolve(Schema input, Column column) {
        List<Integer> matches = input.find(column.name(), column.relAlias());
        if (matches.isEmpty()) {
            throw error("db.messages.exec.error-column-not-found", "column", column);
        }
        if (matches.size() > 1) {
            throw error("db.messages.exec.error-column-ambiguous", "column", column);
        }
        return matches.get(0);
    }

    /**
     * Rejects schemas containing the same qualified column twice.
     *
     * @param columns the derived columns
     * @return the schema of those columns
     * @throws TranslationException if a qualified name repeats
     */
    protected Schema uniqueSchema(List<SchemaColumn> columns) {
        Set<String> seen = new HashSet<>();
        for (SchemaColumn column : columns) {
            if (!seen.add(column.qualifiedName())) {
                throw error("db.messages.exec.error-schema-not-unique", "column", column.qualifiedName());
            }
        }
        return new Schema(columns);
    }

    /**
     * Creates a translation error positioned at this node.
     *
     * @param key the message key
     * @param param the parameter name
     * @param value the parameter value
     * @return the exception to throw
     */
    protected TranslationException error(String key, String param, Object value) {
        CodeInfo codeInfo = header.codeInfo();
        return new TranslationException(key, param, String.valueOf(value), codeInfo);
    }

    /**
     * Returns the children's schemas concatenated, left first.
     *
     * @return the concatenated columns
     */
    protected List<SchemaColumn> concatenatedChildColumns() {
        List<SchemaColumn> columns = new ArrayList<>();
        for (LogicalPlan child : children) {
            columns.addAll(child.schema().columns());
        }
        return columns;
    }

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
