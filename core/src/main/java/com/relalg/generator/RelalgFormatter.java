package com.relalg.generator;

import com.relalg.logical.AntiJoin;
import com.relalg.logical.CrossJoin;
import com.relalg.logical.Difference;
import com.relalg.logical.Division;
import com.relalg.logical.FullOuterJoin;
import com.relalg.logical.GroupBy;
import com.relalg.logical.InnerJoin;
import com.relalg.logical.Intersect;
import com.relalg.logical.Join;
import com.relalg.logical.JoinCondition;
import com.relalg.logical.LeftOuterJoin;
import com.relalg.logical.LogicalPlan;
import com.relalg.logical.OrderBy;
import com.relalg.logical.PlanVisitor;
import com.relalg.logical.Projection;
import com.relalg.logical.Relation;
import com.relalg.logical.RenameColumns;
import com.relalg.logical.RenameRelation;
import com.relalg.logical.RightOuterJoin;
import com.relalg.logical.Selection;
import com.relalg.logical.SemiJoin;
import com.relalg.logical.SetOperation;
import com.relalg.logical.Union;
import com.relalg.translate.TranslatorConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders operator trees as relational-algebra text.
 *
 * <p>Unary operators are written prefix with their argument list, binary
 * operators infix. Nodes that were parenthesized in the query are parenthesized
 * again; operands are parenthesized where the text would otherwise be ambiguous.
 * Inline relations are rendered by their source definition.
 *
 * <p>Example usage:
 * <pre>
 *   LogicalPlan plan = translator.translate(root);
 *   String text = new RelalgFormatter().format(plan);
 *   // π R.a (σ R.b > 1 R)
 * </pre>
 *
 * <p>The formatter holds no state and may be shared.
 */
public class RelalgFormatter implements PlanVisitor<String> {

    /**
     * Formats an operator tree.
     *
     * @param plan the tree root
     * @return the RA text
     * @throws NullPointerException if plan is null
     */
    public String format(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        String text = plan.accept(this);
        return plan.header().wrappedInParentheses() ? "(" + text + ")" : text;
    }

    // ==================== Nullary / unary ====================

    @Override
    public String visitRelation(Relation node) {
        Object definition = node.header().metaData(TranslatorConfig.META_INLINE_DEFINITION);
        return definition != null ? definition.toString() : node.name();
    }

    @Override
    public String visitSelection(Selection node) {
        return unary("σ " + node.condition().format(), node.child());
    }

    @Override
    public String visitProjection(Projection node) {
        return unary("π " + join(node.columns()), node.child());
    }

    @Override
    public String visitOrderBy(OrderBy node) {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < node.orderColumns().size(); i++) {
            keys.add(node.orderColumns().get(i) + (node.ascending().get(i) ? " asc" : " desc"));
        }
        return unary("τ " + String.join(", ", keys), node.child());
    }

    @Override
    public String visitGroupBy(GroupBy node) {
        return unary("γ " + join(node.groupColumns()) + "; " + join(node.aggregateFunctions()), node.child());
    }

    @Override
    public String visitRenameColumns(RenameColumns node) {
        return unary("ρ " + join(node.renamings()), node.child());
    }

    @Override
    public String visitRenameRelation(RenameRelation node) {
        return unary("ρ " + node.newRelAlias(), node.child());
    }

    // ==================== Joins ====================

    @Override
    public String visitCrossJoin(CrossJoin node) {
        return binary(node.left(), "⨯", node.right());
    }

    @Override
    public String visitInnerJoin(InnerJoin node) {
        return binary(node.left(), "⨝" + condition(node.condition()), node.right());
    }

    @Override
    public String visitLeftOuterJoin(LeftOuterJoin node) {
        return binary(node.left(), "⟕" + condition(node.condition()), node.right());
    }

    @Override
    public String visitRightOuterJoin(RightOuterJoin node) {
        return binary(node.left(), "⟖" + condition(node.condition()), node.right());
    }

    @Override
    public String visitFullOuterJoin(FullOuterJoin node) {
        return binary(node.left(), "⟗" + condition(node.condition()), node.right());
    }

    @Override
    public String visitSemiJoin(SemiJoin node) {
        return binary(node.left(), node.isLeftSemi() ? "⋉" : "⋊", node.right());
    }

    @Override
    public String visitAntiJoin(AntiJoin node) {
        return binary(node.left(), "▷", node.right());
    }

    // ==================== Set operations ====================

    @Override
    public String visitUnion(Union node) {
        return setOperation(node);
    }

    @Override
    public String visitIntersect(Intersect node) {
        return setOperation(node);
    }

    @Override
    public String visitDifference(Difference node) {
        return setOperation(node);
    }

    @Override
    public String visitDivision(Division node) {
        return binary(node.left(), "÷", node.right());
    }

    // ==================== Helpers ====================

    private String setOperation(SetOperation node) {
        return binary(node.left(), node.symbol(), node.right());
    }

    private String unary(String operator, LogicalPlan child) {
        String operand = format(child);
        if (child instanceof Relation || child.header().wrappedInParentheses()) {
            return operator + " " + operand;
        }
        return operator + " (" + operand + ")";
    }

    private String binary(LogicalPlan left, String operator, LogicalPlan right) {
        return operand(left) + " " + operator + " " + operand(right);
    }

    private String operand(LogicalPlan child) {
        String text = format(child);
        boolean infix = child instanceof Join || child instanceof SetOperation || child instanceof Division;
        return infix && !child.header().wrappedInParentheses() ? "(" + text + ")" : text;
    }

    private static String condition(JoinCondition condition) {
        if (condition instanceof JoinCondition.Theta theta) {
            return " " + theta.joinExpression().format();
        }
        JoinCondition.Natural natural = (JoinCondition.Natural) condition;
        return natural.isRestricted() ? " " + natural.restrictToColumns() : "";
    }

    private static String join(List<?> items) {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
