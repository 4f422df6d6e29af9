package com.relalg.generator;

import com.relalg.ast.CodeInfo;
import com.relalg.expression.ColumnValue;
import com.relalg.expression.GenericValueExpr;
import com.relalg.logical.AggregateFunction;
import com.relalg.logical.AntiJoin;
import com.relalg.logical.Column;
import com.relalg.logical.CrossJoin;
import com.relalg.logical.Difference;
import com.relalg.logical.Division;
import com.relalg.logical.GroupBy;
import com.relalg.logical.InnerJoin;
import com.relalg.logical.JoinCondition;
import com.relalg.logical.LeftOuterJoin;
import com.relalg.logical.LogicalPlan;
import com.relalg.logical.OrderBy;
import com.relalg.logical.Projection;
import com.relalg.logical.Relation;
import com.relalg.logical.RenameColumns;
import com.relalg.logical.RenameRelation;
import com.relalg.logical.Selection;
import com.relalg.logical.SemiJoin;
import com.relalg.logical.Union;
import com.relalg.test.TestCategories;
import com.relalg.translate.TranslatorConfig;
import com.relalg.types.BooleanType;
import com.relalg.types.NumberType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RelalgFormatter}.
 */
@TestCategories.Unit
@DisplayName("Relational Algebra Formatter Tests")
public class RelalgFormatterTest {

    private RelalgFormatter formatter;
    private Relation r;
    private Relation s;

    @BeforeEach
    void setUp() {
        formatter = new RelalgFormatter();
        r = Relation.of("R", "a:number", "b:string");
        s = Relation.of("S", "b:string", "d:number");
    }

    private static GenericValueExpr greaterThan(String column, long value) {
        return GenericValueExpr.call(BooleanType.get(), ">",
            new ColumnValue(column, null), GenericValueExpr.constant(NumberType.get(), value));
    }

    @Nested
    @DisplayName("Unary Operator Tests")
    class UnaryOperatorTests {

        @Test
        @DisplayName("Relation renders as its name")
        void testRelation() {
            assertThat(formatter.format(r)).isEqualTo("R");
        }

        @Test
        @DisplayName("Inline relation renders as its definition")
        void testInlineRelation() {
            r.header().setMetaData(TranslatorConfig.META_INLINE_DEFINITION, "{a, b\n1, 'x'}");

            assertThat(formatter.format(r)).isEqualTo("{a, b\n1, 'x'}");
        }

        @Test
        @DisplayName("Nested unary operators parenthesize their operand")
        void testNestedUnary() {
            LogicalPlan plan = new Projection(new Selection(r, greaterThan("a", 1)), List.of(Column.of("a")));

            assertThat(formatter.format(plan)).isEqualTo("π a (σ a > 1 R)");
        }

        @Test
        @DisplayName("Order-by, group-by and renames")
        void testOtherUnaryOperators() {
            OrderBy orderBy = new OrderBy(r, List.of(Column.of("a"), new Column("b", "R")), List.of(true, false));
            GroupBy groupBy = new GroupBy(r, List.of(Column.of("b")), List.of(
                new AggregateFunction(AggregateFunction.Function.COUNT_ALL, null, "n"),
                new AggregateFunction(AggregateFunction.Function.SUM, Column.of("a"), "total")));
            RenameColumns renameColumns = new RenameColumns(r);
            renameColumns.addRenaming("x", "a", null);

            assertThat(formatter.format(orderBy)).isEqualTo("τ a asc, R.b desc R");
            assertThat(formatter.format(groupBy)).isEqualTo("γ b; count(*)→n, sum(a)→total R");
            assertThat(formatter.format(renameColumns)).isEqualTo("ρ x←a R");
            assertThat(formatter.format(new RenameRelation(r, "q"))).isEqualTo("ρ q R");
        }
    }

    @Nested
    @DisplayName("Binary Operator Tests")
    class BinaryOperatorTests {

        @Test
        @DisplayName("Joins render infix with their condition")
        void testJoins() {
            GenericValueExpr on = GenericValueExpr.call(BooleanType.get(), "=",
                new ColumnValue("b", "R"), new ColumnValue("b", "S"));

            assertThat(formatter.format(new CrossJoin(r, s))).isEqualTo("R ⨯ S");
            assertThat(formatter.format(new InnerJoin(r, s, JoinCondition.natural()))).isEqualTo("R ⨝ S");
            assertThat(formatter.format(new InnerJoin(r, s, new JoinCondition.Theta(on)))).isEqualTo("R ⨝ R.b = S.b S");
            assertThat(formatter.format(new LeftOuterJoin(r, s, new JoinCondition.Natural(List.of("b")))))
                .isEqualTo("R ⟕ [b] S");
            assertThat(formatter.format(new SemiJoin(r, s, true))).isEqualTo("R ⋉ S");
            assertThat(formatter.format(new SemiJoin(r, s, false))).isEqualTo("R ⋊ S");
            assertThat(formatter.format(new AntiJoin(r, s))).isEqualTo("R ▷ S");
        }

        @Test
        @DisplayName("Set operators and division")
        void testSetOperators() {
            Relation t = Relation.of("T", "b:string", "d:number");
            Relation d = Relation.of("D", "b:string");

            assertThat(formatter.format(new Union(s, t))).isEqualTo("S ∪ T");
            assertThat(formatter.format(new Difference(s, t))).isEqualTo("S - T");
            assertThat(formatter.format(new Division(s, d))).isEqualTo("S ÷ D");
        }

        @Test
        @DisplayName("Nested binary operands are parenthesized")
        void testNestedBinary() {
            Relation t = Relation.of("T", "b:string", "d:number");
            LogicalPlan plan = new Union(new CrossJoin(s, t), new CrossJoin(t, s));

            assertThat(formatter.format(plan)).isEqualTo("(S ⨯ T) ∪ (T ⨯ S)");
        }
    }

    @Nested
    @DisplayName("Parenthesization Tests")
    class ParenthesizationTests {

        @Test
        @DisplayName("Parenthesized nodes are not wrapped twice")
        void testParenthesizedOperand() {
            CrossJoin join = new CrossJoin(r, s);
            join.header().setWrappedInParentheses(true);
            join.header().setCodeInfo(CodeInfo.of("(R ⨯ S)", 0));

            assertThat(formatter.format(new Selection(join, greaterThan("a", 1)))).isEqualTo("σ a > 1 (R ⨯ S)");
        }

        @Test
        @DisplayName("Parenthesized root keeps its parentheses")
        void testParenthesizedRoot() {
            r.header().setWrappedInParentheses(true);

            assertThat(formatter.format(r)).isEqualTo("(R)");
        }

        @Test
        @DisplayName("Null plan is rejected")
        void testNullPlan() {
            assertThatThrownBy(() -> formatter.format(null)).isInstanceOf(NullPointerException.class);
        }
    }
}
