package com.relalg.translate;

import com.relalg.ast.AggregateCall;
import com.relalg.ast.AstInfo;
import com.relalg.ast.ColumnName;
import com.relalg.ast.JoinPredicate;
import com.relalg.ast.OrderByItem;
import com.relalg.ast.ValueExprNode;
import com.relalg.ast.relalg.ProjectionItem;
import com.relalg.ast.relalg.RelalgNode;
import com.relalg.ast.relalg.RelalgRoot;
import com.relalg.exception.InternalTranslationException;
import com.relalg.exception.TranslationException;
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
import com.relalg.test.TestBase;
import com.relalg.test.TestCategories;
import com.relalg.types.BooleanType;
import com.relalg.types.DateType;
import com.relalg.types.NumberType;
import com.relalg.types.SchemaColumn;
import com.relalg.types.StringType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;

import static com.relalg.test.AstFixtures.at;
import static com.relalg.test.AstFixtures.bool;
import static com.relalg.test.AstFixtures.catalog;
import static com.relalg.test.AstFixtures.column;
import static com.relalg.test.AstFixtures.number;
import static com.relalg.test.AstFixtures.parenthesized;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link RelalgAstTranslator}: one-to-one mapping of every RA node
 * kind, annotation of each node, and inline relations.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Relational Algebra Translator Tests")
public class RelalgAstTranslatorTest extends TestBase {

    private RelationCatalog catalog;
    private RelalgAstTranslator translator;

    @BeforeEach
    void setUp() {
        catalog = catalog();
        translator = new RelalgAstTranslator(catalog);
    }

    private LogicalPlan translate(RelalgNode node) {
        return translator.translate(new RelalgRoot(node));
    }

    private static RelalgNode.Relation rel(String name) {
        return new RelalgNode.Relation(name, at(name));
    }

    private static RelalgNode.BinaryOperation binary(RelalgNode.BinaryOperator operator, String left, String right) {
        return new RelalgNode.BinaryOperation(operator, rel(left), rel(right), at(left + " op " + right));
    }

    // ==================== Relations ====================

    @Nested
    @DisplayName("Relation Tests")
    class RelationTests {

        @Test
        @DisplayName("Relation reference resolves to a positioned catalog copy")
        void testRelationReference() {
            LogicalPlan plan = translate(new RelalgNode.Relation("R", at("R", 3)));

            assertThat(plan).isInstanceOf(Relation.class);
            assertThat(plan.header().codeInfo().start().offset()).isEqualTo(3);
            assertThat(((Relation) plan).rows()).hasSize(5);
            assertThat(plan).isNotSameAs(catalog.lookup("R", null));
        }

        @Test
        @DisplayName("Unknown relation fails with its name")
        void testRelationNotFound() {
            TranslationException e = catchThrowableOfType(() -> translate(rel("ghost")), TranslationException.class);

            assertThat(e.messageKey()).isEqualTo(TranslatorConfig.ERROR_RELATION_NOT_FOUND);
            assertThat(e.params()).containsEntry("name", "ghost");
            assertThat(e.codeInfo().text()).isEqualTo("ghost");
        }

        @Test
        @DisplayName("Inline table builds a relation with metadata")
        void testInlineTable() {
            String source = "{ X.a:number, X.b:string, X.c:date, X.d:boolean\n 1, 'x', 2020-01-01, true }";
            RelalgNode.Table table = new RelalgNode.Table("X",
                List.of(
                    new RelalgNode.TableColumn("a", "X", "number"),
                    new RelalgNode.TableColumn("b", "X", "string"),
                    new RelalgNode.TableColumn("c", "X", "date"),
                    new RelalgNode.TableColumn("d", "X", "boolean")),
                List.of(Arrays.asList(1, "x", "2020-01-01", true)),
                at(source));

            Relation relation = (Relation) translate(table);

            assertThat(relation.name()).isEqualTo("X");
            assertThat(relation.schema().columns()).containsExactly(
                new SchemaColumn("a", "X", NumberType.get()),
                new SchemaColumn("b", "X", StringType.get()),
                new SchemaColumn("c", "X", DateType.get()),
                new SchemaColumn("d", "X", BooleanType.get()));
            assertThat(relation.rows()).containsExactly(Arrays.asList(1, "x", "2020-01-01", true));
            assertThat(relation.header().metaData(TranslatorConfig.META_INLINE_RELATION)).isEqualTo(true);
            assertThat(relation.header().metaData(TranslatorConfig.META_INLINE_DEFINITION)).isEqualTo(source);
        }

        @Test
        @DisplayName("Inline table with an unknown column type is a defect")
        void testInlineTableUnknownType() {
            RelalgNode.Table table = new RelalgNode.Table("X",
                List.of(new RelalgNode.TableColumn("a", "X", "blob")), List.of(), at("{ a:blob }"));

            assertThatThrownBy(() -> translate(table)).isInstanceOf(InternalTranslationException.class);
        }
    }

    // ==================== Unary operators ====================

    @Nested
    @DisplayName("Unary Operator Tests")
    class UnaryOperatorTests {

        @Test
        @DisplayName("Selection translates its condition")
        void testSelection() {
            RelalgNode node = new RelalgNode.Selection(rel("R"), bool(">", column("a"), number(3)), at("σ a > 3 (R)"));

            Selection selection = (Selection) translate(node);

            assertThat(selection.condition().format()).isEqualTo("a > 3");
            assertThat(selection.child()).isInstanceOf(Relation.class);
            assertThat(selection.header().codeInfo().text()).isEqualTo("σ a > 3 (R)");
        }

        @Test
        @DisplayName("Projection keeps plain and computed columns in order")
        void testProjection() {
            ValueExprNode doubled = ValueExprNode.call("number", "*", at("a * 2"), column("a"), number(2));
            RelalgNode node = new RelalgNode.Projection(rel("R"), List.of(
                new ProjectionItem.Column("b", "R"),
                new ProjectionItem.NamedExpression("x", null, doubled)), at("π R.b, a * 2 → x (R)"));

            Projection projection = (Projection) translate(node);

            assertThat(projection.columns()).hasSize(2);
            assertThat(projection.columns().get(0)).isEqualTo(new Column("b", "R"));
            ProjectionColumn.Named named = (ProjectionColumn.Named) projection.columns().get(1);
            assertThat(named.name()).isEqualTo("x");
            assertThat(named.child().format()).isEqualTo("a * 2");
            assertThat(projection.schema().columns())
                .extracting(SchemaColumn::qualifiedName)
                .containsExactly("R.b", "x");
        }

        @Test
        @DisplayName("Order-by keeps columns and directions in parallel")
        void testOrderBy() {
            RelalgNode node = new RelalgNode.OrderBy(rel("R"), List.of(
                new OrderByItem(ColumnName.of("b"), true),
                new OrderByItem(new ColumnName("a", "R"), false)), at("τ b, R.a desc (R)"));

            OrderBy orderBy = (OrderBy) translate(node);

            assertThat(orderBy.orderColumns()).containsExactly(new Column("b", null), new Column("a", "R"));
            assertThat(orderBy.ascending()).containsExactly(true, false);
        }

        @Test
        @DisplayName("Group-by maps grouping columns and aggregates")
        void testGroupBy() {
            RelalgNode node = new RelalgNode.GroupBy(rel("R"),
                List.of(ColumnName.of("b")),
                List.of(
                    new AggregateCall("COUNT_ALL", null, "n", at("count(*)")),
                    new AggregateCall("min", ColumnName.of("c"), "m", at("min(c)"))),
                at("γ b; count(*)→n, min(c)→m (R)"));

            GroupBy groupBy = (GroupBy) translate(node);

            assertThat(groupBy.groupColumns()).containsExactly(new Column("b", null));
            assertThat(groupBy.aggregateFunctions()).containsExactly(
                new AggregateFunction(AggregateFunction.Function.COUNT_ALL, null, "n"),
                new AggregateFunction(AggregateFunction.Function.MIN, new Column("c", null), "m"));
            assertThat(groupBy.schema().columns()).containsExactly(
                new SchemaColumn("b", "R", StringType.get()),
                new SchemaColumn("n", null, NumberType.get()),
                new SchemaColumn("m", null, StringType.get()));
        }

        @Test
        @DisplayName("Unknown aggregate function is a defect")
        void testUnknownAggregate() {
            RelalgNode node = new RelalgNode.GroupBy(rel("R"), List.of(),
                List.of(new AggregateCall("median", ColumnName.of("a"), "m", at("median(a)"))), at("γ ..."));

            assertThatThrownBy(() -> translate(node))
                .isInstanceOf(InternalTranslationException.class)
                .hasMessageContaining("median");
        }

        @Test
        @DisplayName("Column renaming registers every renaming")
        void testRenameColumns() {
            RelalgNode node = new RelalgNode.RenameColumns(rel("R"), List.of(
                new RelalgNode.Renaming("x", ColumnName.of("a")),
                new RelalgNode.Renaming("y", new ColumnName("b", "R"))), at("ρ x←a, y←R.b (R)"));

            RenameColumns rename = (RenameColumns) translate(node);

            assertThat(rename.renamings()).containsExactly(
                new RenameColumns.Renaming("x", new Column("a", null)),
                new RenameColumns.Renaming("y", new Column("b", "R")));
            assertThat(rename.schema().columns())
                .extracting(SchemaColumn::qualifiedName)
                .containsExactly("R.x", "R.y", "R.c");
        }

        @Test
        @DisplayName("Relation renaming requalifies all columns")
        void testRenameRelation() {
            RenameRelation rename = (RenameRelation) translate(new RelalgNode.RenameRelation(rel("S"), "s", at("ρ s (S)")));

            assertThat(rename.newRelAlias()).isEqualTo("s");
            assertThat(rename.schema().columns()).extracting(SchemaColumn::relAlias).containsOnly("s");
        }
    }

    // ==================== Binary operators ====================

    @Nested
    @DisplayName("Binary Operator Tests")
    class BinaryOperatorTests {

        @Test
        @DisplayName("Theta join becomes an inner join on the condition")
        void testThetaJoin() {
            RelalgNode node = new RelalgNode.ThetaJoin(rel("R"), rel("S"),
                bool("=", column("R", "b"), column("S", "b")), at("R ⨝ R.b = S.b S"));

            InnerJoin join = (InnerJoin) translate(node);

            assertThat(join.condition()).isInstanceOf(JoinCondition.Theta.class);
            assertThat(join.condition().toString()).isEqualTo("R.b = S.b");
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(RelalgNode.BinaryOperator.class)
        @DisplayName("Every binary operator maps to one node kind")
        void testBinaryOperatorMapping(RelalgNode.BinaryOperator operator) {
            String right = operator == RelalgNode.BinaryOperator.DIVISION ? "T" : "S";
            LogicalPlan plan = translate(binary(operator, "S", right));

            Class<?> expected = switch (operator) {
                case UNION -> Union.class;
                case INTERSECT -> Intersect.class;
                case DIFFERENCE -> Difference.class;
                case DIVISION -> Division.class;
                case CROSS_JOIN -> CrossJoin.class;
                case NATURAL_JOIN -> InnerJoin.class;
                case LEFT_SEMI_JOIN, RIGHT_SEMI_JOIN -> SemiJoin.class;
                case ANTI_JOIN -> AntiJoin.class;
            };
            assertThat(plan).isInstanceOf(expected);
            assertThat(plan.children()).hasSize(2);
            assertThat(plan.header().codeInfo()).isNotNull();
        }

        @Test
        @DisplayName("Semi joins carry their orientation")
        void testSemiJoinOrientation() {
            SemiJoin left = (SemiJoin) translate(binary(RelalgNode.BinaryOperator.LEFT_SEMI_JOIN, "R", "S"));
            SemiJoin right = (SemiJoin) translate(binary(RelalgNode.BinaryOperator.RIGHT_SEMI_JOIN, "R", "S"));

            assertThat(left.isLeftSemi()).isTrue();
            assertThat(left.schema().size()).isEqualTo(3);
            assertThat(right.isLeftSemi()).isFalse();
            assertThat(right.schema().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Natural join binary operator uses all shared columns")
        void testNaturalJoin() {
            InnerJoin join = (InnerJoin) translate(binary(RelalgNode.BinaryOperator.NATURAL_JOIN, "R", "S"));

            assertThat(join.condition()).isEqualTo(JoinCondition.natural());
        }

        @Test
        @DisplayName("Outer joins map kind and condition")
        void testOuterJoins() {
            RelalgNode left = new RelalgNode.OuterJoin(RelalgNode.OuterJoinKind.LEFT, rel("S"), rel("T"),
                null, at("S ⟕ T"));
            RelalgNode right = new RelalgNode.OuterJoin(RelalgNode.OuterJoinKind.RIGHT, rel("S"), rel("T"),
                new JoinPredicate.Using(List.of("b")), at("S ⟖ T"));
            RelalgNode full = new RelalgNode.OuterJoin(RelalgNode.OuterJoinKind.FULL, rel("R"), rel("S"),
                new JoinPredicate.On(bool("=", column("R", "b"), column("S", "b"))), at("R ⟗ R.b = S.b S"));

            LeftOuterJoin leftJoin = (LeftOuterJoin) translate(left);
            RightOuterJoin rightJoin = (RightOuterJoin) translate(right);
            FullOuterJoin fullJoin = (FullOuterJoin) translate(full);

            assertThat(leftJoin.condition()).isEqualTo(JoinCondition.natural());
            assertThat(rightJoin.condition()).isEqualTo(new JoinCondition.Natural(List.of("b")));
            assertThat(fullJoin.condition()).isInstanceOf(JoinCondition.Theta.class);
        }
    }

    // ==================== Annotations ====================

    @Nested
    @DisplayName("Annotation Tests")
    class AnnotationTests {

        @Test
        @DisplayName("Parentheses are carried over")
        void testParentheses() {
            RelalgNode node = new RelalgNode.Selection(
                new RelalgNode.Relation("R", parenthesized("(R)")),
                bool(">", column("a"), number(3)),
                at("σ a > 3 (R)"));

            Selection selection = (Selection) translate(node);

            assertThat(selection.header().wrappedInParentheses()).isFalse();
            assertThat(selection.child().header().wrappedInParentheses()).isTrue();
        }

        @Test
        @DisplayName("AST metadata is copied onto the node")
        void testMetaData() {
            AstInfo info = at("ρ s (S)").withMetaData("fromVariable", "V");
            LogicalPlan plan = translate(new RelalgNode.RenameRelation(rel("S"), "s", info));

            assertThat(plan.header().metaData()).containsEntry("fromVariable", "V");
        }

        @Test
        @DisplayName("Every node of a nested query is positioned")
        void testNestedPositions() {
            RelalgNode node = new RelalgNode.Projection(
                new RelalgNode.ThetaJoin(rel("R"), new RelalgNode.RenameRelation(rel("R"), "r2", at("ρ r2 (R)")),
                    bool("=", column("R", "a"), column("r2", "a")), at("R ⨝ ... ")),
                List.of(new ProjectionItem.Column("a", "R")),
                at("π R.a (...)"));

            LogicalPlan plan = translate(node);

            assertPositioned(plan);
            plan.check();
        }

        @Test
        @DisplayName("Missing source position is a defect")
        void testMissingCodeInfo() {
            RelalgNode node = new RelalgNode.Relation("R", new AstInfo(null, false, null));

            assertThatThrownBy(() -> translate(node)).isInstanceOf(InternalTranslationException.class);
        }

        private void assertPositioned(LogicalPlan node) {
            assertThat(node.header().codeInfo()).as("position of %s", node).isNotNull();
            node.children().forEach(this::assertPositioned);
        }
    }
}
