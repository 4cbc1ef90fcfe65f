package org.ontodsl.compiler.frontend;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.diagnostics.Diagnostic;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Lexer;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.Parser;
import org.ontodsl.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.IdentifierNode;
import org.ontodsl.compiler.frontend.parser.ast.NumberLiteralNode;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.parser.ast.StringLiteralNode;
import org.ontodsl.compiler.frontend.parser.ast.ValueShape;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregationFunction;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.parser.features.load.LoadNode;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeNode;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertNode;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser} and its expression parser.
 * Each statement form is parsed into its node, expressions follow operator precedence,
 * and the first syntax error ends the parse with a positioned diagnostic.
 */
public class ParserTest {

    private Program parse(String source, DiagnosticsEngine diagnostics) {
        List<Token> tokens = new Lexer(source, diagnostics, "test.dsl").scanTokens();
        return new Parser(tokens, diagnostics, "test.dsl", Parser.DEFAULT_MAX_EXPRESSION_DEPTH).parse();
    }

    private ExpressionNode parseOutput(String expression) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = parse("ENRICH a WITH t MATCH ON k OUTPUT e AS { x: " + expression + " }", diagnostics);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return ((EnrichNode) program.statements().get(0)).outputs().get(0).expression();
    }

    @Test
    @Tag("unit")
    void testLoadWithColumnMap() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        Program program = parse("LOAD_CSV \"level1.csv\" AS measurement MAP_COLUMNS { factory -> factory_id, type -> fuel }", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.statements()).hasSize(1);
        LoadNode load = (LoadNode) program.statements().get(0);
        assertThat(load.pathValue()).isEqualTo("level1.csv");
        assertThat(load.alias().text()).isEqualTo("measurement");
        assertThat(load.hasColumnMap()).isTrue();
        assertThat(load.columns()).extracting(c -> c.source().text() + "->" + c.target().text())
                .containsExactly("factory->factory_id", "type->fuel");
    }

    /**
     * Verifies that commas between list entries are optional and a missing map is allowed.
     */
    @Test
    @Tag("unit")
    void testOptionalCommasAndMissingColumnMap() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = String.join("\n",
                "LOAD_CSV \"raw.csv\" AS raw",
                "AGGREGATE raw BY [a b] INTO t AGG_COUNT() AS n");

        Program program = parse(source, diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(((LoadNode) program.statements().get(0)).hasColumnMap()).isFalse();
        AggregateNode aggregate = (AggregateNode) program.statements().get(1);
        assertThat(aggregate.groupKeys()).extracting(Token::text).containsExactly("a", "b");
    }

    @Test
    @Tag("unit")
    void testNormalizeWithStringAndBareValues() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        Program program = parse("NORMALIZE measurement { fuel: {\"gass\": \"gas\", diesl: diesel}, unit: {kwh: \"kWh\"} }", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        NormalizeNode normalize = (NormalizeNode) program.statements().get(0);
        assertThat(normalize.target().text()).isEqualTo("measurement");
        assertThat(normalize.fields()).hasSize(2);
        assertThat(normalize.fields().get(0).mappings())
                .extracting(m -> m.fromValue() + "=" + m.toValue())
                .containsExactly("gass=gas", "diesl=diesel");
        assertThat(normalize.fields().get(1).field().text()).isEqualTo("unit");
    }

    @Test
    @Tag("unit")
    void testAggregateWithAllClausesAndTimeWindow() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        Program program = parse("AGGREGATE measurement BY [factory_id, product_id] INTO activity "
                + "AGG_SUM(amount) AS total TAKE_FIRST(unit) AS unit AGG_COUNT() AS rows "
                + "TIME_WINDOW monthly FROM date INTO month", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        AggregateNode aggregate = (AggregateNode) program.statements().get(0);
        assertThat(aggregate.source().text()).isEqualTo("measurement");
        assertThat(aggregate.target().text()).isEqualTo("activity");
        assertThat(aggregate.aggregations()).extracting(c -> c.function())
                .containsExactly(AggregationFunction.SUM, AggregationFunction.FIRST, AggregationFunction.COUNT);
        assertThat(aggregate.aggregations().get(2).field()).isNull();
        assertThat(aggregate.timeWindow().mode().text()).isEqualTo("monthly");
        assertThat(aggregate.timeWindow().sourceField().text()).isEqualTo("date");
        assertThat(aggregate.timeWindow().targetField().text()).isEqualTo("month");
    }

    @Test
    @Tag("unit")
    void testUnitConvertEnrichComputeAndValidate() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = String.join("\n",
                "UNIT_CONVERT measurement.amount FROM unit TO \"kWh\" USING \"units.csv\"",
                "ENRICH activity WITH \"emission_factor_table\" MATCH ON fuel OUTPUT emission AS { co2: activity.total * emission_factor.factor }",
                "COMPUTE total_emission FOR emission GROUP BY scope INTO ghg_report AS sum(co2)",
                "VALIDATE ghg_report WITH \"non_negative\"");

        Program program = parse(source, diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.statements()).hasSize(4);

        UnitConvertNode convert = (UnitConvertNode) program.statements().get(0);
        assertThat(convert.isFromField()).isTrue();
        assertThat(convert.toValue()).isEqualTo("kWh");
        assertThat(convert.tableValue()).isEqualTo("units.csv");

        EnrichNode enrich = (EnrichNode) program.statements().get(1);
        assertThat(enrich.factorTableName()).isEqualTo("emission_factor_table");
        assertThat(enrich.factorAlias()).isEqualTo("emission_factor");
        assertThat(enrich.matchKey().text()).isEqualTo("fuel");

        ComputeNode compute = (ComputeNode) program.statements().get(2);
        assertThat(compute.resultName().text()).isEqualTo("total_emission");
        assertThat(compute.groupKeys()).extracting(Token::text).containsExactly("scope");
        assertThat(compute.function()).extracting(f -> f.name().text(), f -> f.argument().text())
                .containsExactly("sum", "co2");

        ValidateNode validate = (ValidateNode) program.statements().get(3);
        assertThat(validate.ruleValue()).isEqualTo("non_negative");
    }

    /**
     * Verifies that multiplication binds tighter than addition: 2 + 3 * 4 is 2 + (3 * 4).
     */
    @Test
    @Tag("unit")
    void testMultiplicationBindsTighterThanAddition() {
        ExpressionNode expression = parseOutput("2 + 3 * 4");

        BinaryExpressionNode sum = (BinaryExpressionNode) expression;
        assertThat(sum.operatorSymbol()).isEqualTo("+");
        assertThat(sum.left()).isInstanceOf(NumberLiteralNode.class);
        BinaryExpressionNode product = (BinaryExpressionNode) sum.right();
        assertThat(product.operatorSymbol()).isEqualTo("*");
        assertThat(sum.shape()).isEqualTo(ValueShape.NUMBER);
    }

    /**
     * Verifies that a.value * b.factor + c groups as (a.value * b.factor) + c.
     */
    @Test
    @Tag("unit")
    void testQualifiedOperandsAndLeftAssociativity() {
        ExpressionNode expression = parseOutput("a.value * b.factor + c - 1");

        BinaryExpressionNode minus = (BinaryExpressionNode) expression;
        assertThat(minus.operatorSymbol()).isEqualTo("-");
        BinaryExpressionNode plus = (BinaryExpressionNode) minus.left();
        assertThat(plus.operatorSymbol()).isEqualTo("+");
        BinaryExpressionNode times = (BinaryExpressionNode) plus.left();
        assertThat(((IdentifierNode) times.left()).qualifiedName()).isEqualTo("a.value");
        assertThat(((IdentifierNode) times.right()).qualifiedName()).isEqualTo("b.factor");
        assertThat(((IdentifierNode) plus.right()).isQualified()).isFalse();
    }

    @Test
    @Tag("unit")
    void testStringConcatenationShapeAndFunctionCallAtom() {
        BinaryExpressionNode concat = (BinaryExpressionNode) parseOutput("\"em_\" + a.id");
        assertThat(concat.left()).isInstanceOf(StringLiteralNode.class);
        assertThat(concat.isConcatenation()).isTrue();

        assertThat(parseOutput("avg(value)")).isInstanceOf(FunctionCallNode.class);
    }

    @Test
    @Tag("unit")
    void testExpressionDepthLimit() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer("ENRICH a WITH t MATCH ON k OUTPUT e AS { x: 1 + 2 + 3 + 4 }", diagnostics).scanTokens();

        Program program = new Parser(tokens, diagnostics, "deep.dsl", 2).parse();

        assertThat(program.statements()).isEmpty();
        assertThat(diagnostics.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.EXPRESSION_TOO_DEEP);
    }

    /**
     * Verifies that the first syntax error aborts the parse and names expected and found tokens,
     * the position and the statement index.
     */
    @Test
    @Tag("unit")
    void testSyntaxErrorNamesExpectationAndStatementIndex() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = String.join("\n",
                "LOAD_CSV \"a.csv\" AS a",
                "AGGREGATE a BY [k] activity AGG_SUM(x) AS y",
                "VALIDATE a WITH \"r\"");

        Program program = parse(source, diagnostics);

        assertThat(program.statements()).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.firstError().orElseThrow();
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(error.message())
                .startsWith("Statement #2: ")
                .contains("keyword INTO")
                .contains("identifier 'activity'");
        assertThat(error).extracting(Diagnostic::lineNumber, Diagnostic::columnNumber).containsExactly(2, 20);
    }

    @Test
    @Tag("unit")
    void testUnknownStatementAndEndOfInput() {
        DiagnosticsEngine unknown = new DiagnosticsEngine();
        parse("SELECT x", unknown);
        assertThat(unknown.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNKNOWN_STATEMENT);

        DiagnosticsEngine truncated = new DiagnosticsEngine();
        parse("VALIDATE x WITH", truncated);
        assertThat(truncated.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNEXPECTED_END_OF_INPUT);
    }

    @Test
    @Tag("unit")
    void testRequiredAggregationFieldIsEnforced() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        parse("AGGREGATE a BY [k] INTO t AGG_SUM() AS y", diagnostics);

        assertThat(diagnostics.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
    }

    @Test
    @Tag("unit")
    void testTokenStreamMustEndWithEndOfFile() {
        assertThatThrownBy(() -> new Parser(List.of(), new DiagnosticsEngine()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
