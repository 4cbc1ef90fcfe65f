package org.ontodsl.compiler.frontend;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.diagnostics.Diagnostic;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Lexer;
import org.ontodsl.compiler.frontend.parser.Parser;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;
import org.ontodsl.compiler.frontend.semantics.SemanticAnalyzer;
import org.ontodsl.junit.extensions.logging.ExpectLog;
import org.ontodsl.junit.extensions.logging.LogLevel;
import org.ontodsl.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}.
 * These tests verify alias resolution across statements, alias redefinition rules, empty-list and
 * function checks, ENRICH qualifier scoping and the best-effort field warnings.
 */
@ExtendWith(LogWatchExtension.class)
public class SemanticAnalyzerTest {

    private static final String LOAD = "LOAD_CSV \"level1.csv\" AS measurement "
            + "MAP_COLUMNS { factory -> factory_id, product -> product_id, type -> fuel, amount -> amount }\n";

    private AliasRegistry registry;

    private DiagnosticsEngine analyze(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = new Parser(new Lexer(source, diagnostics, "test.dsl").scanTokens(), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as("parse errors: " + diagnostics.summary()).isFalse();
        registry = new AliasRegistry(diagnostics);
        new SemanticAnalyzer(diagnostics, registry).analyze(program);
        return diagnostics;
    }

    private static CompilerErrorCode firstErrorCode(DiagnosticsEngine diagnostics) {
        return diagnostics.firstError().map(Diagnostic::code).orElse(null);
    }

    /**
     * Verifies that a complete chain resolves without diagnostics and registers every target.
     */
    @Test
    @Tag("unit")
    void testValidChainRegistersAliases() {
        DiagnosticsEngine diagnostics = analyze(LOAD
                + "AGGREGATE measurement BY [factory_id, fuel] INTO activity AGG_SUM(amount) AS total\n"
                + "ENRICH activity WITH emission_factor_table MATCH ON fuel OUTPUT emission AS { co2: total * emission_factor.factor }\n"
                + "COMPUTE total_emission FOR emission GROUP BY co2 INTO report AS sum(co2)\n"
                + "VALIDATE report WITH \"positive\"");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(registry.isSealed()).isTrue();
        assertThat(registry.knownFields("activity")).containsExactly("factory_id", "fuel", "total");
        assertThat(registry.knownFields("emission")).containsExactly("co2");
        assertThat(registry.knownFields("report")).containsExactly("co2", "total_emission");
    }

    @Test
    @Tag("unit")
    void testReferenceBeforeDefinitionIsReported() {
        DiagnosticsEngine diagnostics = analyze("ENRICH activity WITH factors MATCH ON fuel OUTPUT emission AS { co2: total }\n"
                + LOAD);

        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.UNKNOWN_ALIAS);
        assertThat(diagnostics.firstError().orElseThrow().message()).contains("'activity'");
        assertThat(registry.isDefined("measurement")).isFalse();
    }

    @Test
    @Tag("unit")
    void testAliasesAreCaseSensitive() {
        DiagnosticsEngine diagnostics = analyze(LOAD + "NORMALIZE Measurement { fuel: {gass: gas} }");

        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.UNKNOWN_ALIAS);
    }

    @Test
    @Tag("unit")
    void testRedefinitionByDifferentKindIsReported() {
        DiagnosticsEngine diagnostics = analyze(LOAD
                + "AGGREGATE measurement BY [fuel] INTO measurement AGG_COUNT() AS n");

        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.ALIAS_REDEFINED);
    }

    /**
     * Verifies that loading into the same alias twice merges the known fields.
     */
    @Test
    @Tag("unit")
    void testRedefinitionBySameKindMergesFields() {
        DiagnosticsEngine diagnostics = analyze(
                "LOAD_CSV \"a.csv\" AS m MAP_COLUMNS { x -> a }\n"
                        + "LOAD_CSV \"b.csv\" AS m MAP_COLUMNS { y -> b }");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(registry.knownFields("m")).containsExactly("a", "b");
    }

    @Test
    @Tag("unit")
    void testEmptyListsAreRejected() {
        assertThat(firstErrorCode(analyze(LOAD + "AGGREGATE measurement BY [] INTO t AGG_COUNT() AS n")))
                .isEqualTo(CompilerErrorCode.EMPTY_LIST);
        assertThat(firstErrorCode(analyze(LOAD + "AGGREGATE measurement BY [fuel] INTO t")))
                .isEqualTo(CompilerErrorCode.EMPTY_LIST);
        assertThat(firstErrorCode(analyze("LOAD_CSV \"a.csv\" AS m MAP_COLUMNS { }")))
                .isEqualTo(CompilerErrorCode.EMPTY_LIST);
        assertThat(firstErrorCode(analyze(LOAD + "NORMALIZE measurement { }")))
                .isEqualTo(CompilerErrorCode.EMPTY_LIST);
        assertThat(firstErrorCode(analyze(LOAD + "ENRICH measurement WITH f MATCH ON fuel OUTPUT e AS { }")))
                .isEqualTo(CompilerErrorCode.EMPTY_LIST);
    }

    @Test
    @Tag("unit")
    void testDuplicateMapColumnsTargetIsRejected() {
        DiagnosticsEngine diagnostics = analyze("LOAD_CSV \"a.csv\" AS m MAP_COLUMNS { a -> x, b -> x }");

        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        Diagnostic error = diagnostics.firstError().orElseThrow();
        assertThat(error.message()).contains("MAP_COLUMNS target 'x'");
    }

    /**
     * Verifies that group keys, the time window target and the aggregation aliases share one namespace.
     */
    @Test
    @Tag("unit")
    void testDuplicateAggregateNamesAreRejected() {
        assertThat(firstErrorCode(analyze(LOAD
                + "AGGREGATE measurement BY [factory_id] INTO a AGG_SUM(amount) AS factory_id")))
                .isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        assertThat(firstErrorCode(analyze(LOAD
                + "AGGREGATE measurement BY [fuel, fuel] INTO a AGG_COUNT() AS n")))
                .isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        assertThat(firstErrorCode(analyze(LOAD
                + "AGGREGATE measurement BY [fuel] INTO a AGG_SUM(amount) AS n AGG_COUNT() AS n")))
                .isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        DiagnosticsEngine diagnostics = analyze("LOAD_CSV \"raw.csv\" AS raw\n"
                + "AGGREGATE raw BY [fuel] INTO t AGG_COUNT() AS n TIME_WINDOW month FROM date INTO fuel");
        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        assertThat(diagnostics.firstError().orElseThrow().message()).contains("TIME_WINDOW target 'fuel'");
    }

    @Test
    @Tag("unit")
    void testDuplicateEnrichOutputFieldIsRejected() {
        DiagnosticsEngine diagnostics = analyze(LOAD
                + "ENRICH measurement WITH f MATCH ON fuel OUTPUT e AS { co2: amount, co2: amount * 2 }");

        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        assertThat(diagnostics.firstError().orElseThrow().message()).contains("output field 'co2'");
    }

    @Test
    @Tag("unit")
    void testComputeResultNameEqualToGroupKeyIsRejected() {
        DiagnosticsEngine diagnostics = analyze(LOAD
                + "COMPUTE fuel FOR measurement GROUP BY fuel INTO r AS sum(amount)");

        assertThat(firstErrorCode(diagnostics)).isEqualTo(CompilerErrorCode.DUPLICATE_NAME);
        assertThat(diagnostics.firstError().orElseThrow().message()).contains("result name 'fuel'");
    }

    @Test
    @Tag("unit")
    void testUnsupportedFunctionsAreRejected() {
        DiagnosticsEngine compute = analyze(LOAD + "COMPUTE x FOR measurement GROUP BY fuel INTO r AS median(amount)");
        assertThat(firstErrorCode(compute)).isEqualTo(CompilerErrorCode.UNSUPPORTED_FUNCTION);

        DiagnosticsEngine upperCase = analyze(LOAD + "COMPUTE x FOR measurement GROUP BY fuel INTO r AS AVG(amount)");
        assertThat(upperCase.hasErrors()).isFalse();

        DiagnosticsEngine enrich = analyze(LOAD + "ENRICH measurement WITH f MATCH ON fuel OUTPUT e AS { x: sum(amount) }");
        assertThat(firstErrorCode(enrich)).isEqualTo(CompilerErrorCode.UNSUPPORTED_FUNCTION);
    }

    /**
     * Verifies ENRICH qualifier scoping: a registered alias outside the match is not in scope,
     * an unregistered qualifier is unknown, the factor table name is accepted.
     */
    @Test
    @Tag("unit")
    void testEnrichQualifierScoping() {
        String chain = LOAD + "AGGREGATE measurement BY [fuel] INTO activity AGG_SUM(amount) AS total\n";

        DiagnosticsEngine other = analyze(chain
                + "ENRICH activity WITH factor_table MATCH ON fuel OUTPUT e AS { x: measurement.amount }");
        assertThat(firstErrorCode(other)).isEqualTo(CompilerErrorCode.ALIAS_NOT_IN_SCOPE);

        DiagnosticsEngine unknown = analyze(chain
                + "ENRICH activity WITH factor_table MATCH ON fuel OUTPUT e AS { x: nowhere.amount }");
        assertThat(firstErrorCode(unknown)).isEqualTo(CompilerErrorCode.UNKNOWN_ALIAS);

        DiagnosticsEngine tableName = analyze(chain
                + "ENRICH activity WITH factor_table MATCH ON fuel OUTPUT e AS { x: factor_table.value * activity.total }");
        assertThat(tableName.hasErrors()).isFalse();
    }

    /**
     * Verifies that an unknown field on a closed field set is a warning and never an error.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Field 'colour' is not known on alias 'measurement'.*")
    void testUnknownFieldOnClosedSetIsWarning() {
        DiagnosticsEngine diagnostics = analyze(LOAD + "NORMALIZE measurement { colour: {red: rot} }");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.warnings()).hasSize(1);
        assertThat(diagnostics.warnings().get(0).message()).contains("known: factory_id, product_id, fuel, amount");
    }

    @Test
    @Tag("unit")
    void testOpenFieldSetLearnsReferencedFields() {
        DiagnosticsEngine diagnostics = analyze("LOAD_CSV \"raw.csv\" AS raw\n"
                + "NORMALIZE raw { fuel: {gass: gas} }\n"
                + "UNIT_CONVERT raw.amount FROM unit TO \"kWh\" USING \"units.csv\"");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(registry.knownFields("raw")).containsExactly("fuel", "amount", "unit");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Unknown TIME_WINDOW mode 'fortnightly'.*")
    void testUnknownTimeWindowModeIsWarning() {
        DiagnosticsEngine diagnostics = analyze("LOAD_CSV \"raw.csv\" AS raw\n"
                + "AGGREGATE raw BY [fuel] INTO t AGG_COUNT() AS n TIME_WINDOW fortnightly FROM date INTO period");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.warnings()).hasSize(1);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Operator '\\*' applied to a string value.*")
    void testArithmeticOnStringIsWarning() {
        DiagnosticsEngine diagnostics = analyze("LOAD_CSV \"raw.csv\" AS raw\n"
                + "ENRICH raw WITH f MATCH ON fuel OUTPUT e AS { x: \"abc\" * 2 }");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.warnings()).extracting(Diagnostic::message)
                .containsExactly("Operator '*' applied to a string value.");
    }

    /**
     * Verifies that analysis stops at the first statement with an error.
     */
    @Test
    @Tag("unit")
    void testAnalysisStopsAtFirstFailingStatement() {
        DiagnosticsEngine diagnostics = analyze("NORMALIZE a { f: {x: y} }\nNORMALIZE b { f: {x: y} }");

        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.firstError().orElseThrow().message()).contains("'a'");
        assertThat(registry.isSealed()).isTrue();
    }
}
