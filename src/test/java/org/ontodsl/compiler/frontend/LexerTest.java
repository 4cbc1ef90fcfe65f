package org.ontodsl.compiler.frontend;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.diagnostics.Diagnostic;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Lexer;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify keyword recognition, literal values, the '->' arrow inside identifiers,
 * comments, positions and the handling of invalid input.
 */
public class LexerTest {

    private List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics, "test.dsl").scanTokens();
    }

    /**
     * Verifies that a complete LOAD_CSV statement is tokenized with correct types and values.
     */
    @Test
    @Tag("unit")
    void testLoadStatementTokenization() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("LOAD_CSV \"level1.csv\" AS measurement MAP_COLUMNS { factory -> factory_id }", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LOAD_CSV, TokenType.STRING, TokenType.AS, TokenType.IDENTIFIER, TokenType.MAP_COLUMNS,
                TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER,
                TokenType.RIGHT_BRACE, TokenType.END_OF_FILE);
        assertThat(tokens.get(1)).extracting(Token::text, Token::value).containsExactly("\"level1.csv\"", "level1.csv");
        assertThat(tokens.get(3).text()).isEqualTo("measurement");
    }

    @Test
    @Tag("unit")
    void testKeywordsAreCaseSensitive() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("load_csv LOAD_CSV Load_Csv", diagnostics);

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.LOAD_CSV, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a hyphen belongs to an identifier unless it starts the '->' arrow.
     */
    @Test
    @Tag("unit")
    void testHyphenInIdentifierAndArrow() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("co2-rate a->b", diagnostics);

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "co2-rate"),
                tuple(TokenType.IDENTIFIER, "a"),
                tuple(TokenType.ARROW, "->"),
                tuple(TokenType.IDENTIFIER, "b"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    @Test
    @Tag("unit")
    void testNumbersAndOperators() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("2 + 3.25 * x / 4 - 1", diagnostics);

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER, TokenType.STAR, TokenType.IDENTIFIER,
                TokenType.SLASH, TokenType.NUMBER, TokenType.MINUS, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(2).value()).isEqualTo(new BigDecimal("3.25"));
    }

    @Test
    @Tag("unit")
    void testStringEscapes() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("\"a\\\"b\\\\c\\nd\\qe\"", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).value()).isEqualTo("a\"b\\c\nd" + "qe");
    }

    /**
     * Verifies that comments and line breaks are skipped and positions stay accurate.
     */
    @Test
    @Tag("unit")
    void testCommentsAreSkippedAndPositionsTracked() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = String.join("\n",
                "# pipeline",
                "VALIDATE  m WITH \"rule\" # trailing");

        List<Token> tokens = scan(source, diagnostics);

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VALIDATE, TokenType.IDENTIFIER, TokenType.WITH, TokenType.STRING, TokenType.END_OF_FILE);
        assertThat(tokens.get(1)).extracting(Token::line, Token::column, Token::fileName).containsExactly(2, 11, "test.dsl");
    }

    @Test
    @Tag("unit")
    void testUnexpectedCharacterStopsScanning() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("VALIDATE m\n  @ WITH \"r\"", diagnostics);

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VALIDATE, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        Diagnostic error = diagnostics.firstError().orElseThrow();
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER);
        assertThat(error.message()).contains("'@'");
        assertThat(error).extracting(Diagnostic::lineNumber, Diagnostic::columnNumber).containsExactly(2, 3);
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringIsReported() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = scan("LOAD_CSV \"level1.csv", diagnostics);

        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(diagnostics.firstError().orElseThrow().code()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING);
    }

    /**
     * Verifies that every iterator starts a fresh scan from the beginning of the source.
     */
    @Test
    @Tag("unit")
    void testTokenSequenceIsRestartable() {
        Lexer lexer = new Lexer("COMPUTE x", new DiagnosticsEngine());

        Iterator<Token> first = lexer.iterator();
        first.next();
        Iterator<Token> second = lexer.iterator();

        assertThat(second.next().type()).isEqualTo(TokenType.COMPUTE);
        assertThat(first.next().type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(lexer.scanTokens()).hasSize(3);
    }
}
