package org.ontodsl.compiler.frontend.parser;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;
import org.ontodsl.compiler.frontend.statement.StatementHandlerRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The main parser for the DSL. It consumes a list of tokens from the
 * {@link org.ontodsl.compiler.frontend.lexer.Lexer} and produces a {@link Program}.
 * <p>
 * Every statement starts with a keyword that selects its handler from the
 * {@link StatementHandlerRegistry}; one token of lookahead suffices. The first syntax error is
 * reported to the {@link DiagnosticsEngine} and ends the parse: there is no recovery.
 */
public class Parser implements ParsingContext {

    /** Default limit for operator nesting in expressions. */
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 64;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final StatementHandlerRegistry statementRegistry;
    private final ExpressionParser expressionParser;
    private final String programName;
    private int current = 0;
    private int statementIndex = 0;

    /**
     * Constructs a new Parser with the default expression depth limit.
     * @param tokens The list of tokens to parse, terminated by END_OF_FILE.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, "<memory>", DEFAULT_MAX_EXPRESSION_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by END_OF_FILE.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param programName The program name stored in the resulting {@link Program}.
     * @param maxExpressionDepth The maximum operator nesting accepted in one expression.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String programName, int maxExpressionDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token stream must end with END_OF_FILE");
        }
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.programName = programName;
        this.statementRegistry = StatementHandlerRegistry.initialize();
        this.expressionParser = new ExpressionParser(this, maxExpressionDepth);
    }

    /**
     * Parses the entire token stream.
     * On a syntax error the returned program holds only the statements before the error,
     * and the error is in the diagnostics.
     * @return The parsed {@link Program}.
     */
    public Program parse() {
        List<StatementNode> statements = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                statementIndex++;
                statements.add(statement());
            }
        } catch (ParsingAbortedException aborted) {
            // The diagnostic is already reported.
        }
        return new Program(programName, statements);
    }

    private StatementNode statement() {
        Token keyword = peek();
        Optional<IStatementHandler> handler = keyword.type().isKeyword()
                ? statementRegistry.get(keyword.type())
                : Optional.empty();
        if (handler.isEmpty()) {
            throw error(CompilerErrorCode.UNKNOWN_STATEMENT,
                    "Expected a statement keyword (LOAD_CSV, NORMALIZE, AGGREGATE, UNIT_CONVERT, ENRICH, COMPUTE, VALIDATE), but found "
                            + keyword.describe() + ".",
                    keyword.sourceInfo());
        }
        return handler.get().parse(this);
    }

    @Override
    public ExpressionNode expression() {
        return expressionParser.parse();
    }

    @Override
    public List<Token> identifierList(TokenType closing, String what) {
        List<Token> identifiers = new ArrayList<>();
        while (!check(closing)) {
            identifiers.add(consume(TokenType.IDENTIFIER, what));
            match(TokenType.COMMA);
        }
        consume(closing, "end of " + what + " list");
        return identifiers;
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String what) {
        if (check(type)) return advance();
        throw unexpected(type.displayName() + " for " + what);
    }

    @Override
    public Token consumeOneOf(String what, TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return advance();
        }
        String expected = Arrays.stream(types).map(TokenType::displayName).collect(Collectors.joining(" or "));
        throw unexpected(expected + " for " + what);
    }

    private RuntimeException unexpected(String expectation) {
        Token found = peek();
        CompilerErrorCode code = found.type() == TokenType.END_OF_FILE
                ? CompilerErrorCode.UNEXPECTED_END_OF_INPUT
                : CompilerErrorCode.UNEXPECTED_TOKEN;
        return error(code, "Expected " + expectation + ", but found " + found.describe() + ".", found.sourceInfo());
    }

    @Override
    public RuntimeException error(CompilerErrorCode code, String message, SourceInfo where) {
        diagnostics.reportError(code, "Statement #" + statementIndex + ": " + message, where);
        return new ParsingAbortedException();
    }

    /**
     * Unwinds the recursive descent after the first reported syntax error.
     */
    private static final class ParsingAbortedException extends RuntimeException {
        ParsingAbortedException() {
            super(null, null, false, false);
        }
    }
}
