package org.ontodsl.compiler.frontend.parser;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides statement handlers with access to the token stream and other necessary services
 * without coupling them directly to the parser implementation.
 * <p>
 * Every failing operation reports a diagnostic and aborts the parse; handlers never see
 * a {@code null} token.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type, otherwise reports an
     * "expected ... but found ..." error and aborts.
     * @param type The expected token type.
     * @param what What the token stands for, e.g. "alias after AS".
     * @return The consumed token.
     */
    Token consume(TokenType type, String what);

    /**
     * Consumes the current token if it is of one of the expected types, otherwise aborts.
     * @param what What the token stands for.
     * @param types The accepted token types.
     * @return The consumed token.
     */
    Token consumeOneOf(String what, TokenType... types);

    /**
     * Parses identifiers up to (and including) the closing token. Commas between entries
     * are optional. The list may be empty.
     * @param closing The token type that ends the list.
     * @param what What the identifiers stand for.
     * @return The identifier tokens in source order.
     */
    List<Token> identifierList(TokenType closing, String what);

    /**
     * Parses an additive expression at the current position.
     * @return The expression tree.
     */
    ExpressionNode expression();

    /**
     * Reports a syntax error and returns the exception that aborts parsing.
     * Callers throw the returned exception.
     * @param code The error code.
     * @param message The message.
     * @param where The position.
     * @return The exception to throw.
     */
    RuntimeException error(CompilerErrorCode code, String message, SourceInfo where);

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
