package org.ontodsl.compiler.frontend.statement;

import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

/**
 * The base interface for all statement handlers.
 * Each handler parses exactly one statement kind, starting at its leading keyword.
 */
@FunctionalInterface
public interface IStatementHandler {

    /**
     * Parses the statement whose keyword is the current token.
     *
     * @param context The context that provides access to the token stream.
     * @return The AST node for the statement; never {@code null}.
     */
    StatementNode parse(ParsingContext context);
}
