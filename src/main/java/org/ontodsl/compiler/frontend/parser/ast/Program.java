package org.ontodsl.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the AST: the statements of one DSL document in source order.
 * The order is the execution order of the generated queries.
 *
 * @param name The program name.
 * @param statements The statements in source order.
 */
public record Program(String name, List<StatementNode> statements) {

    /**
     * Copies the statement list so the program cannot change after parsing.
     */
    public Program {
        statements = List.copyOf(statements);
    }
}
