package org.ontodsl.compiler.frontend.parser.features.enrich;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;

/**
 * One {@code name: expression} entry of an ENRICH output block.
 *
 * @param name The output field name.
 * @param expression The value expression.
 */
public record OutputField(Token name, ExpressionNode expression) {
}
