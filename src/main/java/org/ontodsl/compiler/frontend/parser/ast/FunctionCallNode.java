package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.frontend.lexer.Token;

/**
 * A call {@code name(field)} with exactly one identifier argument.
 *
 * @param name The function name token.
 * @param argument The argument identifier token.
 */
public record FunctionCallNode(Token name, Token argument) implements ExpressionNode {

    @Override
    public ValueShape shape() {
        return ValueShape.UNKNOWN;
    }

    @Override
    public SourceInfo sourceInfo() {
        return name.sourceInfo();
    }
}
