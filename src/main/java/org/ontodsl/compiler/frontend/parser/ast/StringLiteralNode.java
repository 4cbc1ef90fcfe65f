package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.frontend.lexer.Token;

/**
 * A double-quoted string literal.
 *
 * @param literalToken The STRING token.
 */
public record StringLiteralNode(Token literalToken) implements ExpressionNode {

    /**
     * @return The unescaped string content.
     */
    public String value() {
        return (String) literalToken.value();
    }

    @Override
    public ValueShape shape() {
        return ValueShape.STRING;
    }

    @Override
    public SourceInfo sourceInfo() {
        return literalToken.sourceInfo();
    }
}
