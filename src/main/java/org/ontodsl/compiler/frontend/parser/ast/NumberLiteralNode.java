package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.frontend.lexer.Token;

import java.math.BigDecimal;

/**
 * An AST node that represents a numeric literal.
 *
 * @param numberToken The token containing the number.
 */
public record NumberLiteralNode(Token numberToken) implements ExpressionNode {

    /**
     * @return The exact numeric value.
     */
    public BigDecimal getValue() {
        return (BigDecimal) numberToken.value();
    }

    @Override
    public ValueShape shape() {
        return ValueShape.NUMBER;
    }

    @Override
    public SourceInfo sourceInfo() {
        return numberToken.sourceInfo();
    }
}
