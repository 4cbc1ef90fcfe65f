package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary operation {@code left op right} with op one of {@code + - * /}.
 * <p>
 * The {@link #shape()} is computed bottom-up from the operands; a {@code +} whose shape is
 * {@link ValueShape#STRING} is a text concatenation.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        Token operator,
        ExpressionNode right
) implements ExpressionNode {

    /**
     * @return The operator symbol.
     */
    public String operatorSymbol() {
        return operator.text();
    }

    /**
     * @return True if this {@code +} joins text rather than adding numbers.
     */
    public boolean isConcatenation() {
        return "+".equals(operatorSymbol()) && shape() == ValueShape.STRING;
    }

    @Override
    public ValueShape shape() {
        return ValueShape.combine(operatorSymbol(), left.shape(), right.shape());
    }

    @Override
    public SourceInfo sourceInfo() {
        return left.sourceInfo();
    }

    @Override
    public int depth() {
        return 1 + Math.max(left.depth(), right.depth());
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
