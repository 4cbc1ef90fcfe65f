package org.ontodsl.compiler.frontend.parser;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.IdentifierNode;
import org.ontodsl.compiler.frontend.parser.ast.NumberLiteralNode;
import org.ontodsl.compiler.frontend.parser.ast.StringLiteralNode;

/**
 * Precedence-climbing parser for ENRICH output expressions.
 * <p>
 * Levels, lowest to highest: {@code + -}, then {@code * /}, then atoms. Both binary levels are
 * left associative. Atoms are string and number literals, {@code name(field)} calls and
 * identifiers with an optional {@code alias.} qualifier.
 */
class ExpressionParser {

    private final ParsingContext context;
    private final int maxDepth;

    ExpressionParser(ParsingContext context, int maxDepth) {
        this.context = context;
        this.maxDepth = maxDepth;
    }

    ExpressionNode parse() {
        return additive();
    }

    private ExpressionNode additive() {
        ExpressionNode left = multiplicative();
        while (context.match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = context.previous();
            ExpressionNode right = multiplicative();
            left = guarded(new BinaryExpressionNode(left, operator, right));
        }
        return left;
    }

    private ExpressionNode multiplicative() {
        ExpressionNode left = atom();
        while (context.match(TokenType.STAR, TokenType.SLASH)) {
            Token operator = context.previous();
            ExpressionNode right = atom();
            left = guarded(new BinaryExpressionNode(left, operator, right));
        }
        return left;
    }

    private ExpressionNode atom() {
        if (context.match(TokenType.STRING)) {
            return new StringLiteralNode(context.previous());
        }
        if (context.match(TokenType.NUMBER)) {
            return new NumberLiteralNode(context.previous());
        }
        if (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.LEFT_PAREN)) {
            Token name = context.advance();
            context.advance(); // consume '('
            Token argument = context.consume(TokenType.IDENTIFIER, "argument of " + name.text() + "()");
            context.consume(TokenType.RIGHT_PAREN, "end of " + name.text() + "() call");
            return new FunctionCallNode(name, argument);
        }
        Token first = context.consumeOneOf("expression", TokenType.IDENTIFIER, TokenType.STRING, TokenType.NUMBER);
        if (context.match(TokenType.DOT)) {
            Token field = context.consume(TokenType.IDENTIFIER, "field name after '" + first.text() + ".'");
            return new IdentifierNode(first, field);
        }
        return new IdentifierNode(null, first);
    }

    private ExpressionNode guarded(BinaryExpressionNode node) {
        if (node.depth() > maxDepth) {
            throw context.error(CompilerErrorCode.EXPRESSION_TOO_DEEP,
                    "Expression nesting exceeds the maximum depth of " + maxDepth + ".",
                    node.operator().sourceInfo());
        }
        return node;
    }
}
