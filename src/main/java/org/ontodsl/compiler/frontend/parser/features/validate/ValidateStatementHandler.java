package org.ontodsl.compiler.frontend.parser.features.validate;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

/**
 * Handler for the VALIDATE statement.
 */
public class ValidateStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume VALIDATE
        Token target = context.consume(TokenType.IDENTIFIER, "alias after VALIDATE");
        context.consume(TokenType.WITH, "VALIDATE");
        Token rule = context.consume(TokenType.STRING, "rule name after WITH");
        return new ValidateNode(keyword, target, rule);
    }
}
