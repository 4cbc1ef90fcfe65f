package org.ontodsl.compiler.frontend.parser.features.compute;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

import java.util.List;

/**
 * Handler for the COMPUTE statement.
 * GROUP BY accepts a single identifier or a bracketed list.
 */
public class ComputeStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume COMPUTE
        Token resultName = context.consume(TokenType.IDENTIFIER, "result name after COMPUTE");
        context.consume(TokenType.FOR, "COMPUTE");
        Token source = context.consume(TokenType.IDENTIFIER, "source alias after FOR");
        context.consume(TokenType.GROUP, "COMPUTE");
        context.consume(TokenType.BY, "GROUP");

        List<Token> groupKeys;
        if (context.match(TokenType.LEFT_BRACKET)) {
            groupKeys = context.identifierList(TokenType.RIGHT_BRACKET, "group key");
        } else {
            groupKeys = List.of(context.consume(TokenType.IDENTIFIER, "group key after GROUP BY"));
        }

        context.consume(TokenType.INTO, "COMPUTE");
        Token target = context.consume(TokenType.IDENTIFIER, "target alias after INTO");
        context.consume(TokenType.AS, "COMPUTE");
        Token function = context.consume(TokenType.IDENTIFIER, "aggregation function after AS");
        context.consume(TokenType.LEFT_PAREN, function.text() + "()");
        Token argument = context.consume(TokenType.IDENTIFIER, "argument of " + function.text() + "()");
        context.consume(TokenType.RIGHT_PAREN, "end of " + function.text() + "() call");
        return new ComputeNode(keyword, resultName, source, groupKeys, target, new FunctionCallNode(function, argument));
    }
}
