package org.ontodsl.compiler.frontend.parser.features.enrich;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the ENRICH statement. Output values are parsed with the expression parser.
 */
public class EnrichStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume ENRICH
        Token source = context.consume(TokenType.IDENTIFIER, "source alias after ENRICH");
        context.consume(TokenType.WITH, "ENRICH");
        Token factorTable = context.consumeOneOf("factor table after WITH", TokenType.IDENTIFIER, TokenType.STRING);
        context.consume(TokenType.MATCH, "ENRICH");
        context.consume(TokenType.ON, "MATCH");
        Token matchKey = context.consume(TokenType.IDENTIFIER, "match key after MATCH ON");
        context.consume(TokenType.OUTPUT, "ENRICH");
        Token target = context.consume(TokenType.IDENTIFIER, "target alias after OUTPUT");
        context.consume(TokenType.AS, "OUTPUT");
        context.consume(TokenType.LEFT_BRACE, "output block");

        List<OutputField> outputs = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE)) {
            Token name = context.consume(TokenType.IDENTIFIER, "output field name");
            context.consume(TokenType.COLON, "output field '" + name.text() + "'");
            ExpressionNode expression = context.expression();
            outputs.add(new OutputField(name, expression));
            context.match(TokenType.COMMA);
        }
        context.consume(TokenType.RIGHT_BRACE, "end of output block");
        return new EnrichNode(keyword, source, factorTable, matchKey, target, outputs);
    }
}
