package org.ontodsl.compiler.frontend.parser.features.normalize;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the NORMALIZE statement.
 * Values on either side of a mapping may be strings or bare identifiers.
 */
public class NormalizeStatementHandler implements IStatementHandler {

    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume NORMALIZE
        Token target = context.consume(TokenType.IDENTIFIER, "alias after NORMALIZE");
        context.consume(TokenType.LEFT_BRACE, "NORMALIZE block");

        List<FieldNormalization> fields = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE)) {
            Token field = context.consume(TokenType.IDENTIFIER, "field name in NORMALIZE");
            context.consume(TokenType.COLON, "field '" + field.text() + "'");
            context.consume(TokenType.LEFT_BRACE, "value mappings of '" + field.text() + "'");

            List<ValueMapping> mappings = new ArrayList<>();
            while (!context.check(TokenType.RIGHT_BRACE)) {
                Token from = context.consumeOneOf("value to normalize", TokenType.STRING, TokenType.IDENTIFIER);
                context.consume(TokenType.COLON, "value mapping");
                Token to = context.consumeOneOf("normalized value", TokenType.STRING, TokenType.IDENTIFIER);
                mappings.add(new ValueMapping(from, to));
                context.match(TokenType.COMMA);
            }
            context.consume(TokenType.RIGHT_BRACE, "end of value mappings");
            fields.add(new FieldNormalization(field, mappings));
            context.match(TokenType.COMMA);
        }
        context.consume(TokenType.RIGHT_BRACE, "end of NORMALIZE block");
        return new NormalizeNode(keyword, target, fields);
    }
}
