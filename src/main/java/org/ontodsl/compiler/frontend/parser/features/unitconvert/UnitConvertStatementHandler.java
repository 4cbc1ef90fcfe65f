package org.ontodsl.compiler.frontend.parser.features.unitconvert;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

/**
 * Handler for the UNIT_CONVERT statement.
 */
public class UnitConvertStatementHandler implements IStatementHandler {

    /**
     * Parses a UNIT_CONVERT statement.
     * Expected format: {@code UNIT_CONVERT <alias>.<field> FROM <unit> TO <unit> USING "<table>"}
     * @param context The context that encapsulates the parser.
     * @return A {@link UnitConvertNode}.
     */
    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume UNIT_CONVERT
        Token target = context.consume(TokenType.IDENTIFIER, "alias after UNIT_CONVERT");
        context.consume(TokenType.DOT, "'" + target.text() + ".<field>'");
        Token field = context.consume(TokenType.IDENTIFIER, "field after '" + target.text() + ".'");
        context.consume(TokenType.FROM, "UNIT_CONVERT");
        Token from = context.consumeOneOf("source unit", TokenType.IDENTIFIER, TokenType.STRING);
        context.consume(TokenType.TO, "UNIT_CONVERT");
        Token to = context.consumeOneOf("target unit", TokenType.IDENTIFIER, TokenType.STRING);
        context.consume(TokenType.USING, "UNIT_CONVERT");
        Token table = context.consume(TokenType.STRING, "conversion table after USING");
        return new UnitConvertNode(keyword, target, field, from, to, table);
    }
}
