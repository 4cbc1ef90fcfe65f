package org.ontodsl.compiler.frontend.parser.features.aggregate;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the AGGREGATE statement.
 */
public class AggregateStatementHandler implements IStatementHandler {

    /**
     * Parses an AGGREGATE statement.
     * Expected format:
     * {@code AGGREGATE <source> BY [k, ...] INTO <target> (AGG_SUM(f) AS a | TAKE_FIRST(f) AS a | AGG_COUNT([f]) AS a)*
     * [TIME_WINDOW <mode> FROM <field> INTO <alias>]}
     * @param context The context that encapsulates the parser.
     * @return An {@link AggregateNode}.
     */
    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume AGGREGATE
        Token source = context.consume(TokenType.IDENTIFIER, "source alias after AGGREGATE");
        context.consume(TokenType.BY, "AGGREGATE");
        context.consume(TokenType.LEFT_BRACKET, "group key list");
        List<Token> groupKeys = context.identifierList(TokenType.RIGHT_BRACKET, "group key");
        context.consume(TokenType.INTO, "AGGREGATE");
        Token target = context.consume(TokenType.IDENTIFIER, "target alias after INTO");

        List<AggregationClause> aggregations = new ArrayList<>();
        AggregationFunction function;
        while ((function = AggregationFunction.forKeyword(context.peek().type())) != null) {
            aggregations.add(clause(context, function));
        }

        TimeWindow timeWindow = null;
        if (context.match(TokenType.TIME_WINDOW)) {
            Token mode = context.consume(TokenType.IDENTIFIER, "TIME_WINDOW mode");
            context.consume(TokenType.FROM, "TIME_WINDOW");
            Token sourceField = context.consume(TokenType.IDENTIFIER, "timestamp field after FROM");
            context.consume(TokenType.INTO, "TIME_WINDOW");
            Token targetField = context.consume(TokenType.IDENTIFIER, "time window alias after INTO");
            timeWindow = new TimeWindow(mode, sourceField, targetField);
        }

        return new AggregateNode(keyword, source, groupKeys, target, aggregations, timeWindow);
    }

    private AggregationClause clause(ParsingContext context, AggregationFunction function) {
        Token functionToken = context.advance();
        context.consume(TokenType.LEFT_PAREN, functionToken.text());
        Token field = null;
        if (function.isFieldRequired() || context.check(TokenType.IDENTIFIER)) {
            field = context.consume(TokenType.IDENTIFIER, "field of " + functionToken.text());
        }
        context.consume(TokenType.RIGHT_PAREN, "end of " + functionToken.text());
        context.consume(TokenType.AS, functionToken.text());
        Token alias = context.consume(TokenType.IDENTIFIER, "alias of " + functionToken.text());
        return new AggregationClause(function, functionToken, field, alias);
    }
}
