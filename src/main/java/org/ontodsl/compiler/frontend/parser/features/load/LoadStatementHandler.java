package org.ontodsl.compiler.frontend.parser.features.load;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ParsingContext;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the LOAD_CSV statement.
 */
public class LoadStatementHandler implements IStatementHandler {

    /**
     * Parses a LOAD_CSV statement.
     * Expected format: {@code LOAD_CSV "<path>" AS <alias> [MAP_COLUMNS { src -> dst (, ...) }]}
     * @param context The context that encapsulates the parser.
     * @return A {@link LoadNode}.
     */
    @Override
    public StatementNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume LOAD_CSV
        Token path = context.consume(TokenType.STRING, "CSV path after LOAD_CSV");
        context.consume(TokenType.AS, "LOAD_CSV");
        Token alias = context.consume(TokenType.IDENTIFIER, "alias after AS");

        List<ColumnMapping> columns = new ArrayList<>();
        boolean hasColumnMap = context.match(TokenType.MAP_COLUMNS);
        if (hasColumnMap) {
            context.consume(TokenType.LEFT_BRACE, "MAP_COLUMNS block");
            while (!context.check(TokenType.RIGHT_BRACE)) {
                Token source = context.consume(TokenType.IDENTIFIER, "source column in MAP_COLUMNS");
                context.consume(TokenType.ARROW, "column mapping");
                Token target = context.consume(TokenType.IDENTIFIER, "target field in MAP_COLUMNS");
                columns.add(new ColumnMapping(source, target));
                context.match(TokenType.COMMA);
            }
            context.consume(TokenType.RIGHT_BRACE, "end of MAP_COLUMNS block");
        }
        return new LoadNode(keyword, path, alias, columns, hasColumnMap);
    }
}
