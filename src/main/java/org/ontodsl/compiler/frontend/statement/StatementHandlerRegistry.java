package org.ontodsl.compiler.frontend.statement;

import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateStatementHandler;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeStatementHandler;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichStatementHandler;
import org.ontodsl.compiler.frontend.parser.features.load.LoadStatementHandler;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeStatementHandler;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertStatementHandler;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of statement keywords
 * to their corresponding handlers.
 */
public class StatementHandlerRegistry {
    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new statement handler.
     * @param keyword The leading keyword of the statement (e.g., {@link TokenType#LOAD_CSV}).
     * @param handler The handler for the statement.
     */
    public void register(TokenType keyword, IStatementHandler handler) {
        if (!keyword.isKeyword()) {
            throw new IllegalArgumentException("Statements must start with a keyword: " + keyword);
        }
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword token type.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all built-in statement handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenType.LOAD_CSV, new LoadStatementHandler());
        registry.register(TokenType.NORMALIZE, new NormalizeStatementHandler());
        registry.register(TokenType.AGGREGATE, new AggregateStatementHandler());
        registry.register(TokenType.UNIT_CONVERT, new UnitConvertStatementHandler());
        registry.register(TokenType.ENRICH, new EnrichStatementHandler());
        registry.register(TokenType.COMPUTE, new ComputeStatementHandler());
        registry.register(TokenType.VALIDATE, new ValidateStatementHandler());
        return registry;
    }
}
