package org.ontodsl.compiler.frontend.parser.features.aggregate;

import org.ontodsl.compiler.frontend.lexer.TokenType;

/**
 * The aggregation functions available in an AGGREGATE statement.
 */
public enum AggregationFunction {
    /** {@code AGG_SUM(field)} */
    SUM(TokenType.AGG_SUM, true),
    /** {@code TAKE_FIRST(field)} */
    FIRST(TokenType.TAKE_FIRST, true),
    /** {@code AGG_COUNT([field])} */
    COUNT(TokenType.AGG_COUNT, false);

    private final TokenType keyword;
    private final boolean fieldRequired;

    AggregationFunction(TokenType keyword, boolean fieldRequired) {
        this.keyword = keyword;
        this.fieldRequired = fieldRequired;
    }

    public TokenType keyword() {
        return keyword;
    }

    public boolean isFieldRequired() {
        return fieldRequired;
    }

    /**
     * @param type A token type.
     * @return The function introduced by that keyword, or {@code null}.
     */
    public static AggregationFunction forKeyword(TokenType type) {
        for (AggregationFunction function : values()) {
            if (function.keyword == type) return function;
        }
        return null;
    }
}
