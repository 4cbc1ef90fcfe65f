package org.ontodsl.compiler.frontend.parser.features.aggregate;

import org.ontodsl.compiler.frontend.lexer.Token;

/**
 * One aggregation clause such as {@code AGG_SUM(amount) AS total}.
 *
 * @param function The aggregation function.
 * @param functionToken The keyword token of the function.
 * @param field The aggregated field, or {@code null} for a bare {@code AGG_COUNT()}.
 * @param alias The output field name.
 */
public record AggregationClause(
        AggregationFunction function,
        Token functionToken,
        Token field,
        Token alias
) {
}
