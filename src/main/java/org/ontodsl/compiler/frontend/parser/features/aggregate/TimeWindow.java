package org.ontodsl.compiler.frontend.parser.features.aggregate;

import org.ontodsl.compiler.frontend.lexer.Token;

/**
 * {@code TIME_WINDOW <mode> FROM <field> INTO <alias>}: truncates a timestamp field to a
 * coarser granularity and uses the result as an extra grouping key.
 *
 * @param mode The granularity, e.g. {@code monthly}.
 * @param sourceField The timestamp field of the source nodes.
 * @param targetField The field name of the truncated value.
 */
public record TimeWindow(Token mode, Token sourceField, Token targetField) {
}
