package org.ontodsl.compiler.frontend.parser.features.load;

import org.ontodsl.compiler.frontend.lexer.Token;

/**
 * One {@code source -> target} entry of a MAP_COLUMNS block.
 *
 * @param source The CSV header name.
 * @param target The node field the column is stored under.
 */
public record ColumnMapping(Token source, Token target) {
}
