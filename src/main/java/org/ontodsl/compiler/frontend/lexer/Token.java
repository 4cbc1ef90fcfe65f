package org.ontodsl.compiler.frontend.lexer;

import org.ontodsl.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., a keyword, Identifier, Number).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the unescaped content of a string,
 *              the {@link java.math.BigDecimal} of a number, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the source.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @return A short human-readable description for error messages.
     */
    public String describe() {
        return switch (type.category()) {
            case IDENTIFIER, STRING, NUMBER -> type.displayName() + " '" + text + "'";
            default -> type.displayName();
        };
    }
}
