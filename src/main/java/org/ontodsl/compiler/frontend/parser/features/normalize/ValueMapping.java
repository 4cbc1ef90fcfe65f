package org.ontodsl.compiler.frontend.parser.features.normalize;

import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;

/**
 * One {@code old : new} pair. Both sides are STRING or IDENTIFIER tokens.
 *
 * @param from The value to replace.
 * @param to The replacement value.
 */
public record ValueMapping(Token from, Token to) {

    /**
     * @return The literal value of {@link #from()}.
     */
    public String fromValue() {
        return valueOf(from);
    }

    /**
     * @return The literal value of {@link #to()}.
     */
    public String toValue() {
        return valueOf(to);
    }

    static String valueOf(Token token) {
        return token.type() == TokenType.STRING ? (String) token.value() : token.text();
    }
}
