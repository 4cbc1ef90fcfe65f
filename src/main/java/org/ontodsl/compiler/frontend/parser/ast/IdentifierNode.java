package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.frontend.lexer.Token;

/**
 * A field reference, either bare ({@code value}) or qualified by an alias ({@code activity.value}).
 *
 * @param qualifier The alias token before the dot, or {@code null} for a bare identifier.
 * @param name The field name token.
 */
public record IdentifierNode(Token qualifier, Token name) implements ExpressionNode {

    /**
     * @return True if the identifier is written as {@code alias.field}.
     */
    public boolean isQualified() {
        return qualifier != null;
    }

    /**
     * @return The identifier as written, e.g. {@code activity.value}.
     */
    public String qualifiedName() {
        return isQualified() ? qualifier.text() + "." + name.text() : name.text();
    }

    @Override
    public ValueShape shape() {
        return ValueShape.UNKNOWN;
    }

    @Override
    public SourceInfo sourceInfo() {
        return isQualified() ? qualifier.sourceInfo() : name.sourceInfo();
    }
}
