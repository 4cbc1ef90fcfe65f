package org.ontodsl.compiler.frontend.parser.features.unitconvert;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

/**
 * An AST node for {@code UNIT_CONVERT <alias>.<field> FROM <unit> TO <unit> USING "<table>"}.
 * <p>
 * A FROM unit written as a bare identifier names the field that holds each node's current
 * unit; a string is a fixed unit. The TO unit is always taken literally.
 *
 * @param keyword The UNIT_CONVERT token.
 * @param target The alias whose nodes are converted.
 * @param field The converted field.
 * @param from The source unit, STRING or IDENTIFIER.
 * @param to The target unit, STRING or IDENTIFIER.
 * @param table The STRING token with the conversion table path.
 */
public record UnitConvertNode(
        Token keyword,
        Token target,
        Token field,
        Token from,
        Token to,
        Token table
) implements StatementNode {

    /**
     * @return True if FROM names a unit field rather than a fixed unit.
     */
    public boolean isFromField() {
        return from.type() == TokenType.IDENTIFIER;
    }

    /**
     * @return The FROM unit text, without quotes.
     */
    public String fromValue() {
        return unitText(from);
    }

    /**
     * @return The TO unit text, without quotes.
     */
    public String toValue() {
        return unitText(to);
    }

    /**
     * @return The unescaped table path.
     */
    public String tableValue() {
        return (String) table.value();
    }

    private static String unitText(Token unit) {
        return unit.type() == TokenType.STRING ? (String) unit.value() : unit.text();
    }

    @Override
    public StatementKind kind() {
        return StatementKind.UNIT_CONVERT;
    }

    @Override
    public String subjectAlias() {
        return target.text();
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
