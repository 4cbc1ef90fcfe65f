package org.ontodsl.compiler.frontend.parser.features.validate;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

/**
 * An AST node for {@code VALIDATE <alias> WITH "<rule>"}. The rule name is an opaque label.
 *
 * @param keyword The VALIDATE token.
 * @param target The validated alias.
 * @param ruleName The STRING token naming the rule.
 */
public record ValidateNode(Token keyword, Token target, Token ruleName) implements StatementNode {

    /**
     * @return The unescaped rule name.
     */
    public String ruleValue() {
        return (String) ruleName.value();
    }

    @Override
    public StatementKind kind() {
        return StatementKind.VALIDATE;
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
