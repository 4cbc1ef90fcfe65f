package org.ontodsl.compiler.frontend.parser.features.compute;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.AstNode;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.List;

/**
 * An AST node for
 * {@code COMPUTE <result> FOR <source> GROUP BY <keys> INTO <target> AS <func>(<field>)}.
 *
 * @param keyword The COMPUTE token.
 * @param resultName The name of the computed field.
 * @param source The alias being grouped.
 * @param groupKeys The grouping fields.
 * @param target The alias introduced for the result nodes.
 * @param function The aggregation call.
 */
public record ComputeNode(
        Token keyword,
        Token resultName,
        Token source,
        List<Token> groupKeys,
        Token target,
        FunctionCallNode function
) implements StatementNode {

    public ComputeNode {
        groupKeys = List.copyOf(groupKeys);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMPUTE;
    }

    @Override
    public String subjectAlias() {
        return source.text();
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(function);
    }
}
