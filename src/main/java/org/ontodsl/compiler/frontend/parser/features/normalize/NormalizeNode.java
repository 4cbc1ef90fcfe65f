package org.ontodsl.compiler.frontend.parser.features.normalize;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.List;

/**
 * An AST node for {@code NORMALIZE <alias> { field: { old: new, ... }, ... }}.
 *
 * @param keyword The NORMALIZE token.
 * @param target The alias whose nodes are rewritten.
 * @param fields The per-field rewrites in source order.
 */
public record NormalizeNode(
        Token keyword,
        Token target,
        List<FieldNormalization> fields
) implements StatementNode {

    public NormalizeNode {
        fields = List.copyOf(fields);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.NORMALIZE;
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
