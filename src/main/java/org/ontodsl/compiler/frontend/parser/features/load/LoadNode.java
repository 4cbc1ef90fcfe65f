package org.ontodsl.compiler.frontend.parser.features.load;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.List;

/**
 * An AST node for {@code LOAD_CSV "<path>" AS <alias> [MAP_COLUMNS { src -> dst, ... }]}.
 *
 * @param keyword The LOAD_CSV token.
 * @param path The STRING token holding the CSV path.
 * @param alias The alias introduced by this statement.
 * @param columns The column mappings in source order; empty without MAP_COLUMNS.
 * @param hasColumnMap Whether a MAP_COLUMNS block was written, even an empty one.
 */
public record LoadNode(
        Token keyword,
        Token path,
        Token alias,
        List<ColumnMapping> columns,
        boolean hasColumnMap
) implements StatementNode {

    public LoadNode {
        columns = List.copyOf(columns);
    }

    /**
     * @return The unescaped CSV path.
     */
    public String pathValue() {
        return (String) path.value();
    }

    @Override
    public StatementKind kind() {
        return StatementKind.LOAD_CSV;
    }

    @Override
    public String subjectAlias() {
        return alias.text();
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
