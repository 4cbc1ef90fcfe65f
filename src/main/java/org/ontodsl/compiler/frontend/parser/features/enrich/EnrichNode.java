package org.ontodsl.compiler.frontend.parser.features.enrich;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ast.AstNode;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.List;

/**
 * An AST node for
 * {@code ENRICH <source> WITH <factorTable> MATCH ON <key> OUTPUT <target> AS { field: expr, ... }}.
 * <p>
 * The factor table is an external reference table. It need not be registered; its rows are
 * addressed in output expressions through {@link #factorAlias()} or the table name itself.
 *
 * @param keyword The ENRICH token.
 * @param source The alias being enriched.
 * @param factorTable The factor table, IDENTIFIER or STRING.
 * @param matchKey The field both sides are joined on.
 * @param target The alias introduced for the enriched nodes.
 * @param outputs The output fields in source order.
 */
public record EnrichNode(
        Token keyword,
        Token source,
        Token factorTable,
        Token matchKey,
        Token target,
        List<OutputField> outputs
) implements StatementNode {

    private static final String TABLE_SUFFIX = "_table";

    public EnrichNode {
        outputs = List.copyOf(outputs);
    }

    /**
     * @return The factor table name without quotes.
     */
    public String factorTableName() {
        return factorTable.type() == TokenType.STRING ? (String) factorTable.value() : factorTable.text();
    }

    /**
     * @return The implicit alias of a factor row: the table name minus a trailing {@code _table}.
     */
    public String factorAlias() {
        String table = factorTableName();
        if (table.endsWith(TABLE_SUFFIX) && table.length() > TABLE_SUFFIX.length()) {
            return table.substring(0, table.length() - TABLE_SUFFIX.length());
        }
        return table;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ENRICH;
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
        return outputs.stream().<AstNode>map(OutputField::expression).toList();
    }
}
