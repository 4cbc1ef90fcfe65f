package org.ontodsl.compiler.frontend.semantics;

import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.Set;

/**
 * Represents a single alias in the {@link AliasRegistry}: a graph node label introduced by a
 * statement, together with the fields known to exist on its nodes.
 *
 * @param name The token that introduced the alias.
 * @param kind The kind of the introducing statement.
 * @param node The introducing statement.
 * @param openSchema True if the field set may grow (LOAD_CSV without MAP_COLUMNS).
 * @param knownFields The known field names in first-seen order.
 */
public record AliasEntry(
        Token name,
        StatementKind kind,
        StatementNode node,
        boolean openSchema,
        Set<String> knownFields
) {

    /**
     * @param field A field name.
     * @return True if the field is among the known fields.
     */
    public boolean hasField(String field) {
        return knownFields.contains(field);
    }
}
