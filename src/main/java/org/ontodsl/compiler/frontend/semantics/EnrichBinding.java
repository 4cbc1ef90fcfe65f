package org.ontodsl.compiler.frontend.semantics;

import org.ontodsl.compiler.frontend.parser.ast.IdentifierNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;

/**
 * Decides which side of an ENRICH match an identifier in the output block refers to.
 * <p>
 * Bare identifiers and identifiers qualified by the source alias are source fields.
 * Identifiers qualified by the factor alias or by the factor table name are factor row fields.
 * Any other qualifier is outside the statement's scope.
 */
public final class EnrichBinding {

    /**
     * The match side an identifier resolves to.
     */
    public enum Side {
        /** A field of the enriched source node. */
        SOURCE,
        /** A field of the matched factor row. */
        FACTOR,
        /** A qualifier that is neither the source nor the factor table. */
        UNBOUND
    }

    private EnrichBinding() {}

    /**
     * @param enrich The ENRICH statement.
     * @param identifier An identifier from its output block.
     * @return The side the identifier refers to.
     */
    public static Side sideOf(EnrichNode enrich, IdentifierNode identifier) {
        if (!identifier.isQualified()) {
            return Side.SOURCE;
        }
        String qualifier = identifier.qualifier().text();
        if (qualifier.equals(enrich.source().text())) {
            return Side.SOURCE;
        }
        if (qualifier.equals(enrich.factorAlias()) || qualifier.equals(enrich.factorTableName())) {
            return Side.FACTOR;
        }
        return Side.UNBOUND;
    }
}
