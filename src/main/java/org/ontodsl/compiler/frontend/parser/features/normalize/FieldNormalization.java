package org.ontodsl.compiler.frontend.parser.features.normalize;

import org.ontodsl.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The value rewrites for one field of a NORMALIZE statement.
 *
 * @param field The field name.
 * @param mappings The rewrites in source order.
 */
public record FieldNormalization(Token field, List<ValueMapping> mappings) {

    public FieldNormalization {
        mappings = List.copyOf(mappings);
    }
}
