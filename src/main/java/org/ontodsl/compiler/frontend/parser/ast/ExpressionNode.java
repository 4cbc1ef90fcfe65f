package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;

/**
 * An expression in an ENRICH output block or a COMPUTE clause.
 */
public interface ExpressionNode extends AstNode {

    /**
     * @return The structural value shape of this expression.
     */
    ValueShape shape();

    /**
     * @return The position of the first token of this expression.
     */
    SourceInfo sourceInfo();

    /**
     * @return The operator nesting depth; 0 for atoms.
     */
    default int depth() {
        return 0;
    }
}
