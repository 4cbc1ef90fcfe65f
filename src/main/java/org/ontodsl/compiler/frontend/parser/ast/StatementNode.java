package org.ontodsl.compiler.frontend.parser.ast;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;

/**
 * A top-level DSL statement. The set of implementations is closed: one record per
 * {@link StatementKind}.
 */
public interface StatementNode extends AstNode {

    /**
     * @return The kind of this statement.
     */
    StatementKind kind();

    /**
     * @return The alias the statement primarily operates on, used in trace comments.
     */
    String subjectAlias();

    /**
     * @return The position of the statement's leading keyword.
     */
    SourceInfo sourceInfo();
}
