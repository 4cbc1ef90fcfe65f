package org.ontodsl.compiler.backend.cypher;

import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

/**
 * Emits the Cypher block of a specific statement type.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link EmissionContext}.
 *
 * @param <T> The concrete statement type handled by this emitter.
 */
public interface IStatementEmitter<T extends StatementNode> {

	/**
	 * Emits the Cypher for the given statement.
	 *
	 * @param node The statement to emit.
	 * @param ctx  The emission context collecting the query blocks.
	 */
	void emit(T node, EmissionContext ctx);
}
