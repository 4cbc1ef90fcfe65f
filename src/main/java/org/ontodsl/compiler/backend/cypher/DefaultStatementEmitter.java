package org.ontodsl.compiler.backend.cypher;

import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

/**
 * Fallback emitter for statement types without a registered emitter. The statement set is
 * closed, so reaching this emitter means the AST was built outside the parser.
 */
public final class DefaultStatementEmitter implements IStatementEmitter<StatementNode> {

	@Override
	public void emit(StatementNode node, EmissionContext ctx) {
		throw new InternalCompilerError("No Cypher emitter registered for " + node.getClass().getSimpleName()
				+ " at " + node.sourceInfo() + ".");
	}
}
