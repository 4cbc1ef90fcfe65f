package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.parser.features.comment.CommentNode;

/**
 * Comments produce no Cypher.
 */
public class CommentEmitter implements IStatementEmitter<CommentNode> {

	@Override
	public void emit(CommentNode node, EmissionContext ctx) {
		// nothing to emit
	}
}
