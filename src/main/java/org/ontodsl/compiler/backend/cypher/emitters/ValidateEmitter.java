package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateNode;

import java.util.List;

/**
 * Emits a placeholder that returns the nodes a rule applies to. No rule is enforced.
 */
public class ValidateEmitter implements IStatementEmitter<ValidateNode> {

	@Override
	public void emit(ValidateNode node, EmissionContext ctx) {
		ctx.emit(node, List.of(
				"// rule: " + CypherText.commentText(node.ruleValue()) + " (no enforcement generated)",
				"MATCH (n:" + CypherText.name(node.target().text()) + ")",
				"RETURN n;"));
	}
}
