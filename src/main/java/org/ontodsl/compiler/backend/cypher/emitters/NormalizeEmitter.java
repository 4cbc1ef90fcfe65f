package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.parser.features.normalize.FieldNormalization;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeNode;
import org.ontodsl.compiler.frontend.parser.features.normalize.ValueMapping;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits one match-and-set statement per (field, old value) pair.
 */
public class NormalizeEmitter implements IStatementEmitter<NormalizeNode> {

	@Override
	public void emit(NormalizeNode node, EmissionContext ctx) {
		if (node.fields().isEmpty()) {
			throw new InternalCompilerError("NORMALIZE at " + node.sourceInfo() + " has no fields.");
		}
		String label = CypherText.name(node.target().text());
		List<String> lines = new ArrayList<>();
		for (FieldNormalization field : node.fields()) {
			String property = "n." + CypherText.name(field.field().text());
			for (ValueMapping mapping : field.mappings()) {
				lines.add("MATCH (n:" + label + ")");
				lines.add("WHERE " + property + " = " + CypherText.quote(mapping.fromValue()));
				lines.add("SET " + property + " = " + CypherText.quote(mapping.toValue()) + ";");
			}
		}
		ctx.emit(node, lines);
	}
}
