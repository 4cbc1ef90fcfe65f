package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Emits a grouped aggregation over the source nodes and merges one result node per group.
 */
public class ComputeEmitter implements IStatementEmitter<ComputeNode> {

	@Override
	public void emit(ComputeNode node, EmissionContext ctx) {
		if (node.groupKeys().isEmpty()) {
			throw new InternalCompilerError("COMPUTE at " + node.sourceInfo() + " has no group keys.");
		}
		String result = CypherText.name(node.resultName().text());

		List<String> projections = new ArrayList<>();
		List<String> keys = new ArrayList<>();
		for (Token key : node.groupKeys()) {
			String name = CypherText.name(key.text());
			projections.add("e." + name + " AS " + name);
			keys.add(name + ": " + name);
		}
		projections.add(node.function().name().text().toUpperCase(Locale.ROOT)
				+ "(e." + CypherText.name(node.function().argument().text()) + ") AS " + result);

		List<String> lines = new ArrayList<>();
		lines.add("MATCH (e:" + CypherText.name(node.source().text()) + ")");
		lines.add("WITH " + String.join(", ", projections));
		lines.add("MERGE (g:" + CypherText.name(node.target().text()) + " { " + String.join(", ", keys) + " })");
		lines.add("SET g." + result + " = " + result + ";");
		ctx.emit(node, lines);
	}
}
