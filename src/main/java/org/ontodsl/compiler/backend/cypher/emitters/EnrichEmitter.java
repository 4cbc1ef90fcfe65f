package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.ExpressionRenderer;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.OutputField;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the cross match of source nodes and factor rows on the match key, one created node per
 * matching pair, and a relationship from each created node back to its source node.
 */
public class EnrichEmitter implements IStatementEmitter<EnrichNode> {

	private static final String SOURCE_VARIABLE = "a";
	private static final String FACTOR_VARIABLE = "ef";

	@Override
	public void emit(EnrichNode node, EmissionContext ctx) {
		if (node.outputs().isEmpty()) {
			throw new InternalCompilerError("ENRICH at " + node.sourceInfo() + " has an empty output block.");
		}
		ExpressionRenderer renderer = new ExpressionRenderer(node, SOURCE_VARIABLE, FACTOR_VARIABLE);
		String key = CypherText.name(node.matchKey().text());

		List<String> entries = new ArrayList<>();
		for (OutputField output : node.outputs()) {
			entries.add(CypherText.entry(output.name().text(), renderer.render(output.expression())));
		}

		List<String> lines = new ArrayList<>();
		lines.add("MATCH (" + SOURCE_VARIABLE + ":" + CypherText.name(node.source().text()) + "), ("
				+ FACTOR_VARIABLE + ":" + CypherText.name(node.factorTableName()) + ")");
		lines.add("WHERE " + SOURCE_VARIABLE + "." + key + " = " + FACTOR_VARIABLE + "." + key);
		lines.add("CREATE (e:" + CypherText.name(node.target().text()) + " " + CypherText.propertyMap(entries) + ")");
		lines.add("MERGE (e)-[:" + ctx.options().sourceRelationshipPrefix()
				+ CypherText.relationshipSuffix(node.source().text()) + "]->(" + SOURCE_VARIABLE + ");");
		ctx.emit(node, lines);
	}
}
